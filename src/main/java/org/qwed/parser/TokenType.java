package org.qwed.parser;

public enum TokenType {
    LPAREN,
    RPAREN,
    /** 带引号的字符串，text 为反转义后的内容。 */
    STRING,
    /** 其余连续的非空白字符：数字、标识符、运算符关键字或符号别名，由解析器按位置分类。 */
    WORD,
    EOF
}
