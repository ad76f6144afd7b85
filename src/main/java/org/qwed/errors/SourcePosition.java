package org.qwed.errors;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 源文本中的位置。offset 从 0 开始，line 与 column 从 1 开始。
 */
@Getter
@EqualsAndHashCode
public final class SourcePosition {

    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    private final int offset;
    private final int line;
    private final int column;

    private SourcePosition(int offset, int line, int column) {
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public static SourcePosition of(int offset, int line, int column) {
        if (offset < 0 || line < 1 || column < 1) {
            throw new IllegalArgumentException("非法位置: offset=" + offset + ", line=" + line + ", column=" + column);
        }
        return new SourcePosition(offset, line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
