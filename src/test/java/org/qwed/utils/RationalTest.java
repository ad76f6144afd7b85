package org.qwed.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Nested
    @DisplayName("构造与规范化")
    class ConstructionTests {

        @Test
        @DisplayName("分数应约分，符号归到分子上")
        void testValueOf_ShouldNormalize() {
            Rational r = Rational.valueOf(6, -8);

            assertAll("6/-8 => -3/4",
                    () -> assertEquals(Rational.valueOf(-3, 4), r),
                    () -> assertEquals("-3/4", r.toString()),
                    () -> assertFalse(r.isInteger())
            );
        }

        @Test
        @DisplayName("十进制小数应精确转换为分数")
        void testValueOf_FromDecimal() {
            assertAll(
                    () -> assertEquals(Rational.valueOf(1, 10), Rational.valueOf(new BigDecimal("0.1"))),
                    () -> assertEquals(Rational.valueOf(5, 2), Rational.valueOf("2.5")),
                    () -> assertEquals(Rational.valueOf(7, 3), Rational.valueOf("14/6"))
            );
        }

        @Test
        @DisplayName("非法字符串与零分母应抛出 NumberFormatException")
        void testValueOf_InvalidString() {
            assertAll(
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("1/0")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("abc")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf(" "))
            );
        }
    }

    @Nested
    @DisplayName("整数除法与取模 (SMT-LIB 语义)")
    class EuclideanTests {

        @Test
        @DisplayName("负被除数：-7 div 2 = -4，-7 mod 2 = 1")
        void testNegativeDividend() {
            Rational a = Rational.valueOf(-7);
            Rational b = Rational.valueOf(2);

            assertAll(
                    () -> assertEquals(Rational.valueOf(-4), a.integerDivide(b)),
                    () -> assertEquals(Rational.valueOf(1), a.mod(b))
            );
        }

        @Test
        @DisplayName("负除数：7 div -2 = -3，7 mod -2 = 1")
        void testNegativeDivisor() {
            Rational a = Rational.valueOf(7);
            Rational b = Rational.valueOf(-2);

            assertAll(
                    () -> assertEquals(Rational.valueOf(-3), a.integerDivide(b)),
                    () -> assertEquals(Rational.valueOf(1), a.mod(b))
            );
        }

        @Test
        @DisplayName("除数为零或操作数非整数时抛出 ArithmeticException")
        void testInvalidOperands() {
            assertAll(
                    () -> assertThrows(ArithmeticException.class, () -> Rational.ONE.integerDivide(Rational.ZERO)),
                    () -> assertThrows(ArithmeticException.class, () -> Rational.ONE.divide(Rational.ZERO)),
                    () -> assertThrows(ArithmeticException.class,
                            () -> Rational.valueOf(1, 2).mod(Rational.valueOf(2)))
            );
        }
    }

    @Test
    @DisplayName("十进制输出：有限小数精确，循环小数截断到指定位数")
    void testToDecimalString() {
        assertAll(
                () -> assertEquals("30", Rational.valueOf(30).toDecimalString(12)),
                () -> assertEquals("0.25", Rational.valueOf(1, 4).toDecimalString(12)),
                () -> assertEquals("0.3333", Rational.valueOf(1, 3).toDecimalString(4))
        );
    }

    @Test
    @DisplayName("乘方与比较")
    void testPowAndCompare() {
        Rational half = Rational.valueOf(1, 2);

        assertAll(
                () -> assertEquals(Rational.valueOf(1, 8), half.pow(3)),
                () -> assertEquals(Rational.ONE, half.pow(0)),
                () -> assertTrue(half.compareTo(Rational.valueOf(2, 3)) < 0),
                () -> assertThrows(ArithmeticException.class, () -> half.pow(-1))
        );
    }
}
