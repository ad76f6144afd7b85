package org.qwed.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数 n/d，分母恒为正且已约分。
 * 用于算术引擎的确定性求值，以及 Z3 数值字面量与模型取值的互相转换。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(Rational.class);

    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE);
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator cannot be null");
        Objects.requireNonNull(denominator, "denominator cannot be null");
        if (denominator.signum() == 0) {
            logger.error("Rational.valueOf: 分母为零 ({} / 0)", numerator);
            throw new ArithmeticException("分母不能为零: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    public static Rational valueOf(BigDecimal value) {
        Objects.requireNonNull(value, "value cannot be null");
        int scale = value.scale();
        if (scale <= 0) {
            return valueOf(value.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)), BIG_INT_ONE);
        }
        return valueOf(value.unscaledValue(), BIG_INT_TEN.pow(scale));
    }

    /**
     * 解析 "n/d"、整数或十进制小数形式的字符串。
     * @param s 输入字符串。
     * @return Rational 实例。
     * @throws NumberFormatException 格式非法时抛出。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim();
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            BigInteger num = new BigInteger(parts[0].trim());
            BigInteger den = new BigInteger(parts[1].trim());
            if (den.signum() == 0) {
                throw new NumberFormatException("分数" + s + "的分母为零");
            }
            return valueOf(num, den);
        }
        try {
            return valueOf(new BigDecimal(s));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    /**
     * 从 Z3 模型中的数值常量构造 Rational。
     * @param ratNum Z3 有理数常量。
     * @return Rational 实例。
     */
    public static Rational fromZ3(RatNum ratNum) {
        return valueOf(ratNum.getBigIntNumerator(), ratNum.getBigIntDenominator());
    }

    public static Rational fromZ3(IntNum intNum) {
        return valueOf(intNum.getBigInteger(), BIG_INT_ONE);
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this == ZERO) {
            return other;
        }
        if (other == ZERO) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * 精确除法。
     * @throws ArithmeticException 除数为零时抛出。
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("Rational.divide: 尝试计算 {} / 0", this);
            throw new ArithmeticException("除数为零: " + this + " / 0");
        }
        if (other == ONE) {
            return this;
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    /**
     * SMT-LIB 整数除法：a = b*q + r 且 0 <= r < |b|。
     * 仅对整数有效。
     */
    public Rational integerDivide(Rational other) {
        BigInteger[] qr = euclidean(other);
        return valueOf(qr[0], BIG_INT_ONE);
    }

    /**
     * SMT-LIB 取模：结果落在 [0, |b|) 内。
     * 仅对整数有效。
     */
    public Rational mod(Rational other) {
        BigInteger[] qr = euclidean(other);
        return valueOf(qr[1], BIG_INT_ONE);
    }

    private BigInteger[] euclidean(Rational other) {
        if (!this.isInteger() || !other.isInteger()) {
            logger.error("Rational.euclidean: 非整数参与整数除法: {} , {}", this, other);
            throw new ArithmeticException("整数除法要求整数操作数: " + this + ", " + other);
        }
        if (other.isZero()) {
            logger.error("Rational.euclidean: 尝试计算 {} div 0", this);
            throw new ArithmeticException("除数为零: " + this + " div 0");
        }
        BigInteger a = this.numerator;
        BigInteger b = other.numerator;
        BigInteger r = a.mod(b.abs());
        BigInteger q = a.subtract(r).divide(b);
        return new BigInteger[]{q, r};
    }

    public Rational pow(int exponent) {
        if (exponent < 0) {
            throw new ArithmeticException("不支持负指数: " + exponent);
        }
        return valueOf(numerator.pow(exponent), denominator.pow(exponent));
    }

    public Rational negate() {
        if (this.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public Rational abs() {
        return numerator.signum() >= 0 ? this : this.negate();
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    /**
     * 转换为 long 值，要求是 long 范围内的整数。
     * @throws ArithmeticException 非整数或越界时抛出。
     */
    public long longValueExact() {
        if (!isInteger()) {
            throw new ArithmeticException("Rational不是整数: " + this);
        }
        return numerator.longValueExact();
    }

    /**
     * 以十进制形式表示，有限小数精确输出，否则保留 scale 位。
     */
    public String toDecimalString(int scale) {
        if (isInteger()) {
            return numerator.toString();
        }
        BigDecimal num = new BigDecimal(numerator);
        BigDecimal den = new BigDecimal(denominator);
        try {
            return num.divide(den).stripTrailingZeros().toPlainString();
        } catch (ArithmeticException e) {
            // 无限循环小数
            return num.divide(den, scale, RoundingMode.HALF_EVEN).toPlainString();
        }
    }

    public ArithExpr toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    public ArithExpr toZ3Int(Context ctx) {
        if (!isInteger()) {
            logger.error("非法调用Rational.toZ3Int: {} 不是整数", this);
            throw new IllegalArgumentException("非法调用Rational.toZ3Int: " + this + " 不是整数");
        }
        return ctx.mkInt(numerator.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    private static boolean shouldCache(Rational r) {
        return (r.numerator.abs().bitLength() + r.denominator.bitLength()) < 32;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
