package org.termkit.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，实数字面量 (REAL_NUM) 的载荷。
 * 始终保持约分后的规范形式 (分母为正，gcd(分子, 分母) = 1)，因此结构相等即数值相等。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE); // 0/1
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);      // 1/1

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

    /**
     * 私有构造函数，调用者保证参数已规范化。
     */
    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
        logger.debug("创建了一个Rational: {} / {}", numerator, denominator);
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

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

    /**
     * 通用工厂方法：约分并规范化符号。
     * @throws ArithmeticException 如果分母为 0。
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为0的Rational: {} / {}", numerator, denominator);
            throw new ArithmeticException("Rational 分母不能为 0: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        if (numerator.equals(denominator)) {
            return ONE;
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            logger.debug("从缓存命中: {}/{}", numerator, denominator);
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    // ========== 基础运算 ==========
    public Rational add(Rational other) {
        logger.debug("计算了{} + {}", this, other);
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = this.numerator.multiply(other.denominator).add(other.numerator.multiply(this.denominator));
        return valueOf(newNum, this.denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        logger.debug("计算了{} - {}", this, other);
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        logger.debug("计算了{} * {}", this, other);
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(this.numerator.multiply(other.numerator), this.denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException 如果除数为 0。
     */
    public Rational divide(Rational other) {
        logger.debug("计算了{} / {}", this, other);
        if (other.isZero()) {
            logger.error("Rational 除以零: {} / 0", this);
            throw new ArithmeticException("Rational 除以零: " + this);
        }
        if (other == ONE) {
            return this;
        }
        return valueOf(this.numerator.multiply(other.denominator), this.denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (this.isZero()) {
            return ZERO;
        }
        return valueOf(this.numerator.negate(), this.denominator);
    }

    /**
     * 向负无穷取整。
     */
    public BigInteger floor() {
        BigInteger[] qr = this.numerator.divideAndRemainder(this.denominator);
        if (qr[1].signum() < 0) {
            return qr[0].subtract(BIG_INT_ONE);
        }
        return qr[0];
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return this == ZERO;
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return this.denominator.equals(BIG_INT_ONE);
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
            h = 31 * numerator.hashCode() + denominator.hashCode();
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

    /**
     * 只缓存位数较小的值，避免缓存无限增长。
     */
    private static boolean shouldCache(Rational r) {
        return (r.numerator.abs().bitLength() + r.denominator.bitLength()) < 64;
    }

    @Override
    public String toString() {
        if (this.denominator.equals(BIG_INT_ONE)) {
            return this.numerator.toString();
        }
        return this.numerator + "/" + this.denominator;
    }
}
