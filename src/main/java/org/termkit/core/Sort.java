package org.termkit.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 代表表达式的类型 (Sort)。
 * 结构相同的两个 Sort 是同一个实例：所有实例都通过静态工厂创建并缓存。
 * 此类是不可变的。
 */
@Getter
public final class Sort {

    private static final Logger logger = LoggerFactory.getLogger(Sort.class);

    private static final ConcurrentHashMap<List<Object>, Sort> CACHE = new ConcurrentHashMap<>();

    private static final Sort BOOL = intern(SortKind.BOOL, 0, 0, null, null, null);
    private static final Sort INT = intern(SortKind.INT, 0, 0, null, null, null);
    private static final Sort REAL = intern(SortKind.REAL, 0, 0, null, null, null);
    private static final Sort ROUNDING_MODE = intern(SortKind.ROUNDING_MODE, 0, 0, null, null, null);

    private final SortKind kind;
    /** BV 的位宽，或 FP 的指数位数 */
    private final int width;
    /** FP 的有效数位数 (含隐藏位) */
    private final int significandBits;
    /** ARRAY 的下标类型 */
    private final Sort domain;
    /** ARRAY 的值类型 */
    private final Sort range;
    /** UNINTERPRETED 的名称 */
    private final String name;

    private final int hashCode;

    private Sort(SortKind kind, int width, int significandBits, Sort domain, Sort range, String name) {
        this.kind = kind;
        this.width = width;
        this.significandBits = significandBits;
        this.domain = domain;
        this.range = range;
        this.name = name;
        this.hashCode = Objects.hash(kind, width, significandBits, domain, range, name);
    }

    private static Sort intern(SortKind kind, int width, int significandBits, Sort domain, Sort range, String name) {
        List<Object> key = Arrays.asList(kind, width, significandBits, domain, range, name);
        return CACHE.computeIfAbsent(key, k -> {
            Sort sort = new Sort(kind, width, significandBits, domain, range, name);
            logger.debug("创建 Sort: {}", sort);
            return sort;
        });
    }

    public static Sort bool() {
        return BOOL;
    }

    public static Sort integer() {
        return INT;
    }

    public static Sort real() {
        return REAL;
    }

    public static Sort roundingMode() {
        return ROUNDING_MODE;
    }

    /**
     * 位宽为 width 的位向量类型。
     * @throws IllegalArgumentException 如果 width 不是正数。
     */
    public static Sort bitVec(int width) {
        if (width <= 0) {
            logger.error("位向量位宽必须为正数，实际为 {}", width);
            throw new IllegalArgumentException("位向量位宽必须为正数: " + width);
        }
        return intern(SortKind.BV, width, 0, null, null, null);
    }

    /**
     * IEEE 浮点类型。
     * @param exponentBits 指数位数。
     * @param significandBits 有效数位数 (含隐藏位)，例如 Float32 为 (8, 24)。
     */
    public static Sort floatingPoint(int exponentBits, int significandBits) {
        if (exponentBits <= 0 || significandBits <= 0) {
            logger.error("浮点类型的指数位与有效数位必须为正数: ({}, {})", exponentBits, significandBits);
            throw new IllegalArgumentException("非法的浮点类型: (" + exponentBits + ", " + significandBits + ")");
        }
        return intern(SortKind.FP, exponentBits, significandBits, null, null, null);
    }

    public static Sort array(Sort domain, Sort range) {
        Objects.requireNonNull(domain, "Array domain sort cannot be null");
        Objects.requireNonNull(range, "Array range sort cannot be null");
        return intern(SortKind.ARRAY, 0, 0, domain, range, null);
    }

    public static Sort uninterpreted(String name) {
        Objects.requireNonNull(name, "Uninterpreted sort name cannot be null");
        return intern(SortKind.UNINTERPRETED, 0, 0, null, null, name);
    }

    public boolean isBool() {
        return kind == SortKind.BOOL;
    }

    /**
     * 整数与实数统称算术类型。
     */
    public boolean isArith() {
        return kind == SortKind.INT || kind == SortKind.REAL;
    }

    public int getExponentBits() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sort that = (Sort) o;
        return kind == that.kind
                && width == that.width
                && significandBits == that.significandBits
                && Objects.equals(domain, that.domain)
                && Objects.equals(range, that.range)
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BV -> "(_ BitVec " + width + ")";
            case FP -> "(_ FloatingPoint " + width + " " + significandBits + ")";
            case ARRAY -> "(Array " + domain + " " + range + ")";
            case UNINTERPRETED -> name;
            default -> kind.getSymbol();
        };
    }
}
