package org.termkit.expressions;

import lombok.Getter;
import org.termkit.core.Sort;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表一个运算符或未解释函数的声明：名称、种类、结果类型与参数类型列表。
 * 种类为 {@link ExprKind#APP} 时表示用户函数 (参数为空即常量)，否则为内建运算符或字面量。
 * 此类是不可变的，结构相等；实例由 {@link ExprStore} 统一缓存。
 */
@Getter
public final class Declaration {

    private final String name;
    private final ExprKind kind;
    private final Sort range;
    private final List<Sort> domain;

    private final int hashCode;

    Declaration(String name, ExprKind kind, Sort range, List<Sort> domain) {
        this.name = Objects.requireNonNull(name, "Declaration name cannot be null");
        this.kind = Objects.requireNonNull(kind, "Declaration kind cannot be null");
        this.range = Objects.requireNonNull(range, "Declaration range cannot be null");
        this.domain = List.copyOf(Objects.requireNonNull(domain, "Declaration domain cannot be null"));
        this.hashCode = Objects.hash(name, kind, range, this.domain);
    }

    public int arity() {
        return domain.size();
    }

    /**
     * 是否是用户声明的常量 (零元未解释函数)。
     */
    public boolean isConstant() {
        return kind == ExprKind.APP && domain.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Declaration that = (Declaration) o;
        return kind == that.kind
                && name.equals(that.name)
                && range.equals(that.range)
                && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (domain.isEmpty()) {
            return name + ": " + range;
        }
        return name + ": (" + domain.stream().map(Sort::toString).collect(Collectors.joining(" ")) + ") -> " + range;
    }
}
