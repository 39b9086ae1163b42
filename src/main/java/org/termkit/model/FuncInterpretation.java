package org.termkit.model;

import lombok.Getter;
import org.termkit.core.Sort;
import org.termkit.expressions.Declaration;
import org.termkit.expressions.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 函数在模型中的解释：有序的 (参数模式, 值) 条目表，加上可选的默认值。
 * 条目与默认值中可以出现形式参数 {@link #getVars()} 的零元应用，求值时被实际参数替换。
 * 靠前的条目优先匹配。此类是不可变的。
 */
@Getter
public final class FuncInterpretation {

    private static final Logger logger = LoggerFactory.getLogger(FuncInterpretation.class);

    private final Declaration decl;
    private final List<Declaration> vars;
    private final List<Entry> entries;
    /** 默认值，可能为 null */
    private final Expr defaultValue;
    private final Sort sort;

    /**
     * @param decl 被解释的声明。
     * @param vars 形式参数，个数与 decl 的参数个数一致。
     * @param entries 条目表，每个条目的参数个数等于 vars 的个数。
     * @param defaultValue 默认值，可以为 null。
     * @throws IllegalArgumentException 如果个数或类型不一致。
     */
    public FuncInterpretation(Declaration decl, List<Declaration> vars, List<Entry> entries, Expr defaultValue) {
        this.decl = Objects.requireNonNull(decl, "Interpreted declaration cannot be null");
        this.vars = List.copyOf(Objects.requireNonNull(vars, "Formal parameter list cannot be null"));
        this.entries = List.copyOf(Objects.requireNonNull(entries, "Entry list cannot be null"));
        this.defaultValue = defaultValue;
        this.sort = decl.getRange();

        if (this.vars.size() != decl.arity()) {
            logger.error("解释 {} 的形式参数个数 {} 与声明的参数个数 {} 不一致", decl.getName(), this.vars.size(), decl.arity());
            throw new IllegalArgumentException("Interpretation of " + decl.getName() + " expects "
                    + decl.arity() + " formal parameters but got " + this.vars.size());
        }
        for (Entry entry : this.entries) {
            if (entry.getArgs().size() != this.vars.size()) {
                logger.error("解释 {} 的条目 {} 参数个数不正确", decl.getName(), entry);
                throw new IllegalArgumentException("Entry " + entry + " has " + entry.getArgs().size()
                        + " arguments, expected " + this.vars.size());
            }
            checkSort(entry.getValue());
        }
        if (defaultValue != null) {
            checkSort(defaultValue);
        }
        logger.debug("创建 FuncInterpretation: {}", this);
    }

    /**
     * 常量的解释：没有参数，也没有条目，只有默认值。
     */
    public static FuncInterpretation constant(Declaration decl, Expr value) {
        return new FuncInterpretation(decl, List.of(), List.of(), Objects.requireNonNull(value, "Constant value cannot be null"));
    }

    private void checkSort(Expr value) {
        if (!value.getSort().equals(sort)) {
            logger.error("解释 {} 的值 {} 类型应为 {}", decl.getName(), value, sort);
            throw new IllegalArgumentException("Value " + value + " of interpretation " + decl.getName()
                    + " must have sort " + sort + " but has " + value.getSort());
        }
    }

    @Override
    public String toString() {
        String table = entries.stream().map(Entry::toString).collect(Collectors.joining(", "));
        return decl.getName() + vars.stream().map(Declaration::getName).collect(Collectors.joining(", ", "(", ")"))
                + " = {" + table + (entries.isEmpty() ? "" : ", ") + "else -> " + defaultValue + "}";
    }

    /**
     * 一个条目：参数模式逐位与实际参数相等时，函数取值 value。
     */
    @Getter
    public static final class Entry {

        private final List<Expr> args;
        private final Expr value;

        public Entry(List<Expr> args, Expr value) {
            this.args = List.copyOf(Objects.requireNonNull(args, "Entry arguments cannot be null"));
            this.value = Objects.requireNonNull(value, "Entry value cannot be null");
        }

        @Override
        public String toString() {
            return args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")")) + " -> " + value;
        }
    }
}
