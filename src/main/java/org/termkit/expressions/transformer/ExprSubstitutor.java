package org.termkit.expressions.transformer;

import org.termkit.expressions.Expr;
import org.termkit.expressions.ExprStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 把表达式图中出现的指定节点替换为给定节点。
 * 替换在子节点改写之后进行，因此也作用于重建出的父节点。
 */
public class ExprSubstitutor extends NonRecursiveTransformer {

    private static final Logger logger = LoggerFactory.getLogger(ExprSubstitutor.class);

    private final Map<Expr, Expr> substitution = new HashMap<>();

    public ExprSubstitutor(ExprStore store) {
        super(store);
    }

    /**
     * 登记一条替换 from -> to。
     * @throws IllegalArgumentException 如果两者类型不同。
     */
    public ExprSubstitutor substitute(Expr from, Expr to) {
        Objects.requireNonNull(from, "Substituted expression cannot be null");
        Objects.requireNonNull(to, "Substitute cannot be null");
        if (!from.getSort().equals(to.getSort())) {
            logger.error("替换的类型不一致: {} : {} -> {} : {}", from, from.getSort(), to, to.getSort());
            throw new IllegalArgumentException("Sort mismatch in substitution: " + from.getSort() + " -> " + to.getSort());
        }
        substitution.put(from, to);
        logger.debug("登记替换: {} -> {}", from, to);
        return this;
    }

    public boolean isEmpty() {
        return substitution.isEmpty();
    }

    @Override
    protected Expr transformExpr(Expr expr) {
        return substitution.getOrDefault(expr, expr);
    }
}
