package org.termkit.expressions.transformer;

import org.apache.commons.lang3.tuple.Pair;
import org.termkit.expressions.Expr;
import org.termkit.expressions.ExprShape;
import org.termkit.expressions.ExprStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 非递归的表达式变换框架。
 * <p>
 * 用显式工作栈代替调用栈：弹出一个节点并调用其改写规则；规则若发现依赖尚未改写，
 * 就返回 {@link RewriteStep#deferred}，引擎把节点本身重新压栈，再把缺失的依赖压在其上，
 * 从而保证依赖先于节点完成。规则返回 {@link RewriteStep#ready} 时结果被缓存。
 * 共享的子表达式只会被最终改写一次，无论有多少个父节点引用它。
 * <p>
 * 工作项是 (节点, 绑定作用域) 对。绑定形态的体在 {@link #enterBinder} 给出的作用域中改写；
 * 默认不开新作用域，所有节点都在根作用域中改写。需要区分绑定变量的子类覆盖该方法，
 * 同一节点在不同作用域中会各改写一次。
 * <p>
 * 缓存与工作栈只在一次 {@link #apply} 调用内有效。实例不是线程安全的，并发使用时每个线程各建一个实例。
 */
public abstract class NonRecursiveTransformer {

    private static final Logger logger = LoggerFactory.getLogger(NonRecursiveTransformer.class);

    protected final ExprStore store;

    private final BindingScope rootScope = BindingScope.root();
    private final Map<Pair<Expr, BindingScope>, Expr> transformed = new HashMap<>();
    private final Deque<Pair<Expr, BindingScope>> exprStack = new ArrayDeque<>();

    private BindingScope currentScope;
    private BindingScope dependencyScope;

    protected NonRecursiveTransformer(ExprStore store) {
        this.store = Objects.requireNonNull(store, "ExprStore cannot be null");
    }

    /**
     * 对以 root 为根的整个表达式图应用变换。
     * @param root 根表达式。
     * @return 变换结果，类型与 root 相同。
     * @throws IllegalStateException 如果工作栈清空后根节点仍没有结果，或结果类型改变。
     */
    public Expr apply(Expr root) {
        Objects.requireNonNull(root, "Root expression cannot be null");
        transformed.clear();
        exprStack.clear();
        Pair<Expr, BindingScope> rootItem = Pair.of(root, rootScope);
        exprStack.push(rootItem);
        while (!exprStack.isEmpty()) {
            Pair<Expr, BindingScope> item = exprStack.pop();
            if (transformed.containsKey(item)) {
                // 被多个父节点压栈的共享节点，已经改写过
                continue;
            }
            Expr expr = item.getLeft();
            currentScope = item.getRight();
            dependencyScope = isBinder(expr) ? enterBinder(currentScope, expr) : currentScope;
            RewriteStep step = rewrite(expr);
            if (step.isReady()) {
                transformed.put(item, step.getResult());
                continue;
            }
            List<Expr> missing = step.getMissingDependencies();
            if (missing.isEmpty()) {
                logger.error("节点 {} 被推迟，但没有给出缺失的依赖", expr);
                throw new IllegalStateException("Deferred rewrite without missing dependencies: " + expr);
            }
            logger.debug("推迟节点 #{}，等待 {} 个依赖", expr.getId(), missing.size());
            exprStack.push(item);
            for (Expr dependency : missing) {
                exprStack.push(Pair.of(dependency, dependencyScope));
            }
        }
        currentScope = null;
        dependencyScope = null;
        Expr result = transformed.get(rootItem);
        if (result == null) {
            logger.error("表达式没有被正确变换: {}", root);
            throw new IllegalStateException("Expression was not properly transformed: " + root);
        }
        if (!result.getSort().equals(root.getSort())) {
            logger.error("变换改变了表达式的类型: {} -> {}", root.getSort(), result.getSort());
            throw new IllegalStateException("Transformation changed sort from " + root.getSort() + " to " + result.getSort());
        }
        return result;
    }

    private static boolean isBinder(Expr expr) {
        return expr.getShape() == ExprShape.QUANTIFIER || expr.getShape() == ExprShape.ARRAY_LAMBDA;
    }

    /**
     * 绑定形态 binder 的体所在的作用域。默认与外层相同。
     */
    protected BindingScope enterBinder(BindingScope outer, Expr binder) {
        return outer;
    }

    /**
     * 正在改写的节点所在的作用域。
     */
    protected final BindingScope currentScope() {
        return currentScope;
    }

    /**
     * 整个实例共用的根作用域。
     */
    protected final BindingScope rootScope() {
        return rootScope;
    }

    /**
     * 当前 apply 中依赖 expr 的改写结果，尚未改写时返回 null。
     * 依赖在当前节点为其打开的作用域中查找：绑定形态的体在内层作用域，其余在当前作用域。
     */
    protected final Expr transformedExpr(Expr expr) {
        return transformed.get(Pair.of(expr, dependencyScope));
    }

    /**
     * 按节点形态分派的改写规则。子类可覆盖以提供按种类的规则。
     */
    protected RewriteStep rewrite(Expr expr) {
        return switch (expr.getShape()) {
            case VALUE -> RewriteStep.ready(transformExpr(expr));
            case APP -> transformApp(expr);
            case QUANTIFIER -> transformQuantifier(expr);
            case ARRAY_LAMBDA -> transformArrayLambda(expr);
        };
    }

    /**
     * 收尾步骤：依赖已就绪 (或无依赖) 的节点的最终改写。默认原样返回。
     */
    protected Expr transformExpr(Expr expr) {
        return expr;
    }

    /**
     * 函数应用依赖全部参数；参数不变时直接收尾，否则用改写后的参数重建。
     */
    protected RewriteStep transformApp(Expr expr) {
        return transformAfterDependencies(expr, expr.getArgs(), transformedArgs -> {
            if (transformedArgs.equals(expr.getArgs())) {
                return transformExpr(expr);
            }
            return transformExpr(store.mkApp(expr.getDecl(), transformedArgs));
        });
    }

    /**
     * 量词只依赖其体，绑定变量声明原样保留。
     */
    protected RewriteStep transformQuantifier(Expr expr) {
        return transformAfterDependencies(expr, List.of(expr.getBody()), transformedBody -> {
            Expr body = transformedBody.get(0);
            if (body == expr.getBody()) {
                return transformExpr(expr);
            }
            Expr rebuilt = switch (expr.getKind()) {
                case EXISTS -> store.mkExists(body, expr.getBounds());
                case FORALL -> store.mkForall(body, expr.getBounds());
                default -> throw new IllegalStateException("Unexpected quantifier kind: " + expr.getKind());
            };
            return transformExpr(rebuilt);
        });
    }

    protected RewriteStep transformArrayLambda(Expr expr) {
        return transformAfterDependencies(expr, List.of(expr.getBody()), transformedBody -> {
            Expr body = transformedBody.get(0);
            if (body == expr.getBody()) {
                return transformExpr(expr);
            }
            return transformExpr(store.mkArrayLambda(expr.getBounds().get(0), body));
        });
    }

    /**
     * 依赖全部改写完成后才调用 transformer；否则推迟，列出缺失的依赖。
     * @param expr 当前节点。
     * @param dependencies 依赖列表。
     * @param transformer 接收改写后依赖 (与 dependencies 一一对应) 并返回最终结果。
     */
    protected final RewriteStep transformAfterDependencies(Expr expr, List<Expr> dependencies,
                                                           Function<List<Expr>, Expr> transformer) {
        List<Expr> transformedDependencies = new ArrayList<>(dependencies.size());
        List<Expr> missing = null;
        for (Expr dependency : dependencies) {
            Expr transformedDependency = transformedExpr(dependency);
            if (transformedDependency != null) {
                transformedDependencies.add(transformedDependency);
            } else {
                if (missing == null) {
                    missing = new ArrayList<>();
                }
                missing.add(dependency);
            }
        }
        if (missing != null) {
            return RewriteStep.deferred(missing);
        }
        return RewriteStep.ready(transformer.apply(transformedDependencies));
    }
}
