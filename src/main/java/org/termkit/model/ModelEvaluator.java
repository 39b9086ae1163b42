package org.termkit.model;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.termkit.core.RoundingModeKind;
import org.termkit.core.Sort;
import org.termkit.expressions.Declaration;
import org.termkit.expressions.Expr;
import org.termkit.expressions.ExprStore;
import org.termkit.expressions.transformer.BindingScope;
import org.termkit.expressions.transformer.ExprSubstitutor;
import org.termkit.expressions.transformer.NonRecursiveTransformer;
import org.termkit.expressions.transformer.RewriteStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 在模型下求值 (或部分求值) 表达式。
 * <p>
 * 未解释函数与常量查询模型；内建运算符在参数求值后做常量折叠，否则原样重建。
 * 模型是完全的 (complete) 时，没有解释的声明取其值域类型的默认值；
 * 模型是部分的时，它们保持符号形式。
 * <p>
 * 量词与 lambda 的体在同一个工作栈中求值，所在作用域绑定的声明不查询模型，保持符号形式。
 * 因此同一个节点在绑定体内外各求值一次。
 * <p>
 * 已求值表达式的缓存在实例的整个生命周期内有效，多次调用 {@link #evaluate} 可以复用。
 * 实例不是线程安全的。
 *
 * @author Ayalyt
 */
public class ModelEvaluator extends NonRecursiveTransformer {

    private static final Logger logger = LoggerFactory.getLogger(ModelEvaluator.class);

    private final Model model;
    private final boolean complete;
    private final ConstantFolder folder;

    private final Map<Pair<Expr, BindingScope>, Expr> evaluatedExpressions = new HashMap<>();
    private final Map<Triple<Declaration, List<Expr>, BindingScope>, Expr> evaluatedFunctions = new HashMap<>();

    // 以下两项只在一次 evaluate 内有效
    private final Map<Pair<Expr, BindingScope>, Integer> junctionProgress = new HashMap<>();
    private final Map<Pair<Expr, BindingScope>, Expr> pendingFolds = new HashMap<>();

    /**
     * @param store 用于重建与构造结果的表达式仓库。
     * @param model 模型。
     * @param complete 模型是否完全。
     */
    public ModelEvaluator(ExprStore store, Model model, boolean complete) {
        super(store);
        this.model = Objects.requireNonNull(model, "Model cannot be null");
        this.complete = complete;
        this.folder = new ConstantFolder(store);
        logger.info("创建 ModelEvaluator，模型包含 {} 个解释，complete = {}", model.getDeclarations().size(), complete);
    }

    /**
     * 求值表达式。
     * @param expr 待求值的表达式。
     * @return 求值结果，类型与 expr 相同。
     * @throws IllegalStateException 模型与声明不一致，或需要为未解释类型取默认值。
     */
    public Expr evaluate(Expr expr) {
        junctionProgress.clear();
        pendingFolds.clear();
        Expr result = apply(expr);
        logger.debug("求值 {} -> {}", expr, result);
        return result;
    }

    /**
     * 迄今为止在绑定体之外求值过的表达式及其结果 (只读快照)。
     */
    public Map<Expr, Expr> getEvaluatedExpressions() {
        Map<Expr, Expr> outermost = new HashMap<>();
        evaluatedExpressions.forEach((key, value) -> {
            if (key.getRight().isRoot()) {
                outermost.put(key.getLeft(), value);
            }
        });
        return Collections.unmodifiableMap(outermost);
    }

    @Override
    protected BindingScope enterBinder(BindingScope outer, Expr binder) {
        return outer.enter(binder.getBounds());
    }

    @Override
    protected RewriteStep rewrite(Expr expr) {
        Pair<Expr, BindingScope> key = Pair.of(expr, currentScope());
        Expr cached = evaluatedExpressions.get(key);
        if (cached != null) {
            return RewriteStep.ready(cached);
        }
        RewriteStep step = evaluateNode(expr);
        if (step.isReady()) {
            evaluatedExpressions.put(key, step.getResult());
        }
        return step;
    }

    private RewriteStep evaluateNode(Expr expr) {
        return switch (expr.getKind()) {
            case TRUE, FALSE, INT_NUM, REAL_NUM, BV_VALUE, FP_VALUE, ROUNDING_MODE -> RewriteStep.ready(expr);
            case APP -> evaluateFunctionApp(expr);
            case AND -> evaluateJunction(expr, true);
            case OR -> evaluateJunction(expr, false);
            case NOT -> evaluateNot(expr);
            case EQ -> evaluateEq(expr);
            case ITE -> evaluateIte(expr);
            case IMPLIES, XOR, DISTINCT,
                    ADD, MUL, SUB, UNARY_MINUS, DIV, POWER, LT, LE, GT, GE,
                    MOD, REM, TO_REAL, TO_INT, IS_INT,
                    SELECT, STORE, CONST_ARRAY,
                    BV_NOT, BV_NEG, BV_AND, BV_OR, BV_XOR, BV_ADD, BV_MUL, BV_ULT, BV_ULE, BV_CONCAT,
                    FP_ABS, FP_NEG, FP_ADD, FP_MUL, FP_EQ, FP_LT, FP_IS_ZERO, FP_IS_NAN -> evaluateBuiltin(expr);
            case EXISTS, FORALL -> evaluateQuantifier(expr);
            case ARRAY_LAMBDA -> evaluateArrayLambda(expr);
        };
    }

    // ========== 布尔 ==========

    /**
     * 合取/析取逐个请求操作数：遇到吸收元 (合取的 false，析取的 true) 立即返回，之后的操作数不再求值；
     * 单位元被丢弃，全部丢弃时返回单位元。
     */
    private RewriteStep evaluateJunction(Expr expr, boolean conjunction) {
        List<Expr> args = expr.getArgs();
        Pair<Expr, BindingScope> key = Pair.of(expr, currentScope());
        for (int i = junctionProgress.getOrDefault(key, 0); i < args.size(); i++) {
            Expr value = transformedExpr(args.get(i));
            if (value == null) {
                junctionProgress.put(key, i);
                return RewriteStep.deferred(args.get(i));
            }
            if (conjunction ? value.isFalse() : value.isTrue()) {
                junctionProgress.remove(key);
                return RewriteStep.ready(store.mkBool(!conjunction));
            }
        }
        junctionProgress.remove(key);

        List<Expr> survivors = new ArrayList<>(args.size());
        for (Expr arg : args) {
            Expr value = transformedExpr(arg);
            if (!(conjunction ? value.isTrue() : value.isFalse())) {
                survivors.add(value);
            }
        }
        if (survivors.isEmpty()) {
            return RewriteStep.ready(store.mkBool(conjunction));
        }
        if (survivors.equals(args)) {
            return RewriteStep.ready(expr);
        }
        return RewriteStep.ready(conjunction ? store.mkAnd(survivors) : store.mkOr(survivors));
    }

    private RewriteStep evaluateNot(Expr expr) {
        return transformAfterDependencies(expr, expr.getArgs(), values -> {
            Expr arg = values.get(0);
            if (arg.isTrue()) {
                return store.mkFalse();
            }
            if (arg.isFalse()) {
                return store.mkTrue();
            }
            return arg == expr.arg(0) ? expr : store.mkNot(arg);
        });
    }

    /**
     * 只有两边求值后是同一个节点时才判定为 true，不做其他推理。
     */
    private RewriteStep evaluateEq(Expr expr) {
        return transformAfterDependencies(expr, expr.getArgs(), values -> {
            Expr lhs = values.get(0);
            Expr rhs = values.get(1);
            if (lhs == rhs) {
                return store.mkTrue();
            }
            return values.equals(expr.getArgs()) ? expr : store.mkEq(lhs, rhs);
        });
    }

    /**
     * 先求值条件；条件是字面量时只求值被选中的分支，否则两个分支都求值并重建。
     */
    private RewriteStep evaluateIte(Expr expr) {
        Expr condition = transformedExpr(expr.arg(0));
        if (condition == null) {
            return RewriteStep.deferred(expr.arg(0));
        }
        if (condition.isTrue() || condition.isFalse()) {
            Expr branch = condition.isTrue() ? expr.arg(1) : expr.arg(2);
            Expr value = transformedExpr(branch);
            return value == null ? RewriteStep.deferred(branch) : RewriteStep.ready(value);
        }
        return transformAfterDependencies(expr, List.of(expr.arg(1), expr.arg(2)), branches -> {
            Expr trueBranch = branches.get(0);
            Expr falseBranch = branches.get(1);
            if (condition == expr.arg(0) && trueBranch == expr.arg(1) && falseBranch == expr.arg(2)) {
                return expr;
            }
            return store.mkIte(condition, trueBranch, falseBranch);
        });
    }

    // ========== 内建运算符 ==========

    private RewriteStep evaluateBuiltin(Expr expr) {
        return transformAfterDependencies(expr, expr.getArgs(), values -> {
            Expr folded = folder.fold(expr.getKind(), values);
            if (folded != null) {
                return folded;
            }
            return values.equals(expr.getArgs()) ? expr : store.mkApp(expr.getDecl(), values);
        });
    }

    // ========== 未解释函数 ==========

    /**
     * 参数就绪后查询模型得到折叠项，再在同一次 apply 中对折叠项求值。
     */
    private RewriteStep evaluateFunctionApp(Expr expr) {
        List<Expr> args = new ArrayList<>(expr.getArgs().size());
        List<Expr> missing = new ArrayList<>();
        for (Expr arg : expr.getArgs()) {
            Expr value = transformedExpr(arg);
            if (value == null) {
                missing.add(arg);
            } else {
                args.add(value);
            }
        }
        if (!missing.isEmpty()) {
            return RewriteStep.deferred(missing);
        }
        Declaration decl = expr.getDecl();
        Expr rebuilt = args.equals(expr.getArgs()) ? expr : store.mkApp(decl, args);
        if (currentScope().binds(decl)) {
            return RewriteStep.ready(rebuilt);
        }

        Triple<Declaration, List<Expr>, BindingScope> key = Triple.of(decl, List.copyOf(args), currentScope());
        Expr known = evaluatedFunctions.get(key);
        if (known != null) {
            return RewriteStep.ready(known);
        }

        Pair<Expr, BindingScope> frame = Pair.of(expr, currentScope());
        Expr folded = pendingFolds.get(frame);
        boolean revisit = folded != null;
        if (!revisit) {
            folded = evaluateFunction(decl, args, rebuilt);
            if (folded == expr || folded == rebuilt) {
                evaluatedFunctions.put(key, folded);
                return RewriteStep.ready(folded);
            }
        }
        Expr value = transformedExpr(folded);
        if (value == null) {
            value = evaluatedExpressions.get(Pair.of(folded, currentScope()));
        }
        if (value == null) {
            if (revisit) {
                // 折叠项还没有结果时节点又被弹出，说明折叠项依赖节点自身
                logger.error("声明 {} 的解释引用了自身: {}", decl.getName(), folded);
                throw new IllegalStateException("Interpretation of " + decl.getName() + " depends on itself: " + folded);
            }
            pendingFolds.put(frame, folded);
            return RewriteStep.deferred(folded);
        }
        pendingFolds.remove(frame);
        evaluatedFunctions.put(key, value);
        return RewriteStep.ready(value);
    }

    /**
     * 函数在模型下的取值 (未求值的折叠项)。
     * 形式参数替换为实际参数后，从最后一个条目向前折叠成 if-then-else 链，靠前的条目优先。
     * 模式与实际参数都是字面量的条目直接判定是否匹配。
     */
    private Expr evaluateFunction(Declaration decl, List<Expr> args, Expr rebuilt) {
        FuncInterpretation interpretation = model.interpretation(decl);
        if (interpretation == null) {
            return complete ? sampleValue(decl.getRange()) : rebuilt;
        }
        if (interpretation.getVars().size() != args.size()) {
            logger.error("声明 {} 的解释有 {} 个形式参数，调用给出 {} 个实际参数",
                    decl.getName(), interpretation.getVars().size(), args.size());
            throw new IllegalStateException("Interpretation of " + decl.getName() + " expects "
                    + interpretation.getVars().size() + " arguments but got " + args.size());
        }

        ExprSubstitutor substitutor = new ExprSubstitutor(store);
        for (int i = 0; i < args.size(); i++) {
            substitutor.substitute(store.mkApp(interpretation.getVars().get(i), List.of()), args.get(i));
        }

        Expr accumulator = interpretation.getDefaultValue() != null
                ? substitute(substitutor, interpretation.getDefaultValue())
                : sampleValue(interpretation.getSort());
        List<FuncInterpretation.Entry> entries = interpretation.getEntries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            FuncInterpretation.Entry entry = entries.get(i);
            List<Expr> conditions = new ArrayList<>();
            boolean matchable = true;
            for (int j = 0; j < args.size(); j++) {
                Expr pattern = substitute(substitutor, entry.getArgs().get(j));
                Expr actual = args.get(j);
                if (pattern == actual) {
                    continue;
                }
                if (pattern.isValue() && actual.isValue()) {
                    matchable = false;
                    break;
                }
                conditions.add(store.mkEq(actual, pattern));
            }
            if (!matchable) {
                continue;
            }
            Expr value = substitute(substitutor, entry.getValue());
            if (conditions.isEmpty()) {
                accumulator = value;
            } else {
                Expr condition = conditions.size() == 1 ? conditions.get(0) : store.mkAnd(conditions);
                accumulator = store.mkIte(condition, value, accumulator);
            }
        }
        logger.debug("{}{} 折叠为 {}", decl.getName(), args, accumulator);
        return accumulator;
    }

    private static Expr substitute(ExprSubstitutor substitutor, Expr expr) {
        return substitutor.isEmpty() ? expr : substitutor.apply(expr);
    }

    // ========== 绑定形态 ==========

    /**
     * 量词只依赖其体；体求值为布尔字面量时量词本身就是该字面量。
     */
    private RewriteStep evaluateQuantifier(Expr expr) {
        return transformAfterDependencies(expr, List.of(expr.getBody()), values -> {
            Expr body = values.get(0);
            if (body.isTrue() || body.isFalse()) {
                return body;
            }
            if (body == expr.getBody()) {
                return expr;
            }
            return switch (expr.getKind()) {
                case EXISTS -> store.mkExists(body, expr.getBounds());
                case FORALL -> store.mkForall(body, expr.getBounds());
                default -> throw new IllegalStateException("Unexpected quantifier kind: " + expr.getKind());
            };
        });
    }

    /**
     * 体求值为字面量的 lambda 是常量数组。
     */
    private RewriteStep evaluateArrayLambda(Expr expr) {
        return transformAfterDependencies(expr, List.of(expr.getBody()), values -> {
            Expr body = values.get(0);
            if (body.isValue()) {
                return store.mkArrayConst(expr.getSort(), body);
            }
            if (body == expr.getBody()) {
                return expr;
            }
            return store.mkArrayLambda(expr.getBounds().get(0), body);
        });
    }

    // ========== 默认值 ==========

    /**
     * 类型的默认值。
     * @throws IllegalStateException 未解释类型没有默认值。
     */
    public Expr sampleValue(Sort sort) {
        return switch (sort.getKind()) {
            case BOOL -> store.mkTrue();
            case INT -> store.mkIntNum(0);
            case REAL -> store.mkRealNum(0);
            case BV -> store.mkBv(0, sort.getWidth());
            case FP -> store.mkFpZero(false, sort);
            case ROUNDING_MODE -> store.mkRoundingMode(RoundingModeKind.ROUND_TOWARD_ZERO);
            case ARRAY -> store.mkArrayConst(sort, sampleValue(sort.getRange()));
            case UNINTERPRETED -> {
                logger.error("未解释类型 {} 没有默认值", sort);
                throw new IllegalStateException("Cannot sample a value of uninterpreted sort " + sort);
            }
        };
    }
}
