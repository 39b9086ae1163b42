package org.termkit.expressions;

import org.termkit.core.RoundingModeKind;
import org.termkit.core.Sort;
import org.termkit.core.SortKind;
import org.termkit.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 表达式、声明的构造与缓存中心 (hash-consing)。
 * 结构相同的节点只会被创建一次；构造时检查参数个数与操作数类型，违反时抛出 {@link IllegalArgumentException}。
 * 所有缓存都是并发安全的，多个线程可以共享同一个 store。
 * @author Ayalyt
 */
public final class ExprStore {

    private static final Logger logger = LoggerFactory.getLogger(ExprStore.class);

    private final AtomicInteger nextId = new AtomicInteger(0);
    private final Map<List<Object>, Expr> exprCache = new ConcurrentHashMap<>();
    private final Map<Declaration, Declaration> declCache = new ConcurrentHashMap<>();
    /** 字面量声明到字面量节点的映射，供 {@link #mkApp} 重建字面量 */
    private final Map<Declaration, Expr> literalsByDecl = new ConcurrentHashMap<>();

    private final Expr trueExpr;
    private final Expr falseExpr;

    public ExprStore() {
        this.trueExpr = mkLiteral(ExprKind.TRUE, "true", Sort.bool(), null);
        this.falseExpr = mkLiteral(ExprKind.FALSE, "false", Sort.bool(), null);
        logger.info("ExprStore 初始化完成");
    }

    /**
     * 当前 store 中已缓存的节点数。
     */
    public int size() {
        return exprCache.size();
    }

    // ========== 声明 ==========

    public Declaration mkFuncDecl(String name, Sort range, List<Sort> domain) {
        return internDecl(name, ExprKind.APP, range, domain);
    }

    public Declaration mkConstDecl(String name, Sort sort) {
        return internDecl(name, ExprKind.APP, sort, Collections.emptyList());
    }

    private Declaration internDecl(String name, ExprKind kind, Sort range, List<Sort> domain) {
        Declaration decl = new Declaration(name, kind, range, domain);
        return declCache.computeIfAbsent(decl, d -> {
            logger.debug("创建声明: {}", d);
            return d;
        });
    }

    private Declaration operatorDecl(ExprKind kind, Sort range, List<Sort> domain) {
        return internDecl(kind.getSymbol(), kind, range, domain);
    }

    // ========== 字面量 ==========

    public Expr mkTrue() {
        return trueExpr;
    }

    public Expr mkFalse() {
        return falseExpr;
    }

    public Expr mkBool(boolean value) {
        return value ? trueExpr : falseExpr;
    }

    public Expr mkIntNum(long value) {
        return mkIntNum(BigInteger.valueOf(value));
    }

    public Expr mkIntNum(BigInteger value) {
        Objects.requireNonNull(value, "Integer value cannot be null");
        return mkLiteral(ExprKind.INT_NUM, value.toString(), Sort.integer(), value);
    }

    public Expr mkRealNum(long value) {
        return mkRealNum(Rational.valueOf(value));
    }

    public Expr mkRealNum(Rational value) {
        Objects.requireNonNull(value, "Real value cannot be null");
        return mkLiteral(ExprKind.REAL_NUM, value.toString(), Sort.real(), value);
    }

    public Expr mkBv(long value, int width) {
        return mkBv(BigInteger.valueOf(value), width);
    }

    /**
     * 位向量字面量。负数按补码截断到 width 位。
     */
    public Expr mkBv(BigInteger value, int width) {
        Objects.requireNonNull(value, "Bit-vector value cannot be null");
        Sort sort = Sort.bitVec(width);
        BigInteger bits = value.mod(BigInteger.ONE.shiftLeft(width));
        return mkLiteral(ExprKind.BV_VALUE, Expr.bvLiteral(bits, width), sort, bits);
    }

    /**
     * 浮点字面量，按 IEEE 位域给出。
     * 所有 NaN 位模式 (指数全 1、尾数非 0) 都映射到同一个规范 NaN：符号位 0，仅尾数最高位为 1。
     * @param negative 符号位。
     * @param exponent 带偏置的指数位，范围 [0, 2^eb)。
     * @param significand 不含隐藏位的尾数位，范围 [0, 2^(sb-1))。
     * @param sort 浮点类型。
     */
    public Expr mkFp(boolean negative, BigInteger exponent, BigInteger significand, Sort sort) {
        Objects.requireNonNull(sort, "Floating-point sort cannot be null");
        if (sort.getKind() != SortKind.FP) {
            throw fail("mkFp 需要浮点类型，实际为 " + sort);
        }
        if (exponent.signum() < 0 || exponent.bitLength() > sort.getExponentBits()) {
            throw fail("指数位 " + exponent + " 超出 " + sort + " 的范围");
        }
        if (significand.signum() < 0 || significand.bitLength() > sort.getSignificandBits() - 1) {
            throw fail("尾数位 " + significand + " 超出 " + sort + " 的范围");
        }
        if (exponent.equals(maxExponent(sort)) && significand.signum() != 0) {
            negative = false;
            significand = BigInteger.ONE.shiftLeft(sort.getSignificandBits() - 2);
        }
        List<Object> parts = List.of(negative, exponent, significand);
        String name = "(fp " + (negative ? "#b1 " : "#b0 ")
                + Expr.bvLiteral(exponent, sort.getExponentBits()) + " "
                + Expr.bvLiteral(significand, sort.getSignificandBits() - 1) + ")";
        return mkLiteral(ExprKind.FP_VALUE, name, sort, parts);
    }

    public Expr mkFpZero(boolean negative, Sort sort) {
        return mkFp(negative, BigInteger.ZERO, BigInteger.ZERO, sort);
    }

    public Expr mkFpNaN(Sort sort) {
        Objects.requireNonNull(sort, "Floating-point sort cannot be null");
        return mkFp(false, maxExponent(sort), BigInteger.ONE, sort);
    }

    private static BigInteger maxExponent(Sort sort) {
        return BigInteger.ONE.shiftLeft(sort.getExponentBits()).subtract(BigInteger.ONE);
    }

    public Expr mkRoundingMode(RoundingModeKind mode) {
        Objects.requireNonNull(mode, "Rounding mode cannot be null");
        return mkLiteral(ExprKind.ROUNDING_MODE, mode.getSymbol(), Sort.roundingMode(), mode);
    }

    private Expr mkLiteral(ExprKind kind, String name, Sort sort, Object payload) {
        Declaration decl = internDecl(name, kind, sort, Collections.emptyList());
        Expr literal = intern(kind, decl, Collections.emptyList(), sort, Collections.emptyList(), payload);
        literalsByDecl.putIfAbsent(decl, literal);
        return literal;
    }

    // ========== 未解释函数 ==========

    public Expr mkConst(String name, Sort sort) {
        return mkApp(mkConstDecl(name, sort), Collections.emptyList());
    }

    /**
     * 通用构造入口：按声明的种类分派到对应的工厂方法。
     * 变换在参数改变后用它重建节点。
     * @throws IllegalArgumentException 参数个数或类型与声明不符，或声明是绑定形态。
     */
    public Expr mkApp(Declaration decl, List<Expr> args) {
        Objects.requireNonNull(decl, "Declaration cannot be null");
        Objects.requireNonNull(args, "Argument list cannot be null");
        ExprKind kind = decl.getKind();
        checkArity(kind, args);
        return switch (kind) {
            case TRUE, FALSE, INT_NUM, REAL_NUM, BV_VALUE, FP_VALUE, ROUNDING_MODE -> {
                Expr literal = literalsByDecl.get(decl);
                if (literal == null) {
                    throw fail("未知的字面量声明: " + decl);
                }
                yield literal;
            }
            case APP -> mkUninterpretedApp(decl, args);
            case AND -> mkAnd(args);
            case OR -> mkOr(args);
            case NOT -> mkNot(args.get(0));
            case IMPLIES -> mkImplies(args.get(0), args.get(1));
            case XOR -> mkXor(args.get(0), args.get(1));
            case EQ -> mkEq(args.get(0), args.get(1));
            case DISTINCT -> mkDistinct(args);
            case ITE -> mkIte(args.get(0), args.get(1), args.get(2));
            case ADD -> mkArithAdd(args);
            case MUL -> mkArithMul(args);
            case SUB -> mkArithSub(args);
            case UNARY_MINUS -> mkArithUnaryMinus(args.get(0));
            case DIV -> mkArithDiv(args.get(0), args.get(1));
            case POWER -> mkArithPower(args.get(0), args.get(1));
            case LT -> mkArithLt(args.get(0), args.get(1));
            case LE -> mkArithLe(args.get(0), args.get(1));
            case GT -> mkArithGt(args.get(0), args.get(1));
            case GE -> mkArithGe(args.get(0), args.get(1));
            case MOD -> mkIntMod(args.get(0), args.get(1));
            case REM -> mkIntRem(args.get(0), args.get(1));
            case TO_REAL -> mkIntToReal(args.get(0));
            case TO_INT -> mkRealToInt(args.get(0));
            case IS_INT -> mkRealIsInt(args.get(0));
            case SELECT -> mkArraySelect(args.get(0), args.get(1));
            case STORE -> mkArrayStore(args.get(0), args.get(1), args.get(2));
            case CONST_ARRAY -> mkArrayConst(decl.getRange(), args.get(0));
            case BV_NOT, BV_NEG -> mkBvUnary(kind, args.get(0));
            case BV_AND, BV_OR, BV_XOR, BV_ADD, BV_MUL -> mkBvBinary(kind, args.get(0), args.get(1));
            case BV_ULT, BV_ULE -> mkBvCompare(kind, args.get(0), args.get(1));
            case BV_CONCAT -> mkBvConcat(args.get(0), args.get(1));
            case FP_ABS, FP_NEG -> mkFpUnary(kind, args.get(0));
            case FP_ADD, FP_MUL -> mkFpArith(kind, args.get(0), args.get(1), args.get(2));
            case FP_EQ, FP_LT -> mkFpCompare(kind, args.get(0), args.get(1));
            case FP_IS_ZERO, FP_IS_NAN -> mkFpPredicate(kind, args.get(0));
            case EXISTS, FORALL, ARRAY_LAMBDA ->
                    throw fail("绑定形态 " + kind + " 需要绑定变量，不能通过 mkApp 构造");
        };
    }

    private Expr mkUninterpretedApp(Declaration decl, List<Expr> args) {
        if (args.size() != decl.arity()) {
            throw fail("函数 " + decl.getName() + " 需要 " + decl.arity() + " 个参数，实际为 " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            Sort expected = decl.getDomain().get(i);
            if (!expected.equals(args.get(i).getSort())) {
                throw fail("函数 " + decl.getName() + " 的第 " + i + " 个参数类型应为 " + expected
                        + "，实际为 " + args.get(i).getSort());
            }
        }
        return node(ExprKind.APP, decl, args, decl.getRange());
    }

    // ========== 布尔 ==========

    public Expr mkAnd(List<Expr> args) {
        checkAll(ExprKind.AND, args, Sort.bool());
        return node(ExprKind.AND, operatorDecl(ExprKind.AND, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    public Expr mkAnd(Expr... args) {
        return mkAnd(Arrays.asList(args));
    }

    public Expr mkOr(List<Expr> args) {
        checkAll(ExprKind.OR, args, Sort.bool());
        return node(ExprKind.OR, operatorDecl(ExprKind.OR, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    public Expr mkOr(Expr... args) {
        return mkOr(Arrays.asList(args));
    }

    public Expr mkNot(Expr arg) {
        return boolOp(ExprKind.NOT, List.of(arg));
    }

    public Expr mkImplies(Expr lhs, Expr rhs) {
        return boolOp(ExprKind.IMPLIES, List.of(lhs, rhs));
    }

    public Expr mkXor(Expr lhs, Expr rhs) {
        return boolOp(ExprKind.XOR, List.of(lhs, rhs));
    }

    private Expr boolOp(ExprKind kind, List<Expr> args) {
        checkAll(kind, args, Sort.bool());
        return node(kind, operatorDecl(kind, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    public Expr mkEq(Expr lhs, Expr rhs) {
        List<Expr> args = List.of(lhs, rhs);
        checkAll(ExprKind.EQ, args, lhs.getSort());
        return node(ExprKind.EQ, operatorDecl(ExprKind.EQ, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    public Expr mkDistinct(List<Expr> args) {
        checkArity(ExprKind.DISTINCT, args);
        checkAll(ExprKind.DISTINCT, args, args.get(0).getSort());
        return node(ExprKind.DISTINCT, operatorDecl(ExprKind.DISTINCT, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    public Expr mkIte(Expr condition, Expr trueBranch, Expr falseBranch) {
        checkSort(ExprKind.ITE, condition, Sort.bool());
        checkSort(ExprKind.ITE, falseBranch, trueBranch.getSort());
        List<Expr> args = List.of(condition, trueBranch, falseBranch);
        Sort sort = trueBranch.getSort();
        return node(ExprKind.ITE, operatorDecl(ExprKind.ITE, sort, sortsOf(args)), args, sort);
    }

    // ========== 算术 ==========

    /**
     * @throws IllegalArgumentException 如果参数列表为空或类型不一致。
     */
    public Expr mkArithAdd(List<Expr> args) {
        return arithOp(ExprKind.ADD, args);
    }

    public Expr mkArithAdd(Expr... args) {
        return mkArithAdd(Arrays.asList(args));
    }

    public Expr mkArithMul(List<Expr> args) {
        return arithOp(ExprKind.MUL, args);
    }

    public Expr mkArithMul(Expr... args) {
        return mkArithMul(Arrays.asList(args));
    }

    public Expr mkArithSub(List<Expr> args) {
        return arithOp(ExprKind.SUB, args);
    }

    public Expr mkArithSub(Expr... args) {
        return mkArithSub(Arrays.asList(args));
    }

    public Expr mkArithUnaryMinus(Expr arg) {
        return arithOp(ExprKind.UNARY_MINUS, List.of(arg));
    }

    public Expr mkArithDiv(Expr lhs, Expr rhs) {
        return arithOp(ExprKind.DIV, List.of(lhs, rhs));
    }

    public Expr mkArithPower(Expr lhs, Expr rhs) {
        return arithOp(ExprKind.POWER, List.of(lhs, rhs));
    }

    public Expr mkArithLt(Expr lhs, Expr rhs) {
        return arithCompare(ExprKind.LT, lhs, rhs);
    }

    public Expr mkArithLe(Expr lhs, Expr rhs) {
        return arithCompare(ExprKind.LE, lhs, rhs);
    }

    public Expr mkArithGt(Expr lhs, Expr rhs) {
        return arithCompare(ExprKind.GT, lhs, rhs);
    }

    public Expr mkArithGe(Expr lhs, Expr rhs) {
        return arithCompare(ExprKind.GE, lhs, rhs);
    }

    /**
     * 算术运算的结果类型等于第一个参数的类型。
     */
    private Expr arithOp(ExprKind kind, List<Expr> args) {
        checkArity(kind, args);
        Sort sort = args.get(0).getSort();
        if (!sort.isArith()) {
            throw fail(kind.getSymbol() + " 需要算术类型的参数，实际为 " + sort);
        }
        checkAll(kind, args, sort);
        return node(kind, operatorDecl(kind, sort, sortsOf(args)), args, sort);
    }

    /**
     * 比较运算总是布尔类型，声明的操作数类型取自左操作数。
     */
    private Expr arithCompare(ExprKind kind, Expr lhs, Expr rhs) {
        Sort operandSort = lhs.getSort();
        if (!operandSort.isArith()) {
            throw fail(kind.getSymbol() + " 需要算术类型的参数，实际为 " + operandSort);
        }
        List<Expr> args = List.of(lhs, rhs);
        checkAll(kind, args, operandSort);
        return node(kind, operatorDecl(kind, Sort.bool(), List.of(operandSort, operandSort)), args, Sort.bool());
    }

    public Expr mkIntMod(Expr lhs, Expr rhs) {
        return typedOp(ExprKind.MOD, List.of(lhs, rhs), Sort.integer(), Sort.integer());
    }

    public Expr mkIntRem(Expr lhs, Expr rhs) {
        return typedOp(ExprKind.REM, List.of(lhs, rhs), Sort.integer(), Sort.integer());
    }

    public Expr mkIntToReal(Expr arg) {
        return typedOp(ExprKind.TO_REAL, List.of(arg), Sort.integer(), Sort.real());
    }

    public Expr mkRealToInt(Expr arg) {
        return typedOp(ExprKind.TO_INT, List.of(arg), Sort.real(), Sort.integer());
    }

    public Expr mkRealIsInt(Expr arg) {
        return typedOp(ExprKind.IS_INT, List.of(arg), Sort.real(), Sort.bool());
    }

    // ========== 数组 ==========

    public Expr mkArraySelect(Expr array, Expr index) {
        Sort arraySort = checkArray(ExprKind.SELECT, array);
        checkSort(ExprKind.SELECT, index, arraySort.getDomain());
        List<Expr> args = List.of(array, index);
        return node(ExprKind.SELECT, operatorDecl(ExprKind.SELECT, arraySort.getRange(), sortsOf(args)), args, arraySort.getRange());
    }

    public Expr mkArrayStore(Expr array, Expr index, Expr value) {
        Sort arraySort = checkArray(ExprKind.STORE, array);
        checkSort(ExprKind.STORE, index, arraySort.getDomain());
        checkSort(ExprKind.STORE, value, arraySort.getRange());
        List<Expr> args = List.of(array, index, value);
        return node(ExprKind.STORE, operatorDecl(ExprKind.STORE, arraySort, sortsOf(args)), args, arraySort);
    }

    /**
     * 每个下标都取值 value 的常量数组。
     */
    public Expr mkArrayConst(Sort arraySort, Expr value) {
        Objects.requireNonNull(arraySort, "Array sort cannot be null");
        if (arraySort.getKind() != SortKind.ARRAY) {
            throw fail("常量数组需要数组类型，实际为 " + arraySort);
        }
        checkSort(ExprKind.CONST_ARRAY, value, arraySort.getRange());
        List<Expr> args = List.of(value);
        return node(ExprKind.CONST_ARRAY, operatorDecl(ExprKind.CONST_ARRAY, arraySort, sortsOf(args)), args, arraySort);
    }

    /**
     * lambda 表达式，结果类型为 (Array 下标类型 体类型)。
     */
    public Expr mkArrayLambda(Declaration indexVar, Expr body) {
        Objects.requireNonNull(indexVar, "Index declaration cannot be null");
        Objects.requireNonNull(body, "Lambda body cannot be null");
        if (!indexVar.isConstant()) {
            throw fail("lambda 的绑定变量必须是常量声明: " + indexVar);
        }
        Sort sort = Sort.array(indexVar.getRange(), body.getSort());
        Declaration decl = operatorDecl(ExprKind.ARRAY_LAMBDA, sort, List.of(body.getSort()));
        return intern(ExprKind.ARRAY_LAMBDA, decl, List.of(body), sort, List.of(indexVar), null);
    }

    // ========== 位向量 ==========

    public Expr mkBvNot(Expr arg) {
        return mkBvUnary(ExprKind.BV_NOT, arg);
    }

    public Expr mkBvNeg(Expr arg) {
        return mkBvUnary(ExprKind.BV_NEG, arg);
    }

    public Expr mkBvAnd(Expr lhs, Expr rhs) {
        return mkBvBinary(ExprKind.BV_AND, lhs, rhs);
    }

    public Expr mkBvOr(Expr lhs, Expr rhs) {
        return mkBvBinary(ExprKind.BV_OR, lhs, rhs);
    }

    public Expr mkBvXor(Expr lhs, Expr rhs) {
        return mkBvBinary(ExprKind.BV_XOR, lhs, rhs);
    }

    public Expr mkBvAdd(Expr lhs, Expr rhs) {
        return mkBvBinary(ExprKind.BV_ADD, lhs, rhs);
    }

    public Expr mkBvMul(Expr lhs, Expr rhs) {
        return mkBvBinary(ExprKind.BV_MUL, lhs, rhs);
    }

    public Expr mkBvUnsignedLess(Expr lhs, Expr rhs) {
        return mkBvCompare(ExprKind.BV_ULT, lhs, rhs);
    }

    public Expr mkBvUnsignedLessOrEqual(Expr lhs, Expr rhs) {
        return mkBvCompare(ExprKind.BV_ULE, lhs, rhs);
    }

    public Expr mkBvConcat(Expr high, Expr low) {
        checkBv(ExprKind.BV_CONCAT, high);
        checkBv(ExprKind.BV_CONCAT, low);
        Sort sort = Sort.bitVec(high.getSort().getWidth() + low.getSort().getWidth());
        List<Expr> args = List.of(high, low);
        return node(ExprKind.BV_CONCAT, operatorDecl(ExprKind.BV_CONCAT, sort, sortsOf(args)), args, sort);
    }

    private Expr mkBvUnary(ExprKind kind, Expr arg) {
        Sort sort = checkBv(kind, arg);
        List<Expr> args = List.of(arg);
        return node(kind, operatorDecl(kind, sort, sortsOf(args)), args, sort);
    }

    private Expr mkBvBinary(ExprKind kind, Expr lhs, Expr rhs) {
        Sort sort = checkBv(kind, lhs);
        checkSort(kind, rhs, sort);
        List<Expr> args = List.of(lhs, rhs);
        return node(kind, operatorDecl(kind, sort, sortsOf(args)), args, sort);
    }

    private Expr mkBvCompare(ExprKind kind, Expr lhs, Expr rhs) {
        Sort sort = checkBv(kind, lhs);
        checkSort(kind, rhs, sort);
        List<Expr> args = List.of(lhs, rhs);
        return node(kind, operatorDecl(kind, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    // ========== 浮点 ==========

    public Expr mkFpAbs(Expr arg) {
        return mkFpUnary(ExprKind.FP_ABS, arg);
    }

    public Expr mkFpNeg(Expr arg) {
        return mkFpUnary(ExprKind.FP_NEG, arg);
    }

    public Expr mkFpAdd(Expr roundingMode, Expr lhs, Expr rhs) {
        return mkFpArith(ExprKind.FP_ADD, roundingMode, lhs, rhs);
    }

    public Expr mkFpMul(Expr roundingMode, Expr lhs, Expr rhs) {
        return mkFpArith(ExprKind.FP_MUL, roundingMode, lhs, rhs);
    }

    public Expr mkFpEqual(Expr lhs, Expr rhs) {
        return mkFpCompare(ExprKind.FP_EQ, lhs, rhs);
    }

    public Expr mkFpLess(Expr lhs, Expr rhs) {
        return mkFpCompare(ExprKind.FP_LT, lhs, rhs);
    }

    public Expr mkFpIsZero(Expr arg) {
        return mkFpPredicate(ExprKind.FP_IS_ZERO, arg);
    }

    public Expr mkFpIsNaN(Expr arg) {
        return mkFpPredicate(ExprKind.FP_IS_NAN, arg);
    }

    private Expr mkFpUnary(ExprKind kind, Expr arg) {
        Sort sort = checkFp(kind, arg);
        List<Expr> args = List.of(arg);
        return node(kind, operatorDecl(kind, sort, sortsOf(args)), args, sort);
    }

    private Expr mkFpArith(ExprKind kind, Expr roundingMode, Expr lhs, Expr rhs) {
        checkSort(kind, roundingMode, Sort.roundingMode());
        Sort sort = checkFp(kind, lhs);
        checkSort(kind, rhs, sort);
        List<Expr> args = List.of(roundingMode, lhs, rhs);
        return node(kind, operatorDecl(kind, sort, sortsOf(args)), args, sort);
    }

    private Expr mkFpCompare(ExprKind kind, Expr lhs, Expr rhs) {
        Sort sort = checkFp(kind, lhs);
        checkSort(kind, rhs, sort);
        List<Expr> args = List.of(lhs, rhs);
        return node(kind, operatorDecl(kind, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    private Expr mkFpPredicate(ExprKind kind, Expr arg) {
        checkFp(kind, arg);
        List<Expr> args = List.of(arg);
        return node(kind, operatorDecl(kind, Sort.bool(), sortsOf(args)), args, Sort.bool());
    }

    // ========== 量词 ==========

    public Expr mkExists(Expr body, List<Declaration> bounds) {
        return quantifier(ExprKind.EXISTS, body, bounds);
    }

    public Expr mkForall(Expr body, List<Declaration> bounds) {
        return quantifier(ExprKind.FORALL, body, bounds);
    }

    private Expr quantifier(ExprKind kind, Expr body, List<Declaration> bounds) {
        Objects.requireNonNull(body, "Quantifier body cannot be null");
        Objects.requireNonNull(bounds, "Bound variable list cannot be null");
        checkSort(kind, body, Sort.bool());
        if (bounds.isEmpty()) {
            throw fail(kind.getSymbol() + " 至少需要一个绑定变量");
        }
        for (Declaration bound : bounds) {
            if (!bound.isConstant()) {
                throw fail("绑定变量必须是常量声明: " + bound);
            }
        }
        Declaration decl = operatorDecl(kind, Sort.bool(), List.of(Sort.bool()));
        return intern(kind, decl, List.of(body), Sort.bool(), List.copyOf(bounds), null);
    }

    // ========== 内部工具 ==========

    private Expr typedOp(ExprKind kind, List<Expr> args, Sort operandSort, Sort resultSort) {
        checkAll(kind, args, operandSort);
        return node(kind, operatorDecl(kind, resultSort, sortsOf(args)), args, resultSort);
    }

    private Expr node(ExprKind kind, Declaration decl, List<Expr> args, Sort sort) {
        return intern(kind, decl, List.copyOf(args), sort, Collections.emptyList(), null);
    }

    private Expr intern(ExprKind kind, Declaration decl, List<Expr> args, Sort sort, List<Declaration> bounds, Object payload) {
        List<Object> key = Arrays.asList(kind, decl, args, bounds, payload);
        return exprCache.computeIfAbsent(key, k -> {
            Expr expr = new Expr(nextId.getAndIncrement(), kind, decl, args, sort, bounds, payload);
            logger.debug("创建表达式 #{}: {}", expr.getId(), expr);
            return expr;
        });
    }

    private static List<Sort> sortsOf(List<Expr> args) {
        List<Sort> sorts = new ArrayList<>(args.size());
        for (Expr arg : args) {
            sorts.add(arg.getSort());
        }
        return sorts;
    }

    private static void checkArity(ExprKind kind, List<Expr> args) {
        if (!kind.acceptsArity(args.size())) {
            String expected = kind.isVariadic()
                    ? "至少 " + kind.getMinArity()
                    : kind.getMinArity() == kind.getMaxArity()
                            ? String.valueOf(kind.getMinArity())
                            : kind.getMinArity() + ".." + kind.getMaxArity();
            throw fail(kind + " 需要 " + expected + " 个参数，实际为 " + args.size());
        }
    }

    private static void checkAll(ExprKind kind, List<Expr> args, Sort expected) {
        checkArity(kind, args);
        for (Expr arg : args) {
            checkSort(kind, arg, expected);
        }
    }

    private static void checkSort(ExprKind kind, Expr arg, Sort expected) {
        Objects.requireNonNull(arg, kind + " argument cannot be null");
        if (!arg.getSort().equals(expected)) {
            throw fail(kind + " 的参数类型应为 " + expected + "，实际为 " + arg.getSort() + ": " + arg);
        }
    }

    private static Sort checkArray(ExprKind kind, Expr arg) {
        Sort sort = arg.getSort();
        if (sort.getKind() != SortKind.ARRAY) {
            throw fail(kind + " 需要数组类型的参数，实际为 " + sort);
        }
        return sort;
    }

    private static Sort checkBv(ExprKind kind, Expr arg) {
        Sort sort = arg.getSort();
        if (sort.getKind() != SortKind.BV) {
            throw fail(kind + " 需要位向量类型的参数，实际为 " + sort);
        }
        return sort;
    }

    private static Sort checkFp(ExprKind kind, Expr arg) {
        Sort sort = arg.getSort();
        if (sort.getKind() != SortKind.FP) {
            throw fail(kind + " 需要浮点类型的参数，实际为 " + sort);
        }
        return sort;
    }

    private static IllegalArgumentException fail(String message) {
        logger.error(message);
        return new IllegalArgumentException(message);
    }
}
