package org.termkit.model;

import org.termkit.core.SortKind;
import org.termkit.expressions.Expr;
import org.termkit.expressions.ExprKind;
import org.termkit.expressions.ExprStore;
import org.termkit.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 内建运算符的常量折叠：只在相关操作数都是字面量时直接计算结果，不做任何推理。
 * 无法折叠时返回 null，由调用者用求值后的参数重建节点。
 * 除以零、乘方与浮点运算从不折叠。
 */
final class ConstantFolder {

    private static final Logger logger = LoggerFactory.getLogger(ConstantFolder.class);

    private final ExprStore store;

    ConstantFolder(ExprStore store) {
        this.store = store;
    }

    /**
     * @param kind 运算符种类。
     * @param args 已求值的参数。
     * @return 折叠结果，或 null。
     */
    Expr fold(ExprKind kind, List<Expr> args) {
        Expr folded = switch (kind) {
            case IMPLIES -> foldImplies(args.get(0), args.get(1));
            case XOR -> foldXor(args.get(0), args.get(1));
            case DISTINCT -> foldDistinct(args);
            case ADD, SUB, MUL -> foldArith(kind, args);
            case UNARY_MINUS -> foldUnaryMinus(args.get(0));
            case DIV -> foldDiv(args.get(0), args.get(1));
            case LT, LE, GT, GE -> foldCompare(kind, args.get(0), args.get(1));
            case MOD, REM -> foldModRem(kind, args.get(0), args.get(1));
            case TO_REAL -> isNum(args.get(0)) ? store.mkRealNum(Rational.valueOf(args.get(0).getIntValue())) : null;
            case TO_INT -> isNum(args.get(0)) ? store.mkIntNum(args.get(0).getRealValue().floor()) : null;
            case IS_INT -> isNum(args.get(0)) ? store.mkBool(args.get(0).getRealValue().isInteger()) : null;
            case SELECT -> foldSelect(args.get(0), args.get(1));
            case BV_NOT, BV_NEG, BV_AND, BV_OR, BV_XOR, BV_ADD, BV_MUL, BV_ULT, BV_ULE, BV_CONCAT -> foldBv(kind, args);
            default -> null;
        };
        if (folded != null) {
            logger.debug("常量折叠 {}{} -> {}", kind.getSymbol(), args, folded);
        }
        return folded;
    }

    // ========== 布尔 ==========

    private Expr foldImplies(Expr lhs, Expr rhs) {
        if (lhs.isFalse() || rhs.isTrue()) {
            return store.mkTrue();
        }
        if (lhs.isTrue()) {
            return rhs;
        }
        return null;
    }

    private Expr foldXor(Expr lhs, Expr rhs) {
        if (isBoolLiteral(lhs) && isBoolLiteral(rhs)) {
            return store.mkBool(lhs != rhs);
        }
        return null;
    }

    /**
     * 任意两个参数相同则为 false；全部是互不相同的字面量则为 true。
     */
    private Expr foldDistinct(List<Expr> args) {
        Set<Expr> seen = new HashSet<>();
        boolean allValues = true;
        for (Expr arg : args) {
            if (!seen.add(arg)) {
                return store.mkFalse();
            }
            allValues &= arg.isValue();
        }
        return allValues ? store.mkTrue() : null;
    }

    // ========== 算术 ==========

    private Expr foldArith(ExprKind kind, List<Expr> args) {
        // 单参数的减法保持原样
        if (kind == ExprKind.SUB && args.size() < 2) {
            return null;
        }
        for (Expr arg : args) {
            if (!isNum(arg)) {
                return null;
            }
        }
        if (args.get(0).getSort().getKind() == SortKind.INT) {
            BigInteger acc = args.get(0).getIntValue();
            for (Expr arg : args.subList(1, args.size())) {
                BigInteger value = arg.getIntValue();
                acc = switch (kind) {
                    case ADD -> acc.add(value);
                    case SUB -> acc.subtract(value);
                    default -> acc.multiply(value);
                };
            }
            return store.mkIntNum(acc);
        }
        Rational acc = args.get(0).getRealValue();
        for (Expr arg : args.subList(1, args.size())) {
            Rational value = arg.getRealValue();
            acc = switch (kind) {
                case ADD -> acc.add(value);
                case SUB -> acc.subtract(value);
                default -> acc.multiply(value);
            };
        }
        return store.mkRealNum(acc);
    }

    private Expr foldUnaryMinus(Expr arg) {
        if (!isNum(arg)) {
            return null;
        }
        if (arg.getKind() == ExprKind.INT_NUM) {
            return store.mkIntNum(arg.getIntValue().negate());
        }
        return store.mkRealNum(arg.getRealValue().negate());
    }

    private Expr foldDiv(Expr lhs, Expr rhs) {
        if (!isNum(lhs) || !isNum(rhs)) {
            return null;
        }
        if (lhs.getKind() == ExprKind.INT_NUM) {
            BigInteger divisor = rhs.getIntValue();
            if (divisor.signum() == 0) {
                return null;
            }
            BigInteger dividend = lhs.getIntValue();
            BigInteger remainder = dividend.mod(divisor.abs());
            return store.mkIntNum(dividend.subtract(remainder).divide(divisor));
        }
        Rational divisor = rhs.getRealValue();
        if (divisor.isZero()) {
            return null;
        }
        return store.mkRealNum(lhs.getRealValue().divide(divisor));
    }

    private Expr foldCompare(ExprKind kind, Expr lhs, Expr rhs) {
        if (!isNum(lhs) || !isNum(rhs)) {
            return null;
        }
        int cmp = lhs.getKind() == ExprKind.INT_NUM
                ? lhs.getIntValue().compareTo(rhs.getIntValue())
                : lhs.getRealValue().compareTo(rhs.getRealValue());
        boolean result = switch (kind) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            default -> cmp >= 0;
        };
        return store.mkBool(result);
    }

    /**
     * mod 取欧几里得余数 (总是非负)；rem 的符号随除数。
     */
    private Expr foldModRem(ExprKind kind, Expr lhs, Expr rhs) {
        if (!isNum(lhs) || !isNum(rhs) || rhs.getIntValue().signum() == 0) {
            return null;
        }
        BigInteger divisor = rhs.getIntValue();
        BigInteger mod = lhs.getIntValue().mod(divisor.abs());
        if (kind == ExprKind.REM && divisor.signum() < 0) {
            return store.mkIntNum(mod.negate());
        }
        return store.mkIntNum(mod);
    }

    // ========== 数组 ==========

    /**
     * 沿 store 链向下查找：下标相同取存入的值，下标是不同字面量则跳过，遇到常量数组取其值。
     */
    private Expr foldSelect(Expr array, Expr index) {
        Expr current = array;
        while (true) {
            if (current.getKind() == ExprKind.CONST_ARRAY) {
                return current.arg(0);
            }
            if (current.getKind() != ExprKind.STORE) {
                break;
            }
            Expr storedIndex = current.arg(1);
            if (storedIndex == index) {
                return current.arg(2);
            }
            if (!storedIndex.isValue() || !index.isValue()) {
                break;
            }
            current = current.arg(0);
        }
        return current == array ? null : store.mkArraySelect(current, index);
    }

    // ========== 位向量 ==========

    private Expr foldBv(ExprKind kind, List<Expr> args) {
        for (Expr arg : args) {
            if (arg.getKind() != ExprKind.BV_VALUE) {
                return null;
            }
        }
        int width = args.get(0).getSort().getWidth();
        BigInteger a = args.get(0).getBvValue();
        BigInteger b = args.size() > 1 ? args.get(1).getBvValue() : BigInteger.ZERO;
        BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        return switch (kind) {
            case BV_NOT -> store.mkBv(a.xor(mask), width);
            case BV_NEG -> store.mkBv(a.negate(), width);
            case BV_AND -> store.mkBv(a.and(b), width);
            case BV_OR -> store.mkBv(a.or(b), width);
            case BV_XOR -> store.mkBv(a.xor(b), width);
            case BV_ADD -> store.mkBv(a.add(b), width);
            case BV_MUL -> store.mkBv(a.multiply(b), width);
            case BV_ULT -> store.mkBool(a.compareTo(b) < 0);
            case BV_ULE -> store.mkBool(a.compareTo(b) <= 0);
            case BV_CONCAT -> {
                int lowWidth = args.get(1).getSort().getWidth();
                yield store.mkBv(a.shiftLeft(lowWidth).or(b), width + lowWidth);
            }
            default -> null;
        };
    }

    private static boolean isNum(Expr expr) {
        return expr.getKind() == ExprKind.INT_NUM || expr.getKind() == ExprKind.REAL_NUM;
    }

    private static boolean isBoolLiteral(Expr expr) {
        return expr.isTrue() || expr.isFalse();
    }
}
