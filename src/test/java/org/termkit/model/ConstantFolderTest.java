package org.termkit.model;

import org.termkit.core.RoundingModeKind;
import org.termkit.core.Sort;
import org.termkit.expressions.Expr;
import org.termkit.expressions.ExprKind;
import org.termkit.expressions.ExprStore;
import org.termkit.utils.Rational;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstantFolderTest {

    private ExprStore store;
    private ModelEvaluator evaluator;
    private Expr x;

    @BeforeEach
    void setUp() {
        store = new ExprStore();
        evaluator = new ModelEvaluator(store, SimpleModel.empty(), false);
        x = store.mkConst("x", Sort.integer());
    }

    private Expr num(long value) {
        return store.mkIntNum(value);
    }

    private Expr real(long numerator, long denominator) {
        return store.mkRealNum(Rational.valueOf(numerator, denominator));
    }

    @Nested
    @DisplayName("算术 (Arithmetic)")
    class ArithmeticFolding {

        @Test
        @DisplayName("(+ 1 2 3) => 6, (- 10 3 2) => 5, (* 2 -4) => -8")
        void integerArithmetic() {
            assertAll("Integer folding",
                    () -> assertSame(num(6), evaluator.evaluate(store.mkArithAdd(num(1), num(2), num(3)))),
                    () -> assertSame(num(5), evaluator.evaluate(store.mkArithSub(num(10), num(3), num(2)))),
                    () -> assertSame(num(-8), evaluator.evaluate(store.mkArithMul(num(2), num(-4)))),
                    () -> assertSame(num(-7), evaluator.evaluate(store.mkArithUnaryMinus(num(7))))
            );
        }

        @Test
        @DisplayName("实数运算是精确的 (1/2 + 1/3 => 5/6)")
        void realArithmetic() {
            assertAll("Real folding",
                    () -> assertSame(real(5, 6), evaluator.evaluate(store.mkArithAdd(real(1, 2), real(1, 3)))),
                    () -> assertSame(real(3, 2), evaluator.evaluate(store.mkArithDiv(real(1, 2), real(1, 3)))),
                    () -> assertSame(real(-1, 2), evaluator.evaluate(store.mkArithUnaryMinus(real(1, 2))))
            );
        }

        @Test
        @DisplayName("整数除法与 mod 是欧几里得的，rem 的符号随除数")
        void integerDivision() {
            assertAll("Euclidean division",
                    () -> assertSame(num(-3), evaluator.evaluate(store.mkArithDiv(num(7), num(-2)))),
                    () -> assertSame(num(-4), evaluator.evaluate(store.mkArithDiv(num(-7), num(2)))),
                    () -> assertSame(num(2), evaluator.evaluate(store.mkIntMod(num(-7), num(3)))),
                    () -> assertSame(num(2), evaluator.evaluate(store.mkIntMod(num(-7), num(-3)))),
                    () -> assertSame(num(1), evaluator.evaluate(store.mkIntRem(num(7), num(3)))),
                    () -> assertSame(num(-2), evaluator.evaluate(store.mkIntRem(num(-7), num(-3))))
            );
        }

        @Test
        @DisplayName("除以零保持符号形式")
        void divisionByZeroStaysSymbolic() {
            Expr intDiv = store.mkArithDiv(num(1), num(0));
            Expr realDiv = store.mkArithDiv(real(1, 1), real(0, 1));
            Expr mod = store.mkIntMod(num(5), num(0));
            assertAll("Division by zero",
                    () -> assertSame(intDiv, evaluator.evaluate(intDiv)),
                    () -> assertSame(realDiv, evaluator.evaluate(realDiv)),
                    () -> assertSame(mod, evaluator.evaluate(mod))
            );
        }

        @Test
        @DisplayName("比较运算 (< 1 2) => true, (>= 1/2 2/3) => false")
        void comparisons() {
            assertAll("Comparisons",
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkArithLt(num(1), num(2)))),
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkArithLe(num(2), num(2)))),
                    () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkArithGt(num(2), num(2)))),
                    () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkArithGe(real(1, 2), real(2, 3))))
            );
        }

        @Test
        @DisplayName("整数与实数的转换 (to_int -7/2 => -4)")
        void conversions() {
            assertAll("Conversions",
                    () -> assertSame(real(3, 1), evaluator.evaluate(store.mkIntToReal(num(3)))),
                    () -> assertSame(num(-4), evaluator.evaluate(store.mkRealToInt(real(-7, 2)))),
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkRealIsInt(real(6, 3)))),
                    () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkRealIsInt(real(1, 3))))
            );
        }

        @Test
        @DisplayName("乘方与含符号的运算不折叠，但参数被求值")
        void nonFoldableOperators() {
            Expr power = store.mkArithPower(num(2), num(3));
            Expr partial = store.mkArithAdd(x, store.mkArithMul(num(2), num(3)));
            assertAll("Rebuilt operators",
                    () -> assertSame(power, evaluator.evaluate(power)),
                    () -> assertSame(store.mkArithAdd(x, num(6)), evaluator.evaluate(partial)),
                    () -> assertSame(store.mkArithSub(num(4)), evaluator.evaluate(store.mkArithSub(num(4))))
            );
        }
    }

    @Nested
    @DisplayName("布尔 (Boolean)")
    class BooleanFolding {

        @Test
        @DisplayName("implies / xor / distinct")
        void booleanConnectives() {
            Expr p = store.mkConst("p", Sort.bool());
            assertAll("Boolean folding",
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkImplies(store.mkFalse(), p))),
                    () -> assertSame(p, evaluator.evaluate(store.mkImplies(store.mkTrue(), p))),
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkImplies(p, store.mkTrue()))),
                    () -> assertSame(store.mkImplies(p, store.mkFalse()), evaluator.evaluate(store.mkImplies(p, store.mkFalse()))),
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkXor(store.mkTrue(), store.mkFalse()))),
                    () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkXor(store.mkTrue(), store.mkTrue()))),
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkDistinct(List.of(num(1), num(2), num(3))))),
                    () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkDistinct(List.of(x, num(1), x)))),
                    () -> assertSame(store.mkDistinct(List.of(x, num(1))), evaluator.evaluate(store.mkDistinct(List.of(x, num(1)))))
            );
        }
    }

    @Nested
    @DisplayName("位向量 (Bit-Vectors)")
    class BitVectorFolding {

        @Test
        @DisplayName("(bvadd #xff #x01) => #x00")
        void additionWrapsAround() {
            assertSame(store.mkBv(0, 8), evaluator.evaluate(store.mkBvAdd(store.mkBv(0xFF, 8), store.mkBv(1, 8))));
        }

        @Test
        @DisplayName("按位运算、取负、乘法与比较")
        void bitwiseOperations() {
            Expr a = store.mkBv(0x0F, 8);
            Expr b = store.mkBv(0x3C, 8);
            assertAll("Bit-vector folding",
                    () -> assertSame(store.mkBv(0xF0, 8), evaluator.evaluate(store.mkBvNot(a))),
                    () -> assertSame(store.mkBv(0xFF, 8), evaluator.evaluate(store.mkBvNeg(store.mkBv(1, 8)))),
                    () -> assertSame(store.mkBv(0x0C, 8), evaluator.evaluate(store.mkBvAnd(a, b))),
                    () -> assertSame(store.mkBv(0x3F, 8), evaluator.evaluate(store.mkBvOr(a, b))),
                    () -> assertSame(store.mkBv(0x33, 8), evaluator.evaluate(store.mkBvXor(a, b))),
                    () -> assertSame(store.mkBv(0x84, 8), evaluator.evaluate(store.mkBvMul(a, b))),
                    () -> assertSame(store.mkTrue(), evaluator.evaluate(store.mkBvUnsignedLess(a, b))),
                    () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkBvUnsignedLessOrEqual(b, a)))
            );
        }

        @Test
        @DisplayName("拼接：高位在前 (concat #x1 #x02 => #x102)")
        void concatenation() {
            Expr result = evaluator.evaluate(store.mkBvConcat(store.mkBv(1, 4), store.mkBv(2, 8)));
            assertSame(store.mkBv(0x102, 12), result);
            assertEquals(Sort.bitVec(12), result.getSort());
        }
    }

    @Nested
    @DisplayName("数组 (Arrays)")
    class ArrayFolding {

        private final Sort intArray = Sort.array(Sort.integer(), Sort.integer());

        @Test
        @DisplayName("(select (store (const 0) 1 5) 1) => 5，其余下标取常量 0")
        void selectOverStoreChain() {
            Expr array = store.mkArrayStore(store.mkArrayConst(intArray, num(0)), num(1), num(5));
            assertAll("select over store",
                    () -> assertSame(num(5), evaluator.evaluate(store.mkArraySelect(array, num(1)))),
                    () -> assertSame(num(0), evaluator.evaluate(store.mkArraySelect(array, num(2))))
            );
        }

        @Test
        @DisplayName("跳过下标不同的 store，停在符号数组上")
        void stopsAtSymbolicArray() {
            Expr a = store.mkConst("a", intArray);
            Expr stored = store.mkArrayStore(store.mkArrayStore(a, num(3), num(30)), num(1), num(10));
            assertAll("Partial select folding",
                    () -> assertSame(num(30), evaluator.evaluate(store.mkArraySelect(stored, num(3)))),
                    () -> assertSame(store.mkArraySelect(a, num(2)), evaluator.evaluate(store.mkArraySelect(stored, num(2)))),
                    () -> assertSame(store.mkArraySelect(stored, x), evaluator.evaluate(store.mkArraySelect(stored, x)))
            );
        }

        @Test
        @DisplayName("下标相同的符号下标直接命中")
        void identicalSymbolicIndexMatches() {
            Expr a = store.mkConst("a", intArray);
            Expr stored = store.mkArrayStore(a, x, num(7));
            assertSame(num(7), evaluator.evaluate(store.mkArraySelect(stored, x)));
        }
    }

    @Test
    @DisplayName("浮点运算从不折叠")
    void floatingPointIsNeverFolded() {
        Sort fp = Sort.floatingPoint(8, 24);
        Expr zero = store.mkFpZero(false, fp);
        Expr sum = store.mkFpAdd(store.mkRoundingMode(RoundingModeKind.ROUND_NEAREST_TIES_TO_EVEN), zero, zero);
        Expr isZero = store.mkFpIsZero(zero);
        assertSame(sum, evaluator.evaluate(sum));
        assertSame(isZero, evaluator.evaluate(isZero));
    }

    @Test
    @DisplayName("NaN 只有一个：不同位模式的 NaN 不是 distinct，select 命中存入 NaN 下标的值")
    void nanIsUnique() {
        Sort fp = Sort.floatingPoint(8, 24);
        Expr nan = store.mkFp(false, BigInteger.valueOf(255), BigInteger.ONE, fp);
        Expr otherNan = store.mkFp(true, BigInteger.valueOf(255), BigInteger.valueOf(3), fp);
        Expr array = store.mkArrayStore(store.mkConst("a", Sort.array(fp, Sort.integer())), nan, num(1));
        assertAll("Canonical NaN",
                () -> assertSame(store.mkFalse(), evaluator.evaluate(store.mkDistinct(List.of(nan, otherNan)))),
                () -> assertSame(num(1), evaluator.evaluate(store.mkArraySelect(array, otherNan)))
        );
    }

    @Test
    @DisplayName("直接调用：操作数不是字面量时返回 null")
    void folderReturnsNullForSymbolicOperands() {
        ConstantFolder folder = new ConstantFolder(store);
        assertAll("No folding",
                () -> assertNull(folder.fold(ExprKind.ADD, List.of(x, num(1)))),
                () -> assertNull(folder.fold(ExprKind.LT, List.of(x, num(1)))),
                () -> assertNull(folder.fold(ExprKind.POWER, List.of(num(2), num(2)))),
                () -> assertSame(num(3), folder.fold(ExprKind.ADD, List.of(num(1), num(2))))
        );
    }
}
