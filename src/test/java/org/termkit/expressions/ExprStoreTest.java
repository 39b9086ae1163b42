package org.termkit.expressions;

import org.termkit.core.Sort;
import org.termkit.utils.Rational;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExprStoreTest {

    private ExprStore store;
    private Expr x;
    private Expr y;

    @BeforeEach
    void setUp() {
        store = new ExprStore();
        x = store.mkConst("x", Sort.integer());
        y = store.mkConst("y", Sort.integer());
    }

    @Nested
    @DisplayName("结构共享 (Structural Sharing)")
    class Sharing {

        @Test
        @DisplayName("相同的构造返回同一个节点")
        void identicalConstructionsAreShared() {
            Expr first = store.mkArithAdd(x, store.mkIntNum(1));
            Expr second = store.mkArithAdd(store.mkConst("x", Sort.integer()), store.mkIntNum(1));
            assertAll("Interned (+ x 1)",
                    () -> assertSame(first, second),
                    () -> assertSame(store.mkIntNum(7), store.mkIntNum(BigInteger.valueOf(7))),
                    () -> assertSame(store.mkTrue(), store.mkBool(true))
            );
        }

        @Test
        @DisplayName("同名不同类型的常量是不同的节点")
        void sameNameDifferentSortIsDistinct() {
            Expr realX = store.mkConst("x", Sort.real());
            assertNotSame(x, realX);
            assertNotEquals(x.getDecl(), realX.getDecl());
        }

        @Test
        @DisplayName("整数 1 与实数 1 是不同的字面量")
        void intAndRealLiteralsAreDistinct() {
            assertNotSame(store.mkIntNum(1), store.mkRealNum(1));
            assertEquals(Rational.ONE, store.mkRealNum(1).getRealValue());
        }

        @Test
        @DisplayName("mkApp 用字面量的声明重建出同一个字面量")
        void mkAppRebuildsLiterals() {
            Expr five = store.mkIntNum(5);
            Expr bv = store.mkBv(3, 8);
            assertSame(five, store.mkApp(five.getDecl(), List.of()));
            assertSame(bv, store.mkApp(bv.getDecl(), List.of()));
        }

        @Test
        @DisplayName("mkApp 用运算符的声明重建运算节点")
        void mkAppRebuildsOperators() {
            Expr sum = store.mkArithAdd(x, y);
            Expr rebuilt = store.mkApp(sum.getDecl(), List.of(y, x));
            assertEquals(ExprKind.ADD, rebuilt.getKind());
            assertEquals(List.of(y, x), rebuilt.getArgs());
        }
    }

    @Nested
    @DisplayName("类型规则 (Sort Rules)")
    class SortRules {

        @Test
        @DisplayName("算术结果类型取第一个参数的类型，比较是布尔类型")
        void arithmeticSorts() {
            Expr r = store.mkConst("r", Sort.real());
            assertAll("Arithmetic sorts",
                    () -> assertEquals(Sort.integer(), store.mkArithMul(x, y).getSort()),
                    () -> assertEquals(Sort.real(), store.mkArithUnaryMinus(r).getSort()),
                    () -> assertEquals(Sort.bool(), store.mkArithLt(x, y).getSort()),
                    () -> assertEquals(Sort.real(), store.mkIntToReal(x).getSort())
            );
        }

        @Test
        @DisplayName("混合整数与实数的加法应抛出异常")
        void mixedArithmeticIsRejected() {
            Expr r = store.mkConst("r", Sort.real());
            assertThrows(IllegalArgumentException.class, () -> store.mkArithAdd(x, r));
        }

        @Test
        @DisplayName("零个参数的加法应抛出异常")
        void emptyAdditionIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> store.mkArithAdd(List.of()));
        }

        @Test
        @DisplayName("ITE 条件必须是布尔类型，两个分支类型一致")
        void iteSortChecks() {
            assertThrows(IllegalArgumentException.class, () -> store.mkIte(x, x, y));
            Expr b = store.mkConst("b", Sort.bool());
            assertThrows(IllegalArgumentException.class, () -> store.mkIte(b, x, store.mkRealNum(1)));
            assertEquals(Sort.integer(), store.mkIte(b, x, y).getSort());
        }

        @Test
        @DisplayName("位向量字面量按位宽取模，拼接的位宽相加")
        void bitVectorRules() {
            Expr wrapped = store.mkBv(-1, 8);
            Expr concat = store.mkBvConcat(store.mkBv(1, 4), store.mkBv(2, 8));
            assertAll("Bit-vector literals",
                    () -> assertEquals(BigInteger.valueOf(255), wrapped.getBvValue()),
                    () -> assertSame(store.mkBv(255, 8), wrapped),
                    () -> assertEquals(Sort.bitVec(12), concat.getSort()),
                    () -> assertEquals("#xff", wrapped.toString())
            );
            assertThrows(IllegalArgumentException.class, () -> store.mkBvAdd(store.mkBv(1, 8), store.mkBv(1, 16)));
        }

        @Test
        @DisplayName("数组的 select/store 检查下标与值的类型")
        void arrayRules() {
            Sort arraySort = Sort.array(Sort.integer(), Sort.bool());
            Expr a = store.mkConst("a", arraySort);
            assertEquals(Sort.bool(), store.mkArraySelect(a, x).getSort());
            assertEquals(arraySort, store.mkArrayStore(a, x, store.mkTrue()).getSort());
            assertThrows(IllegalArgumentException.class, () -> store.mkArraySelect(a, store.mkTrue()));
            assertThrows(IllegalArgumentException.class, () -> store.mkArraySelect(x, x));
        }

        @Test
        @DisplayName("浮点字面量的位域超出范围应抛出异常")
        void floatingPointRanges() {
            Sort fp = Sort.floatingPoint(3, 5);
            Expr zero = store.mkFpZero(false, fp);
            assertFalse(zero.getFpSign());
            assertThrows(IllegalArgumentException.class,
                    () -> store.mkFp(false, BigInteger.valueOf(8), BigInteger.ZERO, fp));
            assertThrows(IllegalArgumentException.class,
                    () -> store.mkFp(false, BigInteger.ZERO, BigInteger.valueOf(16), fp));
        }
    }

    @Nested
    @DisplayName("浮点字面量 (Floating-Point Literals)")
    class FloatingPoint {

        private final Sort fp = Sort.floatingPoint(3, 5);
        private final BigInteger allOnes = BigInteger.valueOf(7);

        @Test
        @DisplayName("所有 NaN 位模式得到同一个规范节点")
        void nanIsCanonical() {
            Expr nan = store.mkFpNaN(fp);
            assertAll("Canonical NaN",
                    () -> assertSame(nan, store.mkFp(false, allOnes, BigInteger.ONE, fp)),
                    () -> assertSame(nan, store.mkFp(true, allOnes, BigInteger.valueOf(15), fp)),
                    () -> assertFalse(nan.getFpSign()),
                    () -> assertEquals(allOnes, nan.getFpExponent()),
                    () -> assertEquals(BigInteger.valueOf(8), nan.getFpSignificand())
            );
        }

        @Test
        @DisplayName("无穷与零保留符号位")
        void infinitiesAndZerosKeepTheirSign() {
            Expr positiveInfinity = store.mkFp(false, allOnes, BigInteger.ZERO, fp);
            Expr negativeInfinity = store.mkFp(true, allOnes, BigInteger.ZERO, fp);
            assertNotSame(positiveInfinity, negativeInfinity);
            assertNotSame(store.mkFpNaN(fp), positiveInfinity);
            assertNotSame(store.mkFpZero(false, fp), store.mkFpZero(true, fp));
        }
    }

    @Nested
    @DisplayName("未解释函数与绑定形态 (Functions and Binders)")
    class FunctionsAndBinders {

        @Test
        @DisplayName("函数应用检查参数个数与类型")
        void functionApplicationIsChecked() {
            Declaration f = store.mkFuncDecl("f", Sort.integer(), List.of(Sort.integer()));
            assertEquals(Sort.integer(), store.mkApp(f, List.of(x)).getSort());
            assertThrows(IllegalArgumentException.class, () -> store.mkApp(f, List.of(x, y)));
            assertThrows(IllegalArgumentException.class, () -> store.mkApp(f, List.of(store.mkTrue())));
        }

        @Test
        @DisplayName("量词要求布尔体与非空的绑定变量")
        void quantifierRules() {
            Expr body = store.mkArithLt(x, y);
            Expr forall = store.mkForall(body, List.of(x.getDecl()));
            assertAll("(forall ((x Int)) (< x y))",
                    () -> assertSame(body, forall.getBody()),
                    () -> assertEquals(List.of(x.getDecl()), forall.getBounds()),
                    () -> assertEquals(ExprShape.QUANTIFIER, forall.getShape()),
                    () -> assertEquals("(forall ((x Int)) (< x y))", forall.toString())
            );
            assertThrows(IllegalArgumentException.class, () -> store.mkExists(body, List.of()));
            assertThrows(IllegalArgumentException.class, () -> store.mkExists(x, List.of(x.getDecl())));
        }

        @Test
        @DisplayName("lambda 的类型为 (Array 下标类型 体类型)")
        void arrayLambdaSort() {
            Expr lambda = store.mkArrayLambda(x.getDecl(), store.mkArithAdd(x, store.mkIntNum(1)));
            assertEquals(Sort.array(Sort.integer(), Sort.integer()), lambda.getSort());
            assertThrows(IllegalArgumentException.class, () -> store.mkApp(lambda.getDecl(), List.of(x)));
        }

        @Test
        @DisplayName("读取不匹配的载荷应抛出异常")
        void wrongPayloadAccess() {
            assertThrows(IllegalStateException.class, () -> store.mkTrue().getIntValue());
            assertThrows(IllegalStateException.class, () -> x.getBody());
        }
    }
}
