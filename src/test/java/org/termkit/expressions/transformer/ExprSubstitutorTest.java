package org.termkit.expressions.transformer;

import org.termkit.core.Sort;
import org.termkit.expressions.Expr;
import org.termkit.expressions.ExprStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExprSubstitutorTest {

    private ExprStore store;
    private Expr x;
    private Expr y;

    @BeforeEach
    void setUp() {
        store = new ExprStore();
        x = store.mkConst("x", Sort.integer());
        y = store.mkConst("y", Sort.integer());
    }

    @Test
    @DisplayName("替换所有出现位置，未受影响的子图保持同一个节点 ((x+1) < y, x := 3)")
    void replacesEveryOccurrence() {
        Expr untouched = store.mkArithMul(y, y);
        Expr shared = store.mkArithAdd(x, store.mkIntNum(1));
        Expr root = store.mkAnd(store.mkArithLt(shared, y), store.mkEq(shared, untouched));

        Expr result = new ExprSubstitutor(store).substitute(x, store.mkIntNum(3)).apply(root);

        Expr expectedShared = store.mkArithAdd(store.mkIntNum(3), store.mkIntNum(1));
        assertAll("x replaced by 3",
                () -> assertSame(store.mkAnd(store.mkArithLt(expectedShared, y), store.mkEq(expectedShared, untouched)), result),
                () -> assertSame(untouched, result.arg(1).arg(1))
        );
    }

    @Test
    @DisplayName("复合节点也可以作为替换的源")
    void replacesCompoundNodes() {
        Expr sum = store.mkArithAdd(x, y);
        Expr root = store.mkArithGe(sum, store.mkIntNum(0));

        Expr result = new ExprSubstitutor(store).substitute(sum, y).apply(root);

        assertSame(store.mkArithGe(y, store.mkIntNum(0)), result);
    }

    @Test
    @DisplayName("替换结果中的节点不会被再次替换 (x := y, y := x)")
    void substitutionIsSimultaneous() {
        Expr root = store.mkArithLt(x, y);

        Expr result = new ExprSubstitutor(store).substitute(x, y).substitute(y, x).apply(root);

        assertSame(store.mkArithLt(y, x), result);
    }

    @Test
    @DisplayName("类型不同的替换应抛出异常")
    void sortMismatchIsRejected() {
        ExprSubstitutor substitutor = new ExprSubstitutor(store);
        assertThrows(IllegalArgumentException.class, () -> substitutor.substitute(x, store.mkTrue()));
        assertTrue(substitutor.isEmpty());
    }
}
