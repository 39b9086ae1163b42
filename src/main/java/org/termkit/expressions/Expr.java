package org.termkit.expressions;

import lombok.Getter;
import org.termkit.core.RoundingModeKind;
import org.termkit.core.Sort;
import org.termkit.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;

/**
 * 表达式图中的一个节点：声明、有序参数列表与结果类型。
 * 节点只能由 {@link ExprStore} 创建并缓存 (hash-consing)，结构相同的表达式是同一个对象，
 * 因此相等性即引用相等。结果类型在构造时计算一次。
 * 量词与数组 lambda 的唯一参数是其体，绑定变量的声明保存在 {@link #getBounds()} 中。
 * 此类是不可变的。
 */
@Getter
public final class Expr {

    private static final Logger logger = LoggerFactory.getLogger(Expr.class);

    /** toString 展开的最大深度，更深的子项以 ... 代替 */
    private static final int MAX_PRINT_DEPTH = 12;

    /** 在所属 store 中的稳定编号，按创建顺序递增 */
    private final int id;
    private final ExprKind kind;
    private final Declaration decl;
    private final List<Expr> args;
    private final Sort sort;
    /** 绑定变量声明，仅量词与数组 lambda 非空 */
    private final List<Declaration> bounds;
    /** 字面量载荷，非字面量为 null */
    private final Object payload;

    Expr(int id, ExprKind kind, Declaration decl, List<Expr> args, Sort sort, List<Declaration> bounds, Object payload) {
        this.id = id;
        this.kind = kind;
        this.decl = decl;
        this.args = args;
        this.sort = sort;
        this.bounds = bounds;
        this.payload = payload;
    }

    public ExprShape getShape() {
        return kind.getShape();
    }

    public boolean isValue() {
        return kind.getShape() == ExprShape.VALUE;
    }

    public boolean isTrue() {
        return kind == ExprKind.TRUE;
    }

    public boolean isFalse() {
        return kind == ExprKind.FALSE;
    }

    public Expr arg(int index) {
        return args.get(index);
    }

    /**
     * 量词或数组 lambda 的体。
     */
    public Expr getBody() {
        if (kind.getShape() != ExprShape.QUANTIFIER && kind.getShape() != ExprShape.ARRAY_LAMBDA) {
            logger.error("节点 {} 不是绑定形态，没有体", this);
            throw new IllegalStateException("Not a binder: " + kind);
        }
        return args.get(0);
    }

    // --- 字面量载荷 ---

    public BigInteger getIntValue() {
        return (BigInteger) payloadOf(ExprKind.INT_NUM);
    }

    public Rational getRealValue() {
        return (Rational) payloadOf(ExprKind.REAL_NUM);
    }

    /**
     * 位向量的无符号值，范围 [0, 2^width)。
     */
    public BigInteger getBvValue() {
        return (BigInteger) payloadOf(ExprKind.BV_VALUE);
    }

    public RoundingModeKind getRoundingMode() {
        return (RoundingModeKind) payloadOf(ExprKind.ROUNDING_MODE);
    }

    public boolean getFpSign() {
        return (Boolean) fpPart(0);
    }

    /** 带偏置的指数位 */
    public BigInteger getFpExponent() {
        return (BigInteger) fpPart(1);
    }

    /** 不含隐藏位的尾数位 */
    public BigInteger getFpSignificand() {
        return (BigInteger) fpPart(2);
    }

    private Object fpPart(int index) {
        return ((List<?>) payloadOf(ExprKind.FP_VALUE)).get(index);
    }

    private Object payloadOf(ExprKind expected) {
        if (kind != expected) {
            logger.error("尝试从 {} 节点读取 {} 载荷: {}", kind, expected, this);
            throw new IllegalStateException("Expected " + expected + " literal but was " + kind);
        }
        return payload;
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        // 节点已被 store 缓存，结构相等即引用相等
        return this == o;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    private void print(StringBuilder sb, int depth) {
        if (depth > MAX_PRINT_DEPTH) {
            sb.append("...");
            return;
        }
        switch (kind) {
            case TRUE, FALSE -> sb.append(kind.getSymbol());
            case INT_NUM -> sb.append(payload);
            case REAL_NUM -> sb.append(payload);
            case BV_VALUE -> sb.append(bvLiteral(getBvValue(), sort.getWidth()));
            case FP_VALUE -> sb.append("(fp ")
                    .append(getFpSign() ? "#b1" : "#b0").append(' ')
                    .append(bvLiteral(getFpExponent(), sort.getExponentBits())).append(' ')
                    .append(bvLiteral(getFpSignificand(), sort.getSignificandBits() - 1)).append(')');
            case ROUNDING_MODE -> sb.append(getRoundingMode().getSymbol());
            case APP -> printApplication(sb, decl.getName(), depth);
            case CONST_ARRAY -> printApplication(sb, "(as const " + sort + ")", depth);
            case EXISTS, FORALL, ARRAY_LAMBDA -> {
                sb.append('(').append(kind.getSymbol()).append(" (");
                for (int i = 0; i < bounds.size(); i++) {
                    if (i > 0) {
                        sb.append(' ');
                    }
                    sb.append('(').append(bounds.get(i).getName()).append(' ').append(bounds.get(i).getRange()).append(')');
                }
                sb.append(") ");
                args.get(0).print(sb, depth + 1);
                sb.append(')');
            }
            default -> printApplication(sb, kind.getSymbol(), depth);
        }
    }

    private void printApplication(StringBuilder sb, String head, int depth) {
        if (args.isEmpty()) {
            sb.append(head);
            return;
        }
        sb.append('(').append(head);
        for (Expr arg : args) {
            sb.append(' ');
            arg.print(sb, depth + 1);
        }
        sb.append(')');
    }

    static String bvLiteral(BigInteger value, int width) {
        if (width % 4 == 0) {
            StringBuilder hex = new StringBuilder(value.toString(16));
            while (hex.length() < width / 4) {
                hex.insert(0, '0');
            }
            return "#x" + hex;
        }
        StringBuilder bin = new StringBuilder(value.toString(2));
        while (bin.length() < width) {
            bin.insert(0, '0');
        }
        return "#b" + bin;
    }
}
