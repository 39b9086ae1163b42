package org.termkit.expressions;

/**
 * 表达式节点种类的封闭枚举。
 * 每个种类给出其文本符号、参数个数上下界 (-1 表示不限) 与结构形态。
 */
public enum ExprKind {

    // 字面量
    TRUE("true", 0, 0, ExprShape.VALUE),
    FALSE("false", 0, 0, ExprShape.VALUE),
    INT_NUM("int", 0, 0, ExprShape.VALUE),
    REAL_NUM("real", 0, 0, ExprShape.VALUE),
    BV_VALUE("bv", 0, 0, ExprShape.VALUE),
    FP_VALUE("fp", 0, 0, ExprShape.VALUE),
    ROUNDING_MODE("rm", 0, 0, ExprShape.VALUE),

    // 未解释函数 (常量是零元函数)
    APP("app", 0, -1, ExprShape.APP),

    // 布尔
    AND("and", 0, -1, ExprShape.APP),
    OR("or", 0, -1, ExprShape.APP),
    NOT("not", 1, 1, ExprShape.APP),
    IMPLIES("=>", 2, 2, ExprShape.APP),
    XOR("xor", 2, 2, ExprShape.APP),
    EQ("=", 2, 2, ExprShape.APP),
    DISTINCT("distinct", 2, -1, ExprShape.APP),
    ITE("ite", 3, 3, ExprShape.APP),

    // 算术
    ADD("+", 1, -1, ExprShape.APP),
    MUL("*", 1, -1, ExprShape.APP),
    SUB("-", 1, -1, ExprShape.APP),
    UNARY_MINUS("-", 1, 1, ExprShape.APP),
    DIV("/", 2, 2, ExprShape.APP),
    POWER("^", 2, 2, ExprShape.APP),
    LT("<", 2, 2, ExprShape.APP),
    LE("<=", 2, 2, ExprShape.APP),
    GT(">", 2, 2, ExprShape.APP),
    GE(">=", 2, 2, ExprShape.APP),

    // 整数与实数
    MOD("mod", 2, 2, ExprShape.APP),
    REM("rem", 2, 2, ExprShape.APP),
    TO_REAL("to_real", 1, 1, ExprShape.APP),
    TO_INT("to_int", 1, 1, ExprShape.APP),
    IS_INT("is_int", 1, 1, ExprShape.APP),

    // 数组
    SELECT("select", 2, 2, ExprShape.APP),
    STORE("store", 3, 3, ExprShape.APP),
    CONST_ARRAY("const", 1, 1, ExprShape.APP),

    // 位向量
    BV_NOT("bvnot", 1, 1, ExprShape.APP),
    BV_NEG("bvneg", 1, 1, ExprShape.APP),
    BV_AND("bvand", 2, 2, ExprShape.APP),
    BV_OR("bvor", 2, 2, ExprShape.APP),
    BV_XOR("bvxor", 2, 2, ExprShape.APP),
    BV_ADD("bvadd", 2, 2, ExprShape.APP),
    BV_MUL("bvmul", 2, 2, ExprShape.APP),
    BV_ULT("bvult", 2, 2, ExprShape.APP),
    BV_ULE("bvule", 2, 2, ExprShape.APP),
    BV_CONCAT("concat", 2, 2, ExprShape.APP),

    // 浮点
    FP_ABS("fp.abs", 1, 1, ExprShape.APP),
    FP_NEG("fp.neg", 1, 1, ExprShape.APP),
    FP_ADD("fp.add", 3, 3, ExprShape.APP),
    FP_MUL("fp.mul", 3, 3, ExprShape.APP),
    FP_EQ("fp.eq", 2, 2, ExprShape.APP),
    FP_LT("fp.lt", 2, 2, ExprShape.APP),
    FP_IS_ZERO("fp.isZero", 1, 1, ExprShape.APP),
    FP_IS_NAN("fp.isNaN", 1, 1, ExprShape.APP),

    // 绑定变量的形态
    EXISTS("exists", 1, 1, ExprShape.QUANTIFIER),
    FORALL("forall", 1, 1, ExprShape.QUANTIFIER),
    ARRAY_LAMBDA("lambda", 1, 1, ExprShape.ARRAY_LAMBDA);

    private final String symbol;
    private final int minArity;
    private final int maxArity;
    private final ExprShape shape;

    ExprKind(String symbol, int minArity, int maxArity, ExprShape shape) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.shape = shape;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getMinArity() {
        return minArity;
    }

    public int getMaxArity() {
        return maxArity;
    }

    public ExprShape getShape() {
        return shape;
    }

    public boolean isVariadic() {
        return maxArity < 0;
    }

    /**
     * 检查参数个数是否满足此种类的约束。
     */
    public boolean acceptsArity(int arity) {
        return arity >= minArity && (maxArity < 0 || arity <= maxArity);
    }
}
