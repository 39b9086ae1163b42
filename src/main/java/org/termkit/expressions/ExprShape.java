package org.termkit.expressions;

/**
 * 节点的结构形态，决定变换引擎中该节点的依赖集合。
 */
public enum ExprShape {
    /** 字面量，无依赖 */
    VALUE,
    /** 函数应用，依赖全部参数 */
    APP,
    /** 存在/全称量词，只依赖量词体 */
    QUANTIFIER,
    /** 数组 lambda，只依赖 lambda 体 */
    ARRAY_LAMBDA
}
