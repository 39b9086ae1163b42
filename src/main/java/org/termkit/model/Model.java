package org.termkit.model;

import org.termkit.expressions.Declaration;

import java.util.Set;

/**
 * 模型：为声明给出解释。模型是只读快照，可以被多个求值器并发读取。
 */
public interface Model {

    /**
     * 获取声明的函数解释。
     * @param decl 要查询的声明。
     * @return 解释；模型没有解释该声明时返回 null。
     */
    FuncInterpretation interpretation(Declaration decl);

    /**
     * @return 模型中有解释的全部声明。
     */
    Set<Declaration> getDeclarations();
}
