package org.termkit.expressions.transformer;

import org.termkit.expressions.Declaration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 变换中的绑定作用域。根作用域不绑定任何声明，每进入一个绑定形态得到一个子作用域。
 * <p>
 * 同一父作用域以相同的声明列表进入时返回同一个实例，因此作用域按引用比较即可。
 * 实例不是线程安全的。
 */
public final class BindingScope {

    private final BindingScope parent;
    private final List<Declaration> bounds;
    private final int depth;
    private final Map<List<Declaration>, BindingScope> children = new HashMap<>();

    private BindingScope(BindingScope parent, List<Declaration> bounds) {
        this.parent = parent;
        this.bounds = bounds;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    static BindingScope root() {
        return new BindingScope(null, List.of());
    }

    /**
     * 进入绑定了 declarations 的子作用域。
     */
    public BindingScope enter(List<Declaration> declarations) {
        return children.computeIfAbsent(List.copyOf(declarations), decls -> new BindingScope(this, decls));
    }

    /**
     * declaration 是否被本作用域或任一外层作用域绑定。
     */
    public boolean binds(Declaration declaration) {
        for (BindingScope scope = this; scope != null; scope = scope.parent) {
            if (scope.bounds.contains(declaration)) {
                return true;
            }
        }
        return false;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String toString() {
        return "BindingScope(depth=" + depth + ", bounds=" + bounds + ")";
    }
}
