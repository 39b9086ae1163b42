package org.termkit.expressions.transformer;

import lombok.Getter;
import org.termkit.expressions.Expr;

import java.util.List;
import java.util.Objects;

/**
 * 一次节点访问的结果：要么已得到最终改写结果 (READY)，
 * 要么因依赖尚未改写而推迟 (DEFERRED)，此时列出缺失的依赖。
 * 此类是不可变的。
 */
@Getter
public final class RewriteStep {

    public enum Status {
        READY,
        DEFERRED
    }

    private final Status status;
    private final Expr result;
    private final List<Expr> missingDependencies;

    private RewriteStep(Status status, Expr result, List<Expr> missingDependencies) {
        this.status = status;
        this.result = result;
        this.missingDependencies = missingDependencies;
    }

    /**
     * 工厂方法：改写完成。
     * @param result 改写结果，将被缓存。
     */
    public static RewriteStep ready(Expr result) {
        return new RewriteStep(Status.READY, Objects.requireNonNull(result, "Rewrite result cannot be null"), List.of());
    }

    /**
     * 工厂方法：推迟改写，先处理缺失的依赖。
     * @param missingDependencies 尚未改写的依赖，不能为空。
     */
    public static RewriteStep deferred(List<Expr> missingDependencies) {
        return new RewriteStep(Status.DEFERRED, null, List.copyOf(missingDependencies));
    }

    public static RewriteStep deferred(Expr missingDependency) {
        return new RewriteStep(Status.DEFERRED, null, List.of(missingDependency));
    }

    public boolean isReady() {
        return status == Status.READY;
    }

    @Override
    public String toString() {
        return isReady() ? "READY(" + result + ")" : "DEFERRED" + missingDependencies;
    }
}
