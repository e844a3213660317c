package org.cipexpr.propagation;

import lombok.Getter;

/**
 * 逆向传播的结果：是否不可行，以及收紧的次数。
 */
@Getter
public final class ReversePropagationResult {

    private final boolean infeasible;
    private final int tighteningCount;

    ReversePropagationResult(boolean infeasible, int tighteningCount) {
        this.infeasible = infeasible;
        this.tighteningCount = tighteningCount;
    }

    @Override
    public String toString() {
        return "Reverse{infeasible=" + infeasible + ", tightenings=" + tighteningCount + "}";
    }
}
