package org.cipexpr.propagation;

import lombok.Getter;
import org.cipexpr.utils.Interval;

/**
 * 正向传播的结果：是否不可行，以及根节点的区间。
 */
@Getter
public final class ForwardPropagationResult {

    private final boolean infeasible;
    private final Interval rootInterval;

    ForwardPropagationResult(boolean infeasible, Interval rootInterval) {
        this.infeasible = infeasible;
        this.rootInterval = rootInterval;
    }

    @Override
    public String toString() {
        return infeasible ? "Forward{infeasible}" : "Forward{" + rootInterval + "}";
    }
}
