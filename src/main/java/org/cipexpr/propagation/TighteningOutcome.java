package org.cipexpr.propagation;

/**
 * 一次区间收紧的结果。
 */
public enum TighteningOutcome {
    UNCHANGED,
    TIGHTENED,
    // 收紧后区间为空
    INFEASIBLE;

    public boolean isInfeasible() {
        return this == INFEASIBLE;
    }
}
