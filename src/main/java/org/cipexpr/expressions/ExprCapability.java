package org.cipexpr.expressions;

/**
 * 表达式处理器可选提供的回调。求值是必备的，不在此列。
 */
public enum ExprCapability {
    SIMPLIFY,
    COMPARE,
    PRINT,
    HASH,
    INTERVAL_EVAL,
    REVERSE_PROP,
    BACKWARD_DIFF,
    CURVATURE,
    MONOTONICITY,
    INTEGRALITY,
    ESTIMATE,
    BRANCH_SCORE,
    COPY_DATA,
    FREE_DATA
}
