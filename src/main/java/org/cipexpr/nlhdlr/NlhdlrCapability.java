package org.cipexpr.nlhdlr;

/**
 * 非线性处理器可以为一个节点提供的方法。
 */
public enum NlhdlrCapability {
    INTERVAL_EVAL,
    REVERSE_PROP,
    ESTIMATE,
    BRANCH_SCORE
}
