package org.cipexpr.expressions.walk;

/**
 * 遍历器在一个节点上所处的阶段。
 */
public enum WalkStage {
    /** 刚进入节点，尚未访问任何子节点。 */
    ENTER_EXPR,
    /** 即将进入当前子节点。 */
    VISITING_CHILD,
    /** 当前子节点刚刚处理完。 */
    VISITED_CHILD,
    /** 所有子节点都处理完，即将离开。 */
    LEAVE_EXPR
}
