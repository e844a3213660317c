package org.cipexpr.expressions.walk;

/**
 * 回调的返回值，决定遍历如何继续。
 * <ul>
 * <li>在 ENTER_EXPR 返回 SKIP：跳过全部子节点，直接进入 LEAVE_EXPR。</li>
 * <li>在 VISITING_CHILD 返回 SKIP：跳过当前子节点，也不调用 VISITED_CHILD。</li>
 * <li>在 VISITED_CHILD 返回 SKIP：跳过剩余子节点。</li>
 * <li>在 LEAVE_EXPR 返回 SKIP 与 CONTINUE 相同。</li>
 * </ul>
 * ABORT 立即结束整个遍历。
 */
public enum WalkResult {
    CONTINUE,
    SKIP,
    ABORT
}
