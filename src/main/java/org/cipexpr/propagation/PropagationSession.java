package org.cipexpr.propagation;

/**
 * 一个传播会话持有的标签计数器。标签从 1 开始递增，0 保留为"总是重新计算"。
 * 节点上缓存的标签只与创建它的会话比较，因此一组表达式在整个生命周期内只应使用一个会话。
 */
public final class PropagationSession {

    private int boxTag;
    private int evalTag;
    private int branchScoreTag;

    public int nextBoxTag() {
        return ++boxTag;
    }

    /**
     * 求值与梯度共用此标签，两者都缓存在节点的值上。
     */
    public int nextEvalTag() {
        return ++evalTag;
    }

    public int nextBranchScoreTag() {
        return ++branchScoreTag;
    }
}
