package org.cipexpr.expressions;

import lombok.Getter;
import org.cipexpr.core.PointValuation;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.propagation.ReversePropagationContext;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 表达式处理器：定义一类运算（常数、变量、和、积、幂……）的语义。
 * 求值是必备的；其余回调是否可用由 {@link #getCapabilities()} 声明，
 * 未声明的回调被调用时抛出 {@link UnsupportedOperationException}。
 * 引擎核心只通过这些回调与处理器交互。
 * <p>
 * 处理器同时记录自己的调用统计。
 *
 * @author Ayalyt
 */
@Getter
public abstract class ExprHandler {

    private static final Logger logger = LoggerFactory.getLogger(ExprHandler.class);

    private final String name;
    private final String description;
    /** 打印时的结合优先级，数值越大结合越紧。 */
    private final int precedence;
    private final Set<ExprCapability> capabilities;

    // 统计
    private long nSimplifyCalls;
    private long nSimplified;
    private long nIntervalEvals;
    private long nReversePropCalls;
    private long nCutoffs;
    private long nDomainReductions;
    private long nEstimateCalls;
    private long nBranchScores;

    protected ExprHandler(String name, String description, int precedence, Set<ExprCapability> capabilities) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("处理器名称不能为空");
        }
        this.name = name;
        this.description = description;
        this.precedence = precedence;
        this.capabilities = Collections.unmodifiableSet(capabilities.isEmpty()
                ? EnumSet.noneOf(ExprCapability.class) : EnumSet.copyOf(capabilities));
    }

    public boolean hasCapability(ExprCapability capability) {
        return capabilities.contains(capability);
    }

    protected UnsupportedOperationException unsupported(ExprCapability capability) {
        logger.error("处理器 {} 不支持 {}", name, capability);
        return new UnsupportedOperationException("处理器 '" + name + "' 不支持 " + capability);
    }

    // ========== 必备回调 ==========

    /**
     * 在给定的子节点取值下计算本节点的值。
     * @param childValues 按子节点顺序排列的取值，都是有效值。
     * @param point 叶子变量的取值。
     * @return 值，定义域之外返回 {@link Expression#INVALID_VALUE}。
     */
    public abstract double evaluate(Expression expr, double[] childValues, PointValuation point);

    // ========== 可选回调 ==========

    /**
     * 化简。调用时子节点都已经是规范形式。
     * @return 规范形式的表达式，调用方持有一个引用；未改变时返回 expr 本身（已 capture）。
     */
    public Expression simplify(Expression expr, ExprEngine engine) {
        throw unsupported(ExprCapability.SIMPLIFY);
    }

    /**
     * 比较同一处理器的两个节点，返回 -1、0 或 1。
     */
    public int compare(Expression expr1, Expression expr2, ExpressionComparator comparator) {
        throw unsupported(ExprCapability.COMPARE);
    }

    /**
     * 在遍历的某个阶段输出本节点对应的文本片段。
     */
    public void print(ExprWalkFrame frame, StringBuilder out) {
        throw unsupported(ExprCapability.PRINT);
    }

    /**
     * 结构哈希。
     * @param childHashes 按子节点顺序排列的哈希值。
     */
    public long hash(Expression expr, long[] childHashes) {
        throw unsupported(ExprCapability.HASH);
    }

    /**
     * 由子节点的当前区间计算本节点的区间。
     */
    public Interval intervalEval(Expression expr, LeafIntervalSource leafSource) {
        throw unsupported(ExprCapability.INTERVAL_EVAL);
    }

    /**
     * 由本节点的区间反推子节点的区间，通过 {@link ReversePropagationContext#tighten} 收紧。
     */
    public void reversePropagate(Expression expr, ReversePropagationContext context) {
        throw unsupported(ExprCapability.REVERSE_PROP);
    }

    /**
     * 本节点对第 childIndex 个子节点的偏导数，在子节点的缓存值处计算。
     * @return 偏导数，不可导时返回 {@link Expression#INVALID_VALUE}。
     */
    public double backwardDiff(Expression expr, int childIndex) {
        throw unsupported(ExprCapability.BACKWARD_DIFF);
    }

    /**
     * 由子节点的曲率与区间推出本节点的曲率。
     */
    public Curvature curvature(Expression expr) {
        throw unsupported(ExprCapability.CURVATURE);
    }

    /**
     * 关于第 childIndex 个子节点的单调性，依据子节点的当前区间。
     */
    public Monotonicity monotonicity(Expression expr, int childIndex) {
        throw unsupported(ExprCapability.MONOTONICITY);
    }

    /**
     * 子节点的整数性已知时，本节点是否一定取整数值。
     */
    public boolean integrality(Expression expr) {
        throw unsupported(ExprCapability.INTEGRALITY);
    }

    /**
     * 在给定点处以子节点为变量的线性估计。
     * @param overestimate true 表示求上估计。
     * @return 估计，无法估计时返回 null。
     */
    public LinearEstimate estimate(Expression expr, PointValuation point, boolean overestimate) {
        throw unsupported(ExprCapability.ESTIMATE);
    }

    /**
     * 本节点在给定点处的违反量，用于分支得分。
     * @param auxValue 本节点辅助变量（或节点本身）的取值。
     */
    public double branchScore(Expression expr, PointValuation point, double auxValue) {
        throw unsupported(ExprCapability.BRANCH_SCORE);
    }

    /**
     * 复制节点数据。未声明 COPY_DATA 时使用 {@link ExprData#copy()}。
     */
    public ExprData copyData(Expression expr) {
        return expr.getData() == null ? null : expr.getData().copy();
    }

    /**
     * 节点释放时调用。
     */
    public void freeData(Expression expr) {
        expr.setData(null);
    }

    // ========== 统计 ==========

    public void recordSimplifyCall(boolean simplified) {
        nSimplifyCalls++;
        if (simplified) {
            nSimplified++;
        }
    }

    public void recordIntervalEval() {
        nIntervalEvals++;
    }

    public void recordReversePropCall() {
        nReversePropCalls++;
    }

    public void recordCutoff() {
        nCutoffs++;
    }

    public void recordDomainReduction() {
        nDomainReductions++;
    }

    public void recordEstimateCall() {
        nEstimateCalls++;
    }

    public void recordBranchScore() {
        nBranchScores++;
    }

    @Override
    public String toString() {
        return name;
    }
}
