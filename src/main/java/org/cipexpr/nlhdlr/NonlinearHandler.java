package org.cipexpr.nlhdlr;

import lombok.Getter;
import org.cipexpr.core.PointValuation;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.LinearEstimate;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.propagation.ReversePropagationContext;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 非线性处理器：识别 DAG 中的某种结构，并为识别出的节点提供专门的求值、传播与估计方法。
 * 引擎对每个需要强化的节点按优先级从高到低调用 {@link #detect}，之后只把调用分派给识别成功的处理器。
 * 未在能力中声明的方法被调用时抛出 {@link UnsupportedOperationException}。
 *
 * @author Ayalyt
 */
@Getter
public abstract class NonlinearHandler {

    private static final Logger logger = LoggerFactory.getLogger(NonlinearHandler.class);

    private final String name;
    private final String description;
    private final int priority;
    private final Set<NlhdlrCapability> capabilities;

    protected NonlinearHandler(String name, String description, int priority, Set<NlhdlrCapability> capabilities) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("非线性处理器名称不能为空");
        }
        this.name = name;
        this.description = description;
        this.priority = priority;
        this.capabilities = Collections.unmodifiableSet(capabilities.isEmpty()
                ? EnumSet.noneOf(NlhdlrCapability.class) : EnumSet.copyOf(capabilities));
    }

    public boolean hasCapability(NlhdlrCapability capability) {
        return capabilities.contains(capability);
    }

    protected UnsupportedOperationException unsupported(NlhdlrCapability capability) {
        logger.error("非线性处理器 {} 不支持 {}", name, capability);
        return new UnsupportedOperationException("非线性处理器 '" + name + "' 不支持 " + capability);
    }

    /**
     * 判断是否参与 expr 的强化。
     * @param provided 优先级更高的处理器已经承担的方法。
     * @param enforcedBelow expr ≤ 辅助变量 这一侧是否已有处理器负责。
     * @param enforcedAbove expr ≥ 辅助变量 这一侧是否已有处理器负责。
     * @return 识别结果，不参与时返回 {@link DetectionResult#NONE}。
     */
    public abstract DetectionResult detect(Expression expr, Set<NlhdlrCapability> provided,
                                           boolean enforcedBelow, boolean enforcedAbove);

    /**
     * 以子节点的辅助变量取值计算 expr 的值。
     */
    public abstract double evaluateAuxiliary(Expression expr, Object data, PointValuation point);

    public Interval intervalEval(Expression expr, Object data, LeafIntervalSource leafSource) {
        throw unsupported(NlhdlrCapability.INTERVAL_EVAL);
    }

    public void reversePropagate(Expression expr, Object data, ReversePropagationContext context) {
        throw unsupported(NlhdlrCapability.REVERSE_PROP);
    }

    /**
     * 在 point 处给出 expr 关于子节点的线性估计。
     * @return 估计，无法给出时返回 null。
     */
    public LinearEstimate estimate(Expression expr, Object data, PointValuation point, boolean overestimate) {
        throw unsupported(NlhdlrCapability.ESTIMATE);
    }

    /**
     * 在 point 处的违反量，用作分支得分。
     */
    public double branchScore(Expression expr, Object data, PointValuation point) {
        throw unsupported(NlhdlrCapability.BRANCH_SCORE);
    }

    /**
     * 绑定被清除时调用。
     */
    public void freeExpressionData(Expression expr, Object data) {
    }

    @Override
    public String toString() {
        return name + "(priority=" + priority + ")";
    }
}
