package org.cipexpr.nlhdlr;

import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprConstraint;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.walk.WalkResult;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 为约束中被加锁的内部节点选择非线性处理器。
 * <p>
 * 每个这样的节点先得到一个辅助变量，定义域取节点的当前区间；然后按优先级从高到低询问处理器，
 * 直到两侧都有处理器负责。向上锁要求强化 expr ≤ 辅助变量（下侧），向下锁要求强化另一侧；
 * 没有对应锁的一侧视为已经覆盖。已经有绑定的节点保持不变。
 *
 * @author Ayalyt
 */
public final class EnforcementDetector {

    private static final Logger logger = LoggerFactory.getLogger(EnforcementDetector.class);

    private final ExprEngine engine;

    public EnforcementDetector(ExprEngine engine) {
        this.engine = engine;
    }

    /**
     * @return 新加上绑定的节点数。
     */
    public int detect(List<ExprConstraint> constraints) {
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        int[] detected = {0};
        for (ExprConstraint constraint : constraints) {
            Expression root = constraint.getRoot();
            if (!visited.add(root)) {
                continue;
            }
            engine.getWalker().walk(root, null,
                    frame -> visited.add(frame.getCurrentChildExpr()) ? WalkResult.CONTINUE : WalkResult.SKIP,
                    null,
                    frame -> {
                        if (detectNode(frame.getExpr())) {
                            detected[0]++;
                        }
                        return WalkResult.CONTINUE;
                    });
        }
        logger.debug("强化检测完成: {} 个节点得到绑定", detected[0]);
        return detected[0];
    }

    private boolean detectNode(Expression expr) {
        if (!expr.isLocked() || expr.getNChildren() == 0 || !expr.getEnforcements().isEmpty()) {
            return false;
        }
        if (expr.getAuxVariable() == null) {
            Interval interval = expr.getInterval().isEmpty() ? Interval.ENTIRE : expr.getInterval();
            expr.setAuxVariable(Variable.createAuxiliary("aux_" + expr.getHandler().getName() + "_" + expr.getSerial(),
                    interval.getInf(), interval.getSup()));
        }
        boolean enforcedBelow = expr.getLocksPos() == 0;
        boolean enforcedAbove = expr.getLocksNeg() == 0;
        Set<NlhdlrCapability> provided = EnumSet.noneOf(NlhdlrCapability.class);
        for (NonlinearHandler nlhdlr : engine.getNonlinearHandlers()) {
            if (enforcedBelow && enforcedAbove) {
                break;
            }
            DetectionResult result = nlhdlr.detect(expr, Collections.unmodifiableSet(provided), enforcedBelow, enforcedAbove);
            if (!result.isSuccess()) {
                continue;
            }
            expr.addEnforcement(new EnforcementBinding(nlhdlr, result));
            provided.addAll(result.getMethods());
            enforcedBelow |= result.isEnforcesBelow();
            enforcedAbove |= result.isEnforcesAbove();
            logger.debug("节点 {}#{} 绑定非线性处理器 {}: {}", expr.getHandler().getName(), expr.getSerial(),
                    nlhdlr.getName(), result);
        }
        if (!enforcedBelow || !enforcedAbove) {
            logger.debug("节点 {}#{} 没有处理器负责强化: below={}, above={}", expr.getHandler().getName(),
                    expr.getSerial(), enforcedBelow, enforcedAbove);
        }
        return !expr.getEnforcements().isEmpty();
    }
}
