package org.cipexpr.nlhdlr;

import org.cipexpr.core.PointValuation;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprCapability;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.ExprHandler;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.LinearEstimate;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.propagation.ReversePropagationContext;
import org.cipexpr.utils.Interval;

import java.util.EnumSet;
import java.util.Set;

/**
 * 默认非线性处理器，优先级最低：把调用转交给节点自身的表达式处理器。
 * 只承担更高优先级处理器还没有承担的方法；表达式处理器能估计时，负责强化尚未被覆盖的一侧。
 *
 * @author Ayalyt
 */
public final class DefaultNonlinearHandler extends NonlinearHandler {

    public static final String NAME = "default";

    public DefaultNonlinearHandler() {
        super(NAME, "delegates to the expression handler", 0, EnumSet.allOf(NlhdlrCapability.class));
    }

    /**
     * 识别时记下的承担情况。
     */
    private static final class Claim {
        private final Set<NlhdlrCapability> methods;
        private final boolean below;
        private final boolean above;

        private Claim(Set<NlhdlrCapability> methods, boolean below, boolean above) {
            this.methods = methods;
            this.below = below;
            this.above = above;
        }
    }

    @Override
    public DetectionResult detect(Expression expr, Set<NlhdlrCapability> provided,
                                  boolean enforcedBelow, boolean enforcedAbove) {
        ExprHandler handler = expr.getHandler();
        Set<NlhdlrCapability> methods = EnumSet.noneOf(NlhdlrCapability.class);
        if (handler.hasCapability(ExprCapability.INTERVAL_EVAL) && !provided.contains(NlhdlrCapability.INTERVAL_EVAL)) {
            methods.add(NlhdlrCapability.INTERVAL_EVAL);
        }
        if (handler.hasCapability(ExprCapability.REVERSE_PROP) && !provided.contains(NlhdlrCapability.REVERSE_PROP)) {
            methods.add(NlhdlrCapability.REVERSE_PROP);
        }
        boolean below = false;
        boolean above = false;
        if (handler.hasCapability(ExprCapability.ESTIMATE) && (!enforcedBelow || !enforcedAbove)) {
            methods.add(NlhdlrCapability.ESTIMATE);
            methods.add(NlhdlrCapability.BRANCH_SCORE);
            below = !enforcedBelow;
            above = !enforcedAbove;
        }
        if (methods.isEmpty()) {
            return DetectionResult.NONE;
        }
        return DetectionResult.of(methods, below, above, new Claim(methods, below, above));
    }

    /**
     * 以子节点的辅助变量取值求值：变量子节点取其自身的值，常数子节点取常数，其余取辅助变量的值。
     * 没有承担强化时直接返回节点缓存的值。
     */
    @Override
    public double evaluateAuxiliary(Expression expr, Object data, PointValuation point) {
        Claim claim = (Claim) data;
        if (!claim.below && !claim.above) {
            return expr.getValue();
        }
        ExprEngine engine = expr.getEngine();
        double[] childValues = new double[expr.getNChildren()];
        for (int i = 0; i < childValues.length; i++) {
            Expression child = expr.getChild(i);
            if (engine.isValue(child)) {
                childValues[i] = engine.getValue(child);
            } else if (engine.isVariable(child)) {
                childValues[i] = point.getValue(engine.getVariable(child));
            } else {
                Variable aux = child.getAuxVariable();
                if (aux == null || !point.contains(aux)) {
                    return Expression.INVALID_VALUE;
                }
                childValues[i] = point.getValue(aux);
            }
        }
        return expr.getHandler().evaluate(expr, childValues, point);
    }

    @Override
    public Interval intervalEval(Expression expr, Object data, LeafIntervalSource leafSource) {
        return expr.getHandler().intervalEval(expr, leafSource);
    }

    @Override
    public void reversePropagate(Expression expr, Object data, ReversePropagationContext context) {
        expr.getHandler().reversePropagate(expr, context);
    }

    @Override
    public LinearEstimate estimate(Expression expr, Object data, PointValuation point, boolean overestimate) {
        Claim claim = (Claim) data;
        if (!claim.methods.contains(NlhdlrCapability.ESTIMATE)) {
            return null;
        }
        return expr.getHandler().estimate(expr, point, overestimate);
    }

    /**
     * 表达式处理器能给出得分时用它的结果；否则按承担的一侧计算辅助变量与子节点辅助取值之间的违反量，
     * 无法求值时得分为 +∞。
     */
    @Override
    public double branchScore(Expression expr, Object data, PointValuation point) {
        Claim claim = (Claim) data;
        Variable aux = expr.getAuxVariable();
        if (!claim.methods.contains(NlhdlrCapability.BRANCH_SCORE) || aux == null || !point.contains(aux)) {
            return 0.0;
        }
        double auxVarValue = point.getValue(aux);
        ExprHandler handler = expr.getHandler();
        if (handler.hasCapability(ExprCapability.BRANCH_SCORE)) {
            return handler.branchScore(expr, point, auxVarValue);
        }
        double auxValue = evaluateAuxiliary(expr, data, point);
        if (Expression.isInvalid(auxValue)) {
            return Double.POSITIVE_INFINITY;
        }
        double violation = 0.0;
        if (claim.below) {
            violation = Math.max(0.0, auxValue - auxVarValue);
        }
        if (claim.above) {
            violation = Math.max(violation, auxVarValue - auxValue);
        }
        return violation;
    }
}
