package org.cipexpr.expressions;

import org.cipexpr.expressions.walk.WalkResult;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 自底向上计算曲率与整数性，结果写在节点上。
 * 曲率依赖子节点的当前区间，区间变化后需要重新计算。
 */
public final class ExpressionAnalyzer {

    private final ExprEngine engine;

    public ExpressionAnalyzer(ExprEngine engine) {
        this.engine = engine;
    }

    /**
     * @return root 的曲率；处理器不支持时为 UNKNOWN。
     */
    public Curvature computeCurvature(Expression root) {
        Set<Expression> done = Collections.newSetFromMap(new IdentityHashMap<>());
        engine.getWalker().walk(root, null,
                frame -> done.contains(frame.getCurrentChildExpr()) ? WalkResult.SKIP : WalkResult.CONTINUE,
                null,
                frame -> {
                    Expression expr = frame.getExpr();
                    if (done.add(expr)) {
                        ExprHandler handler = expr.getHandler();
                        expr.setCurvature(handler.hasCapability(ExprCapability.CURVATURE)
                                ? handler.curvature(expr) : Curvature.UNKNOWN);
                    }
                    return WalkResult.CONTINUE;
                });
        return root.getCurvature();
    }

    /**
     * @return root 是否一定取整数值；处理器不支持时为 false。
     */
    public boolean computeIntegrality(Expression root) {
        Set<Expression> done = Collections.newSetFromMap(new IdentityHashMap<>());
        engine.getWalker().walk(root, null,
                frame -> done.contains(frame.getCurrentChildExpr()) ? WalkResult.SKIP : WalkResult.CONTINUE,
                null,
                frame -> {
                    Expression expr = frame.getExpr();
                    if (done.add(expr)) {
                        ExprHandler handler = expr.getHandler();
                        expr.setIntegral(handler.hasCapability(ExprCapability.INTEGRALITY) && handler.integrality(expr));
                    }
                    return WalkResult.CONTINUE;
                });
        return root.isIntegral();
    }

    /**
     * expr 关于第 childIndex 个子节点的单调性，依据子节点的当前区间。
     */
    public Monotonicity monotonicity(Expression expr, int childIndex) {
        ExprHandler handler = expr.getHandler();
        if (!handler.hasCapability(ExprCapability.MONOTONICITY)) {
            return Monotonicity.UNKNOWN;
        }
        return handler.monotonicity(expr, childIndex);
    }
}
