package org.cipexpr.expressions;

import org.cipexpr.core.PointValuation;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.walk.WalkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 在一个点处求表达式的值与梯度。
 * 节点值按求值标签缓存：标签非 0 且与节点上的标签相同时直接复用；标签为 0 表示总是重新计算。
 * 任一子节点无效时父节点也无效，值为 {@link Expression#INVALID_VALUE}。
 *
 * @author Ayalyt
 */
public final class ExpressionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final ExprEngine engine;

    public ExpressionEvaluator(ExprEngine engine) {
        this.engine = engine;
    }

    /**
     * @return root 在 point 处的值，定义域之外返回 {@link Expression#INVALID_VALUE}。
     */
    public double evaluate(Expression root, PointValuation point, int evalTag) {
        // 本次调用内已求值的节点；标签为 0 时共享节点也只求一次
        Set<Expression> done = Collections.newSetFromMap(new IdentityHashMap<>());
        engine.getWalker().walk(root,
                frame -> isCached(frame.getExpr(), evalTag, done) ? WalkResult.SKIP : WalkResult.CONTINUE,
                frame -> isCached(frame.getCurrentChildExpr(), evalTag, done) ? WalkResult.SKIP : WalkResult.CONTINUE,
                null,
                frame -> {
                    Expression expr = frame.getExpr();
                    if (isCached(expr, evalTag, done)) {
                        return WalkResult.CONTINUE;
                    }
                    done.add(expr);
                    double[] childValues = new double[expr.getNChildren()];
                    for (int i = 0; i < childValues.length; i++) {
                        childValues[i] = expr.getChild(i).getValue();
                        if (Double.isNaN(childValues[i])) {
                            expr.setValue(Expression.INVALID_VALUE, evalTag);
                            return WalkResult.CONTINUE;
                        }
                    }
                    expr.setValue(expr.getHandler().evaluate(expr, childValues, point), evalTag);
                    return WalkResult.CONTINUE;
                });
        return root.getValue();
    }

    private static boolean isCached(Expression expr, int evalTag, Set<Expression> done) {
        return done.contains(expr) || evalTag != 0 && expr.getValueTag() == evalTag;
    }

    /**
     * 反向模式求梯度。先在 point 处求值，再从根出发沿每条路径把偏导数乘积累加到子节点上。
     * @return 每个出现的变量对应的偏导数；根的值无效或某个偏导数无效时返回空 Map。
     */
    public Map<Variable, Double> computeGradient(Expression root, PointValuation point, int tag) {
        double value = evaluate(root, point, tag);
        if (Double.isNaN(value)) {
            logger.debug("根节点在 {} 处的值无效，无法求梯度", point);
            return Collections.emptyMap();
        }
        Set<Expression> touched = Collections.newSetFromMap(new IdentityHashMap<>());
        root.setDerivative(1.0, tag);
        touched.add(root);

        // 每条路径上的贡献，栈顶是当前节点的贡献
        Deque<Double> contributions = new ArrayDeque<>();
        contributions.push(1.0);
        WalkResult result = engine.getWalker().walk(root, null,
                frame -> {
                    Expression expr = frame.getExpr();
                    Expression child = frame.getCurrentChildExpr();
                    if (!expr.getHandler().hasCapability(ExprCapability.BACKWARD_DIFF)) {
                        logger.warn("处理器 {} 不支持求导", expr.getHandler().getName());
                        return WalkResult.ABORT;
                    }
                    double partial = expr.getHandler().backwardDiff(expr, frame.getCurrentChild());
                    if (Double.isNaN(partial)) {
                        return WalkResult.ABORT;
                    }
                    double contribution = contributions.peek() * partial;
                    if (child.getDiffTag() != tag || !touched.contains(child)) {
                        child.setDerivative(0.0, tag);
                        touched.add(child);
                    }
                    child.setDerivative(child.getDerivative() + contribution, tag);
                    if (contribution == 0.0) {
                        return WalkResult.SKIP;
                    }
                    contributions.push(contribution);
                    return WalkResult.CONTINUE;
                },
                frame -> {
                    contributions.pop();
                    return WalkResult.CONTINUE;
                },
                null);
        if (result == WalkResult.ABORT) {
            return Collections.emptyMap();
        }

        Map<Variable, Double> partials = new HashMap<>();
        for (Expression expr : touched) {
            if (engine.isVariable(expr)) {
                partials.merge(engine.getVariable(expr), expr.getDerivative(), Double::sum);
            }
        }
        // 贡献为 0 的路径被跳过，未访问到的变量偏导数为 0
        Map<Variable, Double> gradient = new LinkedHashMap<>();
        for (Variable var : engine.collectVariables(root)) {
            gradient.put(var, partials.getOrDefault(var, 0.0));
        }
        return gradient;
    }
}
