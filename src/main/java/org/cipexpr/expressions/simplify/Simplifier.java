package org.cipexpr.expressions.simplify;

import org.cipexpr.expressions.ExprCapability;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.ExprHandler;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.walk.WalkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 自底向上把表达式化简为规范形式。
 * 离开一个节点时，它的子节点已经被替换为各自的规范形式，再调用处理器的化简回调。
 * 共享子表达式只化简一次。
 * <p>
 * 子节点的替换直接作用在输入表达式上，替换前后语义相同。
 *
 * @author Ayalyt
 */
public final class Simplifier {

    private static final Logger logger = LoggerFactory.getLogger(Simplifier.class);

    private final ExprEngine engine;

    public Simplifier(ExprEngine engine) {
        this.engine = engine;
    }

    /**
     * @return root 的规范形式，调用方持有一个引用；root 本身仍需调用方释放。
     */
    public Expression simplify(Expression root) {
        // 原节点 -> 规范形式，每个值持有一个引用
        Map<Expression, Expression> simplified = new IdentityHashMap<>();

        engine.getWalker().walk(root, null,
                frame -> {
                    Expression child = frame.getCurrentChildExpr();
                    Expression done = simplified.get(child);
                    if (done == null) {
                        return WalkResult.CONTINUE;
                    }
                    if (done != child) {
                        engine.replaceChild(frame.getExpr(), frame.getCurrentChild(), done);
                    }
                    return WalkResult.SKIP;
                },
                frame -> {
                    Expression child = frame.getCurrentChildExpr();
                    Expression done = simplified.get(child);
                    if (done != null && done != child) {
                        engine.replaceChild(frame.getExpr(), frame.getCurrentChild(), done);
                    }
                    return WalkResult.CONTINUE;
                },
                frame -> {
                    Expression expr = frame.getExpr();
                    if (simplified.containsKey(expr)) {
                        return WalkResult.CONTINUE;
                    }
                    ExprHandler handler = expr.getHandler();
                    Expression result;
                    if (handler.hasCapability(ExprCapability.SIMPLIFY)) {
                        result = handler.simplify(expr, engine);
                    } else {
                        engine.capture(expr);
                        result = expr;
                    }
                    simplified.put(expr, result);
                    return WalkResult.CONTINUE;
                });

        Expression result = simplified.get(root);
        engine.capture(result);
        for (Expression value : simplified.values()) {
            engine.release(value);
        }
        logger.debug("化简完成，访问了 {} 个不同的节点", simplified.size());
        return result;
    }
}
