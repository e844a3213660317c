package org.cipexpr.expressions.walk;

import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 表达式 DAG 的非递归深度优先遍历器。
 * 每个节点依次经过 ENTER_EXPR、对每个子节点的 VISITING_CHILD / VISITED_CHILD、LEAVE_EXPR 四个阶段，
 * 在每个阶段调用对应回调（可以为 null，视为 CONTINUE）。
 * 共享子表达式每被引用一次就会被访问一次，需要去重的调用方自行在 VISITING_CHILD 返回 SKIP。
 *
 * @author Ayalyt
 */
public final class ExpressionWalker {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionWalker.class);

    private final ExprEngine engine;

    public ExpressionWalker(ExprEngine engine) {
        this.engine = engine;
    }

    /**
     * 从 root 开始遍历。遍历期间 root 被额外持有一次引用，结束后释放。
     * @return 如果某个回调返回 ABORT 则返回 ABORT，否则返回 CONTINUE。
     */
    public WalkResult walk(Expression root,
                           ExprWalkCallback enter,
                           ExprWalkCallback visitingChild,
                           ExprWalkCallback visitedChild,
                           ExprWalkCallback leave) {
        engine.capture(root);
        try {
            return walkUncaptured(root, enter, visitingChild, visitedChild, leave);
        } finally {
            engine.release(root);
        }
    }

    /**
     * 不持有 root 引用的遍历。只用于释放节点，此时 root 的引用计数已经为 0。
     */
    public WalkResult walkUncaptured(Expression root,
                                     ExprWalkCallback enter,
                                     ExprWalkCallback visitingChild,
                                     ExprWalkCallback visitedChild,
                                     ExprWalkCallback leave) {
        Deque<ExprWalkFrame> stack = new ArrayDeque<>();
        stack.push(new ExprWalkFrame(root, null));

        while (!stack.isEmpty()) {
            ExprWalkFrame frame = stack.peek();
            WalkResult result;
            switch (frame.getStage()) {
                case ENTER_EXPR:
                    result = invoke(enter, frame);
                    if (result == WalkResult.ABORT) {
                        return abort(frame);
                    }
                    frame.setCurrentChild(0);
                    if (result == WalkResult.SKIP || frame.getExpr().getNChildren() == 0) {
                        frame.setStage(WalkStage.LEAVE_EXPR);
                    } else {
                        frame.setStage(WalkStage.VISITING_CHILD);
                    }
                    break;

                case VISITING_CHILD:
                    if (frame.getCurrentChild() >= frame.getExpr().getNChildren()) {
                        frame.setStage(WalkStage.LEAVE_EXPR);
                        break;
                    }
                    result = invoke(visitingChild, frame);
                    if (result == WalkResult.ABORT) {
                        return abort(frame);
                    }
                    if (result == WalkResult.SKIP) {
                        frame.setCurrentChild(frame.getCurrentChild() + 1);
                        break;
                    }
                    // 子节点处理完后回到 VISITED_CHILD
                    frame.setStage(WalkStage.VISITED_CHILD);
                    stack.push(new ExprWalkFrame(frame.getCurrentChildExpr(), frame));
                    break;

                case VISITED_CHILD:
                    result = invoke(visitedChild, frame);
                    if (result == WalkResult.ABORT) {
                        return abort(frame);
                    }
                    frame.setCurrentChild(frame.getCurrentChild() + 1);
                    frame.setStage(result == WalkResult.SKIP ? WalkStage.LEAVE_EXPR : WalkStage.VISITING_CHILD);
                    break;

                case LEAVE_EXPR:
                    result = invoke(leave, frame);
                    if (result == WalkResult.ABORT) {
                        return abort(frame);
                    }
                    stack.pop();
                    break;

                default:
                    logger.error("ExpressionWalker: 未知的遍历阶段 {}", frame.getStage());
                    throw new IllegalStateException("未知的遍历阶段: " + frame.getStage());
            }
        }
        return WalkResult.CONTINUE;
    }

    private static WalkResult invoke(ExprWalkCallback callback, ExprWalkFrame frame) {
        if (callback == null) {
            return WalkResult.CONTINUE;
        }
        WalkResult result = callback.visit(frame);
        return result == null ? WalkResult.CONTINUE : result;
    }

    private static WalkResult abort(ExprWalkFrame frame) {
        logger.debug("遍历在 {} 阶段于节点 {} 处中止", frame.getStage(), frame.getExpr().getSerial());
        return WalkResult.ABORT;
    }
}
