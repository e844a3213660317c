package org.cipexpr.expressions.walk;

/**
 * 遍历回调。调用方需要的上下文通过闭包捕获。
 */
@FunctionalInterface
public interface ExprWalkCallback {

    WalkResult visit(ExprWalkFrame frame);
}
