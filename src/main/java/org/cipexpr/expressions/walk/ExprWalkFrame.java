package org.cipexpr.expressions.walk;

import lombok.Getter;
import org.cipexpr.expressions.Expression;

/**
 * 遍历栈上的一帧：当前节点、所处阶段与正在处理的子节点下标。
 * 遍历状态只保存在帧上，不写入节点，因此同一节点可以同时参与多个遍历。
 */
@Getter
public final class ExprWalkFrame {

    private final Expression expr;
    private final ExprWalkFrame parentFrame;
    private final int depth;
    private WalkStage stage;
    private int currentChild;

    ExprWalkFrame(Expression expr, ExprWalkFrame parentFrame) {
        this.expr = expr;
        this.parentFrame = parentFrame;
        this.depth = parentFrame == null ? 0 : parentFrame.depth + 1;
        this.stage = WalkStage.ENTER_EXPR;
        this.currentChild = 0;
    }

    void setStage(WalkStage stage) {
        this.stage = stage;
    }

    void setCurrentChild(int currentChild) {
        this.currentChild = currentChild;
    }

    /**
     * 当前子节点；阶段为 VISITING_CHILD 或 VISITED_CHILD 时有效。
     */
    public Expression getCurrentChildExpr() {
        return expr.getChild(currentChild);
    }

    /**
     * 父节点，根节点返回 null。
     */
    public Expression getParent() {
        return parentFrame == null ? null : parentFrame.expr;
    }

    /**
     * 父节点处理器的优先级，根节点返回 0。打印时用来决定是否加括号。
     */
    public int getParentPrecedence() {
        return parentFrame == null ? 0 : parentFrame.expr.getHandler().getPrecedence();
    }

    public boolean isRoot() {
        return parentFrame == null;
    }
}
