package org.cipexpr.expressions;

import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.expressions.walk.WalkResult;

/**
 * 把表达式打印成中缀文本，变量写作 &lt;name&gt;，输出可以被 {@link ExpressionParser} 读回。
 * 处理器不支持打印时输出 name(child, child, ...)。
 */
public final class ExpressionPrinter {

    private final ExprEngine engine;

    public ExpressionPrinter(ExprEngine engine) {
        this.engine = engine;
    }

    public String print(Expression expr) {
        StringBuilder out = new StringBuilder();
        // 打印不改变引用计数，也可以用于正在释放的节点
        engine.getWalker().walkUncaptured(expr,
                frame -> emit(frame.getExpr(), frame, out),
                frame -> emit(frame.getExpr(), frame, out),
                frame -> emit(frame.getExpr(), frame, out),
                frame -> emit(frame.getExpr(), frame, out));
        return out.toString();
    }

    private static WalkResult emit(Expression expr, ExprWalkFrame frame, StringBuilder out) {
        ExprHandler handler = expr.getHandler();
        if (handler.hasCapability(ExprCapability.PRINT)) {
            handler.print(frame, out);
            return WalkResult.CONTINUE;
        }
        switch (frame.getStage()) {
            case ENTER_EXPR:
                out.append(handler.getName()).append('(');
                break;
            case VISITING_CHILD:
                if (frame.getCurrentChild() > 0) {
                    out.append(", ");
                }
                break;
            case LEAVE_EXPR:
                out.append(')');
                break;
            default:
                break;
        }
        return WalkResult.CONTINUE;
    }

    /**
     * 整数值不带小数点输出，其余按 {@link Double#toString(double)}。
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
