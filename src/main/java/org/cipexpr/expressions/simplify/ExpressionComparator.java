package org.cipexpr.expressions.simplify;

import org.cipexpr.expressions.ExprCapability;
import org.cipexpr.expressions.ExprHandler;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.handlers.*;

import java.util.Comparator;

/**
 * 规范形式表达式上的全序，化简时用它给子节点排序。
 * 不同处理器之间的比较规则：
 * <ol>
 * <li>常数小于其他一切；</li>
 * <li>和式与其他表达式 f 比较时，把 f 看作 1*f + 0；</li>
 * <li>积与其他表达式 f 比较时，把 f 看作单因子积；</li>
 * <li>幂与其他表达式 f 比较时，把 f 看作 f^1；</li>
 * <li>变量小于其余处理器的表达式；</li>
 * <li>其余按处理器名称比较。</li>
 * </ol>
 * 同一处理器的两个节点交给处理器自己比较，处理器不支持比较时按子节点逐个比较。
 * 返回值只会是 -1、0、1。
 *
 * @author Ayalyt
 */
public final class ExpressionComparator implements Comparator<Expression> {

    @Override
    public int compare(Expression expr1, Expression expr2) {
        if (expr1 == expr2) {
            return 0;
        }
        ExprHandler h1 = expr1.getHandler();
        ExprHandler h2 = expr2.getHandler();

        if (h1 == h2) {
            if (h1.hasCapability(ExprCapability.COMPARE)) {
                return Integer.signum(h1.compare(expr1, expr2, this));
            }
            return compareChildren(expr1, expr2);
        }

        if (h1 instanceof ValueHandler) {
            return -1;
        }
        if (h2 instanceof ValueHandler) {
            return 1;
        }
        if (h1 instanceof SumHandler) {
            return compareSumWithTerm(expr1, expr2);
        }
        if (h2 instanceof SumHandler) {
            return -compareSumWithTerm(expr2, expr1);
        }
        if (h1 instanceof ProductHandler) {
            return compareProductWithFactor(expr1, expr2);
        }
        if (h2 instanceof ProductHandler) {
            return -compareProductWithFactor(expr2, expr1);
        }
        if (h1 instanceof PowHandler) {
            return comparePowWithBase(expr1, expr2);
        }
        if (h2 instanceof PowHandler) {
            return -comparePowWithBase(expr2, expr1);
        }
        if (h1 instanceof VariableHandler) {
            return -1;
        }
        if (h2 instanceof VariableHandler) {
            return 1;
        }
        return Integer.signum(h1.getName().compareTo(h2.getName()));
    }

    /**
     * 和式 sum 与 1*other + 0 比较：先比主项，再比主项系数与 1，再看项数，最后比常数与 0。
     */
    private int compareSumWithTerm(Expression sum, Expression other) {
        SumData data = (SumData) sum.getData();
        if (sum.getNChildren() == 0) {
            // 空和式只有常数，当作更短的一方
            return -1;
        }
        int cmp = compare(sum.getChild(0), other);
        if (cmp != 0) {
            return cmp;
        }
        double coefficient = data.getCoefficient(0);
        if (coefficient != 1.0) {
            return coefficient < 1.0 ? -1 : 1;
        }
        if (sum.getNChildren() > 1) {
            return 1;
        }
        double constant = data.getConstant();
        if (constant != 0.0) {
            return constant < 0.0 ? -1 : 1;
        }
        return 0;
    }

    /**
     * 积 product 与单因子积 1*other 比较：先比第一个因子，再看因子个数，最后比系数与 1。
     */
    private int compareProductWithFactor(Expression product, Expression other) {
        if (product.getNChildren() == 0) {
            return -1;
        }
        int cmp = compare(product.getChild(0), other);
        if (cmp != 0) {
            return cmp;
        }
        if (product.getNChildren() > 1) {
            return 1;
        }
        double coefficient = ((ProductData) product.getData()).getCoefficient();
        if (coefficient != 1.0) {
            return coefficient < 1.0 ? -1 : 1;
        }
        return 0;
    }

    /**
     * 幂 pow 与 other^1 比较：先比底数，再比指数与 1。
     */
    private int comparePowWithBase(Expression pow, Expression other) {
        int cmp = compare(pow.getChild(0), other);
        if (cmp != 0) {
            return cmp;
        }
        double exponent = PowHandler.exponentOf(pow);
        if (exponent != 1.0) {
            return exponent < 1.0 ? -1 : 1;
        }
        return 0;
    }

    /**
     * 按下标从 0 开始逐个比较子节点；公共部分相同时子节点少的较小。
     */
    private int compareChildren(Expression expr1, Expression expr2) {
        int n = Math.min(expr1.getNChildren(), expr2.getNChildren());
        for (int i = 0; i < n; i++) {
            int cmp = compare(expr1.getChild(i), expr2.getChild(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(expr1.getNChildren(), expr2.getNChildren());
    }
}
