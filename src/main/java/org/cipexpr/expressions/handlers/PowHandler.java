package org.cipexpr.expressions.handlers;

import org.cipexpr.core.PointValuation;
import org.cipexpr.expressions.*;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.propagation.ReversePropagationContext;
import org.cipexpr.utils.HashUtils;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * 幂 base^exponent，指数为常数。非整数指数只在 base ≥ 0 上有定义。
 *
 * @author Ayalyt
 */
public final class PowHandler extends ExprHandler {

    private static final Logger logger = LoggerFactory.getLogger(PowHandler.class);

    public static final String NAME = "pow";
    public static final int PRECEDENCE = 55000;

    /** 与最近整数相差不超过此值的指数视为整数。 */
    private static final double INTEGRALITY_EPSILON = 1e-9;

    private static final long NAME_HASH = HashUtils.stringHash(NAME);

    public PowHandler() {
        super(NAME, "power with constant exponent", PRECEDENCE, EnumSet.of(
                ExprCapability.SIMPLIFY,
                ExprCapability.COMPARE,
                ExprCapability.PRINT,
                ExprCapability.HASH,
                ExprCapability.INTERVAL_EVAL,
                ExprCapability.REVERSE_PROP,
                ExprCapability.BACKWARD_DIFF,
                ExprCapability.CURVATURE,
                ExprCapability.MONOTONICITY,
                ExprCapability.INTEGRALITY));
    }

    public static double exponentOf(Expression expr) {
        return ((PowData) expr.getData()).getExponent();
    }

    private static boolean isIntegral(double exponent) {
        return exponent == Math.rint(exponent);
    }

    @Override
    public double evaluate(Expression expr, double[] childValues, PointValuation point) {
        double base = childValues[0];
        double exponent = exponentOf(expr);
        if (base < 0.0 && !isIntegral(exponent)) {
            return Expression.INVALID_VALUE;
        }
        if (base == 0.0 && exponent < 0.0) {
            return Expression.INVALID_VALUE;
        }
        double result = Math.pow(base, exponent);
        return Double.isFinite(result) ? result : Expression.INVALID_VALUE;
    }

    // ========== 化简 ==========

    @Override
    public Expression simplify(Expression expr, ExprEngine engine) {
        Expression result = simplifyPow(expr, engine);
        recordSimplifyCall(result != expr);
        return result;
    }

    private Expression simplifyPow(Expression expr, ExprEngine engine) {
        Expression base = expr.getChild(0);
        double exponent = exponentOf(expr);

        // 接近整数的指数取整
        double rounded = Math.rint(exponent);
        boolean roundedExponent = exponent != rounded && Math.abs(exponent - rounded) <= INTEGRALITY_EPSILON;
        if (roundedExponent) {
            exponent = rounded;
        }
        boolean integral = isIntegral(exponent);

        if (exponent == 0.0) {
            return engine.createValue(1.0);
        }
        if (exponent == 1.0) {
            engine.capture(base);
            return base;
        }
        if (engine.isValue(base)) {
            double value = engine.getValue(base);
            double folded = Math.pow(value, exponent);
            if (Double.isFinite(folded)) {
                return engine.createValue(folded);
            }
            logger.debug("常数幂 {}^{} 无法折叠", value, exponent);
        }
        if (exponent > 0.0 && engine.isVariable(base) && engine.getVariable(base).isBinary()) {
            // 0/1 变量的正数次幂等于自身
            engine.capture(base);
            return base;
        }
        if (integral && engine.isProduct(base)) {
            // (c * Π f_i)^n = c^n * Π f_i^n
            List<Expression> pows = new ArrayList<>(base.getNChildren());
            for (Expression factor : base.getChildren()) {
                Expression pow = engine.createPow(factor, exponent);
                pows.add(simplify(pow, engine));
                engine.release(pow);
            }
            double coefficient = Math.pow(((ProductData) base.getData()).getCoefficient(), exponent);
            Expression product = engine.createProduct(pows, coefficient);
            for (Expression pow : pows) {
                engine.release(pow);
            }
            Expression result = engine.getRegistry().getProductHandler().simplify(product, engine);
            engine.release(product);
            return result;
        }
        if (integral && engine.isPow(base)) {
            // (x^a)^n = x^(a*n)
            Expression pow = engine.createPow(base.getChild(0), exponentOf(base) * exponent);
            Expression result = simplify(pow, engine);
            engine.release(pow);
            return result;
        }
        if (engine.isSum(base) && base.getNChildren() == 1) {
            SumData data = (SumData) base.getData();
            double coefficient = data.getCoefficient(0);
            if (data.getConstant() == 0.0 && (integral || coefficient >= 0.0)) {
                // (c*x)^e = c^e * x^e
                Expression pow = engine.createPow(base.getChild(0), exponent);
                Expression simplifiedPow = simplify(pow, engine);
                engine.release(pow);
                Expression sum = engine.createSum(List.of(simplifiedPow),
                        new double[]{Math.pow(coefficient, exponent)}, 0.0);
                engine.release(simplifiedPow);
                Expression result = engine.getRegistry().getSumHandler().simplify(sum, engine);
                engine.release(sum);
                return result;
            }
        }
        if (roundedExponent) {
            return engine.createPow(base, exponent);
        }
        engine.capture(expr);
        return expr;
    }

    // ========== 比较、打印、哈希 ==========

    @Override
    public int compare(Expression expr1, Expression expr2, ExpressionComparator comparator) {
        int cmp = comparator.compare(expr1.getChild(0), expr2.getChild(0));
        if (cmp != 0) {
            return cmp;
        }
        return SumHandler.compareDoubles(exponentOf(expr1), exponentOf(expr2));
    }

    @Override
    public void print(ExprWalkFrame frame, StringBuilder out) {
        boolean parenthesize = PRECEDENCE <= frame.getParentPrecedence();
        switch (frame.getStage()) {
            case ENTER_EXPR:
                if (parenthesize) {
                    out.append('(');
                }
                break;
            case VISITED_CHILD:
                double exponent = exponentOf(frame.getExpr());
                out.append('^');
                if (exponent >= 0.0 && isIntegral(exponent)) {
                    out.append(ExpressionPrinter.formatNumber(exponent));
                } else {
                    out.append('(').append(ExpressionPrinter.formatNumber(exponent)).append(')');
                }
                break;
            case LEAVE_EXPR:
                if (parenthesize) {
                    out.append(')');
                }
                break;
            default:
                break;
        }
    }

    @Override
    public long hash(Expression expr, long[] childHashes) {
        return (NAME_HASH ^ HashUtils.fibHash(exponentOf(expr))) * 31 + childHashes[0];
    }

    // ========== 区间 ==========

    @Override
    public Interval intervalEval(Expression expr, LeafIntervalSource leafSource) {
        recordIntervalEval();
        return expr.getChild(0).getInterval().powerScalar(exponentOf(expr));
    }

    @Override
    public void reversePropagate(Expression expr, ReversePropagationContext context) {
        Interval target = expr.getInterval();
        Expression base = expr.getChild(0);
        double exponent = exponentOf(expr);
        recordReversePropCall();
        if (target.isEntire()) {
            // 非整数指数要求底数非负
            if (!isIntegral(exponent) && base.getInterval().getInf() < 0.0) {
                if (context.tighten(base, Interval.NONNEGATIVE)) {
                    recordCutoff();
                }
            }
            return;
        }
        Interval childBounds = target.powerScalarInverse(base.getInterval(), exponent);
        if (context.tighten(base, childBounds)) {
            recordCutoff();
        }
    }

    // ========== 导数与分析 ==========

    @Override
    public double backwardDiff(Expression expr, int childIndex) {
        double base = expr.getChild(0).getValue();
        double exponent = exponentOf(expr);
        if (base == 0.0 && exponent < 1.0) {
            return Expression.INVALID_VALUE;
        }
        if (base < 0.0 && !isIntegral(exponent)) {
            return Expression.INVALID_VALUE;
        }
        double result = exponent * Math.pow(base, exponent - 1.0);
        return Double.isFinite(result) ? result : Expression.INVALID_VALUE;
    }

    /**
     * 只处理底数为线性、凸或凹的常见组合，其余情况返回 UNKNOWN。
     */
    @Override
    public Curvature curvature(Expression expr) {
        Expression base = expr.getChild(0);
        Curvature baseCurvature = base.getCurvature();
        Interval domain = base.getInterval();
        double exponent = exponentOf(expr);
        boolean integral = isIntegral(exponent);
        boolean even = integral && Math.abs(exponent % 2.0) == 0.0;

        // 外层函数 t^exponent 在底数范围上的曲率与单调性
        Curvature outer;
        if (exponent > 1.0) {
            if (even || !integral || domain.getInf() >= 0.0) {
                outer = Curvature.CONVEX;
            } else if (domain.getSup() <= 0.0) {
                outer = Curvature.CONCAVE;
            } else {
                return Curvature.UNKNOWN;
            }
        } else if (exponent > 0.0) {
            outer = Curvature.CONCAVE;
        } else if (domain.getInf() > 0.0) {
            outer = Curvature.CONVEX;
        } else if (domain.getSup() < 0.0 && integral) {
            outer = even ? Curvature.CONVEX : Curvature.CONCAVE;
        } else {
            return Curvature.UNKNOWN;
        }
        if (baseCurvature == Curvature.LINEAR) {
            return outer;
        }
        Monotonicity monotonicity = monotonicity(expr, 0);
        // 凸且递增的函数作用于凸函数仍为凸，其余组合类推
        if (outer == Curvature.CONVEX && monotonicity == Monotonicity.INCREASING && baseCurvature == Curvature.CONVEX) {
            return Curvature.CONVEX;
        }
        if (outer == Curvature.CONVEX && monotonicity == Monotonicity.DECREASING && baseCurvature == Curvature.CONCAVE) {
            return Curvature.CONVEX;
        }
        if (outer == Curvature.CONCAVE && monotonicity == Monotonicity.INCREASING && baseCurvature == Curvature.CONCAVE) {
            return Curvature.CONCAVE;
        }
        if (outer == Curvature.CONCAVE && monotonicity == Monotonicity.DECREASING && baseCurvature == Curvature.CONVEX) {
            return Curvature.CONCAVE;
        }
        return Curvature.UNKNOWN;
    }

    @Override
    public Monotonicity monotonicity(Expression expr, int childIndex) {
        Interval domain = expr.getChild(0).getInterval();
        double exponent = exponentOf(expr);
        boolean integral = isIntegral(exponent);
        boolean odd = integral && Math.abs(exponent % 2.0) == 1.0;
        if (exponent > 0.0) {
            if (odd || domain.getInf() >= 0.0) {
                return Monotonicity.INCREASING;
            }
            if (integral && domain.getSup() <= 0.0) {
                return Monotonicity.DECREASING;
            }
            return Monotonicity.UNKNOWN;
        }
        if (domain.getInf() >= 0.0) {
            return Monotonicity.DECREASING;
        }
        if (integral && domain.getSup() <= 0.0) {
            return odd ? Monotonicity.DECREASING : Monotonicity.INCREASING;
        }
        return Monotonicity.UNKNOWN;
    }

    @Override
    public boolean integrality(Expression expr) {
        double exponent = exponentOf(expr);
        return exponent >= 0.0 && isIntegral(exponent) && expr.getChild(0).isIntegral();
    }
}
