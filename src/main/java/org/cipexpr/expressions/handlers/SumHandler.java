package org.cipexpr.expressions.handlers;

import org.cipexpr.core.PointValuation;
import org.cipexpr.expressions.*;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.propagation.ReversePropagationContext;
import org.cipexpr.propagation.WeightedSumPropagation;
import org.cipexpr.utils.HashUtils;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * 加权和 constant + Σ c_i * e_i。
 * <p>
 * 规范形式：没有常数子节点，没有和式子节点，没有零系数，子节点按比较器严格递减排列且两两不等，
 * 不是"系数为 1、常数为 0 的单项和"。子节点 0 是和式的主项。
 *
 * @author Ayalyt
 */
public final class SumHandler extends ExprHandler {

    private static final Logger logger = LoggerFactory.getLogger(SumHandler.class);

    public static final String NAME = "sum";
    public static final int PRECEDENCE = 40000;

    private static final long NAME_HASH = HashUtils.stringHash(NAME);

    public SumHandler() {
        super(NAME, "weighted sum with constant", PRECEDENCE, EnumSet.of(
                ExprCapability.SIMPLIFY,
                ExprCapability.COMPARE,
                ExprCapability.PRINT,
                ExprCapability.HASH,
                ExprCapability.INTERVAL_EVAL,
                ExprCapability.REVERSE_PROP,
                ExprCapability.BACKWARD_DIFF,
                ExprCapability.CURVATURE,
                ExprCapability.MONOTONICITY,
                ExprCapability.INTEGRALITY,
                ExprCapability.ESTIMATE,
                ExprCapability.BRANCH_SCORE));
    }

    private static SumData dataOf(Expression expr) {
        return (SumData) expr.getData();
    }

    @Override
    public double evaluate(Expression expr, double[] childValues, PointValuation point) {
        SumData data = dataOf(expr);
        double result = data.getConstant();
        for (int i = 0; i < childValues.length; i++) {
            result += data.getCoefficient(i) * childValues[i];
        }
        return Double.isFinite(result) ? result : Expression.INVALID_VALUE;
    }

    // ========== 化简 ==========

    /**
     * 一个加项：系数与子表达式。
     */
    private static final class Term {
        private final Expression expr;
        private final double coefficient;

        private Term(Expression expr, double coefficient) {
            this.expr = expr;
            this.coefficient = coefficient;
        }
    }

    @Override
    public Expression simplify(Expression expr, ExprEngine engine) {
        SumData data = dataOf(expr);
        ExpressionComparator comparator = engine.getComparator();
        List<Term> terms = new ArrayList<>(expr.getNChildren());
        double constant = data.getConstant();
        boolean changed = false;

        for (int i = 0; i < expr.getNChildren(); i++) {
            Expression child = expr.getChild(i);
            double coefficient = data.getCoefficient(i);
            if (coefficient == 0.0) {
                changed = true;
                continue;
            }
            if (engine.isValue(child)) {
                constant += coefficient * engine.getValue(child);
                changed = true;
                continue;
            }
            List<Term> toMerge = new ArrayList<>();
            if (engine.isSum(child)) {
                // 展开子和式，子和式本身已是规范形式，展开后仍有序
                SumData childData = dataOf(child);
                constant += coefficient * childData.getConstant();
                for (int j = 0; j < child.getNChildren(); j++) {
                    double c = coefficient * childData.getCoefficient(j);
                    if (c != 0.0) {
                        toMerge.add(new Term(child.getChild(j), c));
                    }
                }
                changed = true;
            } else {
                toMerge.add(new Term(child, coefficient));
            }
            changed |= mergeTerms(terms, toMerge, comparator);
        }

        Expression result;
        if (terms.isEmpty()) {
            result = engine.createValue(constant);
        } else if (terms.size() == 1 && terms.get(0).coefficient == 1.0 && constant == 0.0) {
            result = terms.get(0).expr;
            engine.capture(result);
        } else if (!changed) {
            result = expr;
            engine.capture(result);
        } else {
            List<Expression> children = new ArrayList<>(terms.size());
            double[] coefficients = new double[terms.size()];
            for (int i = 0; i < terms.size(); i++) {
                children.add(terms.get(i).expr);
                coefficients[i] = terms.get(i).coefficient;
            }
            result = engine.createSum(children, coefficients, constant);
        }
        recordSimplifyCall(result != expr);
        return result;
    }

    /**
     * 把有序的 toMerge 归并进有序的 target（都按递减排列），相等的项合并系数，系数为 0 的项删除。
     * @return 如果 target 发生了追加到末尾以外的改变。
     */
    private static boolean mergeTerms(List<Term> target, List<Term> toMerge, ExpressionComparator comparator) {
        List<Term> merged = new ArrayList<>(target.size() + toMerge.size());
        boolean changed = false;
        int i = 0;
        int j = 0;
        while (i < target.size() && j < toMerge.size()) {
            Term existing = target.get(i);
            Term incoming = toMerge.get(j);
            int cmp = comparator.compare(existing.expr, incoming.expr);
            if (cmp == 0) {
                double c = existing.coefficient + incoming.coefficient;
                if (c != 0.0) {
                    merged.add(new Term(existing.expr, c));
                }
                changed = true;
                i++;
                j++;
            } else if (cmp > 0) {
                merged.add(existing);
                i++;
            } else {
                merged.add(incoming);
                changed = true;
                j++;
            }
        }
        while (i < target.size()) {
            merged.add(target.get(i++));
        }
        while (j < toMerge.size()) {
            merged.add(toMerge.get(j++));
        }
        target.clear();
        target.addAll(merged);
        return changed;
    }

    // ========== 比较、打印、哈希 ==========

    /**
     * 从主项开始逐项比较子节点，再比较系数；公共部分相同时项少的较小；最后比较常数。
     */
    @Override
    public int compare(Expression expr1, Expression expr2, ExpressionComparator comparator) {
        SumData data1 = dataOf(expr1);
        SumData data2 = dataOf(expr2);
        int n = Math.min(expr1.getNChildren(), expr2.getNChildren());
        for (int i = 0; i < n; i++) {
            int cmp = comparator.compare(expr1.getChild(i), expr2.getChild(i));
            if (cmp != 0) {
                return cmp;
            }
            cmp = compareDoubles(data1.getCoefficient(i), data2.getCoefficient(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        if (expr1.getNChildren() != expr2.getNChildren()) {
            return expr1.getNChildren() < expr2.getNChildren() ? -1 : 1;
        }
        return compareDoubles(data1.getConstant(), data2.getConstant());
    }

    static int compareDoubles(double a, double b) {
        if (a < b) {
            return -1;
        }
        return a > b ? 1 : 0;
    }

    @Override
    public void print(ExprWalkFrame frame, StringBuilder out) {
        Expression expr = frame.getExpr();
        SumData data = dataOf(expr);
        boolean parenthesize = PRECEDENCE <= frame.getParentPrecedence();
        switch (frame.getStage()) {
            case ENTER_EXPR:
                if (parenthesize) {
                    out.append('(');
                }
                if (data.getConstant() != 0.0 || expr.getNChildren() == 0) {
                    out.append(ExpressionPrinter.formatNumber(data.getConstant()));
                }
                break;
            case VISITING_CHILD:
                int i = frame.getCurrentChild();
                double coefficient = data.getCoefficient(i);
                boolean first = i == 0 && data.getConstant() == 0.0;
                if (coefficient == 1.0) {
                    if (!first) {
                        out.append('+');
                    }
                } else if (coefficient == -1.0) {
                    out.append('-');
                } else {
                    if (!first && coefficient > 0.0) {
                        out.append('+');
                    }
                    out.append(ExpressionPrinter.formatNumber(coefficient)).append('*');
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
        SumData data = dataOf(expr);
        long h = NAME_HASH ^ HashUtils.fibHash(data.getConstant());
        for (int i = 0; i < childHashes.length; i++) {
            h += HashUtils.fibHash(data.getCoefficient(i)) ^ childHashes[i];
        }
        return h;
    }

    // ========== 区间 ==========

    @Override
    public Interval intervalEval(Expression expr, LeafIntervalSource leafSource) {
        SumData data = dataOf(expr);
        Interval result = Interval.point(data.getConstant());
        for (int i = 0; i < expr.getNChildren(); i++) {
            Interval childInterval = expr.getChild(i).getInterval();
            if (childInterval.isEmpty()) {
                return Interval.EMPTY;
            }
            result = result.add(childInterval.mulScalar(data.getCoefficient(i)));
        }
        recordIntervalEval();
        return result;
    }

    @Override
    public void reversePropagate(Expression expr, ReversePropagationContext context) {
        Interval target = expr.getInterval();
        recordReversePropCall();
        if (target.isEntire()) {
            return;
        }
        SumData data = dataOf(expr);
        int n = expr.getNChildren();
        Interval[] childIntervals = new Interval[n];
        for (int i = 0; i < n; i++) {
            childIntervals[i] = expr.getChild(i).getInterval();
        }
        Interval[] bounds = WeightedSumPropagation.computeChildBounds(
                childIntervals, data.getCoefficients(), data.getConstant(), target);
        for (int i = 0; i < n; i++) {
            if (context.tighten(expr.getChild(i), bounds[i])) {
                logger.debug("和式 {} 的逆向传播发现不可行", expr.getSerial());
                recordCutoff();
                return;
            }
        }
    }

    // ========== 导数与分析 ==========

    @Override
    public double backwardDiff(Expression expr, int childIndex) {
        return dataOf(expr).getCoefficient(childIndex);
    }

    @Override
    public Curvature curvature(Expression expr) {
        SumData data = dataOf(expr);
        Curvature result = Curvature.LINEAR;
        for (int i = 0; i < expr.getNChildren(); i++) {
            result = result.and(expr.getChild(i).getCurvature().multiply(data.getCoefficient(i)));
        }
        return result;
    }

    @Override
    public Monotonicity monotonicity(Expression expr, int childIndex) {
        double coefficient = dataOf(expr).getCoefficient(childIndex);
        if (coefficient == 0.0) {
            return Monotonicity.CONSTANT;
        }
        return coefficient > 0.0 ? Monotonicity.INCREASING : Monotonicity.DECREASING;
    }

    @Override
    public boolean integrality(Expression expr) {
        SumData data = dataOf(expr);
        if (data.getConstant() != Math.rint(data.getConstant())) {
            return false;
        }
        for (int i = 0; i < expr.getNChildren(); i++) {
            double c = data.getCoefficient(i);
            if (c != Math.rint(c) || !expr.getChild(i).isIntegral()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 和式关于子节点是线性的，估计就是它自身，上下估计相同。
     */
    @Override
    public LinearEstimate estimate(Expression expr, PointValuation point, boolean overestimate) {
        recordEstimateCall();
        SumData data = dataOf(expr);
        return LinearEstimate.of(data.getCoefficients(), data.getConstant(), false);
    }

    @Override
    public double branchScore(Expression expr, PointValuation point, double auxValue) {
        SumData data = dataOf(expr);
        double value = data.getConstant();
        for (int i = 0; i < expr.getNChildren(); i++) {
            double childValue = expr.getChild(i).getValue();
            if (Double.isNaN(childValue)) {
                return 0.0;
            }
            value += data.getCoefficient(i) * childValue;
        }
        return Math.abs(auxValue - value);
    }
}
