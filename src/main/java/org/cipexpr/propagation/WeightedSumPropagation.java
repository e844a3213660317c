package org.cipexpr.propagation;

import org.cipexpr.utils.Interval;

import java.util.Arrays;

import static org.cipexpr.utils.DirectedRounding.addDown;
import static org.cipexpr.utils.DirectedRounding.subDown;

/**
 * 加权和的逆向传播公式：已知 constant + Σ w_i x_i ∈ target，求每个 x_i 的候选区间。
 * <p>
 * 最小活动量与最大活动量都以向下舍入累加，最大活动量通过对相反数累加得到，
 * 所以浮点误差只会放宽候选区间。某一侧有两个以上的无界项时，这一侧对任何子项都推不出有限界；
 * 恰有一个无界项时，只有那个无界项能得到有限界。
 *
 * @author Ayalyt
 */
public final class WeightedSumPropagation {

    private WeightedSumPropagation() {
    }

    /**
     * @param childIntervals 子项当前区间。
     * @param coefficients 子项系数，与 childIntervals 等长。
     * @param constant 常数项。
     * @param target 整个和式所属的区间。
     * @return 每个子项的候选区间；推不出时为 {@link Interval#ENTIRE}。
     */
    public static Interval[] computeChildBounds(Interval[] childIntervals, double[] coefficients,
                                                double constant, Interval target) {
        int n = childIntervals.length;
        if (coefficients.length != n) {
            throw new IllegalArgumentException("系数个数 " + coefficients.length + " 与子项个数 " + n + " 不一致");
        }
        Interval[] result = new Interval[n];
        Arrays.fill(result, Interval.ENTIRE);
        if (target.isEntire() || target.isEmpty()) {
            return result;
        }

        Interval[] terms = new Interval[n];
        double minActivity = constant;
        // 存放最大活动量的相反数，以便全程向下舍入
        double negMaxActivity = -constant;
        int minActivityInf = 0;
        int maxActivityInf = 0;
        for (int i = 0; i < n; i++) {
            terms[i] = childIntervals[i].mulScalar(coefficients[i]);
            if (terms[i].isEmpty()) {
                return result;
            }
            if (terms[i].getSup() == Double.POSITIVE_INFINITY) {
                maxActivityInf++;
            } else {
                negMaxActivity = subDown(negMaxActivity, terms[i].getSup());
            }
            if (terms[i].getInf() == Double.NEGATIVE_INFINITY) {
                minActivityInf++;
            } else {
                minActivity = addDown(minActivity, terms[i].getInf());
            }
        }
        double maxActivity = -negMaxActivity;

        boolean upperUseless = minActivityInf >= 2 || target.getSup() == Double.POSITIVE_INFINITY;
        boolean lowerUseless = maxActivityInf >= 2 || target.getInf() == Double.NEGATIVE_INFINITY;
        if (upperUseless && lowerUseless) {
            return result;
        }

        for (int i = 0; i < n; i++) {
            if (coefficients[i] == 0.0) {
                continue;
            }
            double hi = Double.POSITIVE_INFINITY;
            if (target.getSup() != Double.POSITIVE_INFINITY) {
                if (terms[i].getInf() == Double.NEGATIVE_INFINITY && minActivityInf == 1) {
                    hi = -subDown(minActivity, target.getSup());
                } else if (minActivityInf == 0) {
                    hi = -subDown(subDown(minActivity, target.getSup()), terms[i].getInf());
                }
            }
            double lo = Double.NEGATIVE_INFINITY;
            if (target.getInf() != Double.NEGATIVE_INFINITY) {
                if (terms[i].getSup() == Double.POSITIVE_INFINITY && maxActivityInf == 1) {
                    lo = subDown(target.getInf(), maxActivity);
                } else if (maxActivityInf == 0) {
                    lo = addDown(subDown(target.getInf(), maxActivity), terms[i].getSup());
                }
            }
            result[i] = Interval.of(lo, hi).div(Interval.point(coefficients[i]));
        }
        return result;
    }
}
