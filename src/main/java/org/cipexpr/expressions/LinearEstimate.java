package org.cipexpr.expressions;

import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * 以子节点为变量的线性函数 c1*e1 + c2*e2 + ... + const，
 * 表示某个表达式在给定点附近的上估计或下估计。此类是不可变的。
 *
 * @author Ayalyt
 */
@Getter
public final class LinearEstimate {

    private final double[] coefficients;
    private final double constant;
    /** 为 true 时估计只在当前局部定义域内成立。 */
    private final boolean local;

    private LinearEstimate(double[] coefficients, double constant, boolean local) {
        this.coefficients = coefficients;
        this.constant = constant;
        this.local = local;
    }

    public static LinearEstimate of(double[] coefficients, double constant, boolean local) {
        Objects.requireNonNull(coefficients, "LinearEstimate: coefficients 不能为 null");
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("LinearEstimate: 系数必须有限: " + Arrays.toString(coefficients));
            }
        }
        return new LinearEstimate(coefficients.clone(), constant, local);
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public int size() {
        return coefficients.length;
    }

    public double getCoefficient(int index) {
        return coefficients[index];
    }

    /**
     * 在子节点取值 childValues 处计算此线性函数。
     */
    public double evaluate(double[] childValues) {
        if (childValues.length != coefficients.length) {
            throw new IllegalArgumentException("LinearEstimate: 取值个数 " + childValues.length
                    + " 与系数个数 " + coefficients.length + " 不一致");
        }
        double result = constant;
        for (int i = 0; i < coefficients.length; i++) {
            result += coefficients[i] * childValues[i];
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearEstimate that = (LinearEstimate) o;
        return Double.compare(constant, that.constant) == 0 && local == that.local
                && Arrays.equals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(coefficients), constant, local);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < coefficients.length; i++) {
            if (i > 0) {
                sb.append(" + ");
            }
            sb.append(coefficients[i]).append("*e").append(i);
        }
        if (coefficients.length > 0) {
            sb.append(" + ");
        }
        sb.append(constant);
        return local ? sb + " (local)" : sb.toString();
    }
}
