package org.cipexpr.expressions.handlers;

import lombok.Getter;
import org.cipexpr.expressions.ExprData;

import java.util.Arrays;

/**
 * 和式 constant + Σ coefficients[i] * child[i] 的常数项与系数。
 * 系数与子节点一一对应。
 */
public final class SumData implements ExprData {

    @Getter
    private double constant;
    private double[] coefficients;

    public SumData(double constant, double[] coefficients) {
        this.constant = constant;
        this.coefficients = coefficients.clone();
    }

    public double getCoefficient(int index) {
        return coefficients[index];
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public int size() {
        return coefficients.length;
    }

    public void setConstant(double constant) {
        this.constant = constant;
    }

    public void setCoefficient(int index, double coefficient) {
        coefficients[index] = coefficient;
    }

    public void appendCoefficient(double coefficient) {
        coefficients = Arrays.copyOf(coefficients, coefficients.length + 1);
        coefficients[coefficients.length - 1] = coefficient;
    }

    @Override
    public SumData copy() {
        return new SumData(constant, coefficients);
    }
}
