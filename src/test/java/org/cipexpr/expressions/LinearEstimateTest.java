package org.cipexpr.expressions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearEstimateTest {

    @Test
    @DisplayName("系数被复制，外部修改不影响估计")
    void testCoefficientsCopied() {
        double[] coefficients = {1.0, -2.0};
        LinearEstimate estimate = LinearEstimate.of(coefficients, 3.0, true);
        coefficients[0] = 100.0;
        estimate.getCoefficients()[1] = 100.0;
        assertAll(
                () -> assertEquals(2, estimate.size()),
                () -> assertEquals(1.0, estimate.getCoefficient(0)),
                () -> assertEquals(-2.0, estimate.getCoefficient(1)),
                () -> assertEquals(3.0, estimate.getConstant()),
                () -> assertTrue(estimate.isLocal()),
                () -> assertEquals(1.0 - 4.0 + 3.0, estimate.evaluate(new double[]{1.0, 2.0}), 1e-12)
        );
    }

    @Test
    @DisplayName("非有限系数与取值个数不符时抛出异常")
    void testInvalidInput() {
        LinearEstimate estimate = LinearEstimate.of(new double[]{1.0}, 0.0, false);
        assertAll(
                () -> assertThrows(IllegalArgumentException.class,
                        () -> LinearEstimate.of(new double[]{Double.NaN}, 0.0, false)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> LinearEstimate.of(new double[]{Double.POSITIVE_INFINITY}, 0.0, false)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> estimate.evaluate(new double[]{1.0, 2.0}))
        );
    }

    @Test
    @DisplayName("相等性按系数、常数与局部标记判断")
    void testEquality() {
        LinearEstimate a = LinearEstimate.of(new double[]{1.0, 1.0}, 0.0, false);
        assertAll(
                () -> assertEquals(a, LinearEstimate.of(new double[]{1.0, 1.0}, 0.0, false)),
                () -> assertEquals(a.hashCode(), LinearEstimate.of(new double[]{1.0, 1.0}, 0.0, false).hashCode()),
                () -> assertNotEquals(a, LinearEstimate.of(new double[]{1.0, 1.0}, 0.0, true)),
                () -> assertNotEquals(a, LinearEstimate.of(new double[]{1.0, 2.0}, 0.0, false)),
                () -> assertEquals("1.0*e0 + 1.0*e1 + 0.0", a.toString())
        );
    }
}
