package org.cipexpr.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Random;

import static org.cipexpr.utils.DirectedRounding.*;
import static org.junit.jupiter.api.Assertions.*;

class DirectedRoundingTest {

    private static BigDecimal exact(double d) {
        return new BigDecimal(d);
    }

    @Nested
    @DisplayName("加减法 (Addition)")
    class AdditionTests {

        @Test
        @DisplayName("可以精确表示的结果不应被挪动")
        void testExactSum_IsUnchanged() {
            assertAll(
                    () -> assertEquals(5.0, addDown(2.0, 3.0)),
                    () -> assertEquals(5.0, addUp(2.0, 3.0)),
                    () -> assertEquals(-1.0, subDown(2.0, 3.0)),
                    () -> assertEquals(-1.0, subUp(2.0, 3.0))
            );
        }

        @Test
        @DisplayName("0.1 + 0.2 的上下舍入应夹住精确值")
        void testInexactSum_IsBracketed() {
            BigDecimal trueSum = exact(0.1).add(exact(0.2));
            double lo = addDown(0.1, 0.2);
            double hi = addUp(0.1, 0.2);
            assertAll(
                    () -> assertTrue(exact(lo).compareTo(trueSum) <= 0, "down 应不大于精确值"),
                    () -> assertTrue(exact(hi).compareTo(trueSum) >= 0, "up 应不小于精确值"),
                    () -> assertTrue(lo < hi, "不精确时上下舍入应不同")
            );
        }

        @Test
        @DisplayName("相反符号的无穷相加：向下为 -∞，向上为 +∞")
        void testOppositeInfinities() {
            assertEquals(Double.NEGATIVE_INFINITY, addDown(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));
            assertEquals(Double.POSITIVE_INFINITY, addUp(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));
        }

        @Test
        @DisplayName("有限数溢出时向下舍入为 MAX_VALUE")
        void testFiniteOverflow() {
            assertEquals(Double.MAX_VALUE, addDown(Double.MAX_VALUE, Double.MAX_VALUE));
            assertEquals(Double.POSITIVE_INFINITY, addUp(Double.MAX_VALUE, Double.MAX_VALUE));
        }
    }

    @Nested
    @DisplayName("乘除法 (Multiplication and Division)")
    class MultiplicationTests {

        @Test
        @DisplayName("0 乘无穷按区间约定为 0")
        void testZeroTimesInfinity() {
            assertEquals(0.0, mulDown(0.0, Double.POSITIVE_INFINITY), 0.0);
            assertEquals(0.0, mulUp(Double.NEGATIVE_INFINITY, 0.0), 0.0);
        }

        @Test
        @DisplayName("1/3 的上下舍入应夹住精确值")
        void testOneThird() {
            double lo = divDown(1.0, 3.0);
            double hi = divUp(1.0, 3.0);
            assertTrue(lo < hi);
            assertTrue(exact(lo).multiply(exact(3.0)).compareTo(BigDecimal.ONE) <= 0);
            assertTrue(exact(hi).multiply(exact(3.0)).compareTo(BigDecimal.ONE) >= 0);
        }

        @ParameterizedTest(name = "随机种子 {0}")
        @ValueSource(longs = {1L, 7L, 42L})
        @DisplayName("随机乘法与除法的上下舍入都夹住精确值")
        void testRandomProductsAndQuotients(long seed) {
            Random random = new Random(seed);
            for (int i = 0; i < 500; i++) {
                double a = (random.nextDouble() - 0.5) * 1e6;
                double b = (random.nextDouble() - 0.5) * 1e3;
                if (b == 0.0) {
                    continue;
                }
                BigDecimal product = exact(a).multiply(exact(b));
                assertTrue(exact(mulDown(a, b)).compareTo(product) <= 0, "mulDown " + a + " * " + b);
                assertTrue(exact(mulUp(a, b)).compareTo(product) >= 0, "mulUp " + a + " * " + b);

                double lo = divDown(a, b);
                double hi = divUp(a, b);
                // lo <= a/b <=> lo*b <= a（b > 0）或 lo*b >= a（b < 0）
                int signB = b > 0 ? 1 : -1;
                assertTrue(exact(lo).multiply(exact(b)).compareTo(exact(a)) * signB <= 0, "divDown " + a + " / " + b);
                assertTrue(exact(hi).multiply(exact(b)).compareTo(exact(a)) * signB >= 0, "divUp " + a + " / " + b);
            }
        }
    }

    @Nested
    @DisplayName("零与次正规数 (Zero and Subnormal)")
    class SubnormalTests {

        @Test
        @DisplayName("0 除以非零数的结果精确为 0")
        void testZeroDividend() {
            assertAll(
                    () -> assertEquals(0.0, divDown(0.0, 1.0), 0.0),
                    () -> assertEquals(0.0, divUp(0.0, 1.0), 0.0),
                    () -> assertEquals(0.0, divDown(0.0, -3.0), 0.0),
                    () -> assertEquals(0.0, divUp(0.0, -3.0), 0.0)
            );
        }

        @Test
        @DisplayName("次正规数范围内精确的商不被挪动")
        void testExactSubnormalQuotient() {
            double a = Double.MIN_VALUE * 4;
            assertEquals(Double.MIN_VALUE * 2, divDown(a, 2.0));
            assertEquals(Double.MIN_VALUE * 2, divUp(a, 2.0));
        }

        @Test
        @DisplayName("下溢到 0 的商与积向外舍入")
        void testUnderflowIsBracketed() {
            assertAll(
                    () -> assertEquals(0.0, divDown(Double.MIN_VALUE, 2.0), 0.0),
                    () -> assertEquals(Double.MIN_VALUE, divUp(Double.MIN_VALUE, 2.0)),
                    () -> assertEquals(0.0, mulDown(Double.MIN_VALUE, 0.5), 0.0),
                    () -> assertEquals(Double.MIN_VALUE, mulUp(Double.MIN_VALUE, 0.5)),
                    () -> assertEquals(-Double.MIN_VALUE, mulDown(-Double.MIN_VALUE, 0.5))
            );
        }
    }

    @Nested
    @DisplayName("幂运算 (Power)")
    class PowerTests {

        @Test
        @DisplayName("平方使用乘法舍入，结果精确时不挪动")
        void testSquare() {
            assertEquals(9.0, powDown(3.0, 2.0));
            assertEquals(9.0, powUp(-3.0, 2.0));
        }

        @Test
        @DisplayName("一般指数下 powDown <= Math.pow <= powUp")
        void testGeneralExponent() {
            double r = Math.pow(2.0, 0.5);
            assertAll(
                    () -> assertTrue(powDown(2.0, 0.5) <= r),
                    () -> assertTrue(powUp(2.0, 0.5) >= r),
                    () -> assertEquals(1.0, powDown(1.0, 7.5)),
                    () -> assertEquals(0.0, powUp(0.0, 3.0), 0.0)
            );
        }

        @Test
        @DisplayName("上溢与下溢时仍向外舍入")
        void testOverflowAndUnderflow() {
            assertAll(
                    () -> assertEquals(Double.MAX_VALUE, powDown(1e200, 3.0)),
                    () -> assertEquals(Double.POSITIVE_INFINITY, powUp(1e200, 3.0)),
                    () -> assertEquals(-Double.MAX_VALUE, powUp(-1e200, 3.0)),
                    () -> assertEquals(Double.MIN_VALUE, powUp(1e-200, 3.0)),
                    () -> assertEquals(0.0, powDown(1e-200, 3.0), 0.0),
                    () -> assertEquals(-Double.MIN_VALUE, powDown(-1e-200, 3.0))
            );
        }
    }
}
