package org.cipexpr.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntervalTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    @Nested
    @DisplayName("构造与谓词 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("下界大于上界时得到空区间")
        void testInvertedBounds_YieldEmpty() {
            Interval empty = Interval.of(3.0, 1.0);
            assertAll(
                    () -> assertTrue(empty.isEmpty()),
                    () -> assertEquals(Interval.EMPTY, empty),
                    () -> assertEquals("∅", empty.toString()),
                    () -> assertFalse(empty.contains(2.0))
            );
        }

        @Test
        @DisplayName("NaN 端点应抛出异常")
        void testNaN_Throws() {
            assertThrows(IllegalArgumentException.class, () -> Interval.of(Double.NaN, 1.0));
        }

        @Test
        @DisplayName("ofBounds 把绝对值不小于 infinity 的界视为无穷")
        void testOfBounds() {
            Interval iv = Interval.ofBounds(-1e20, 5.0, 1e20);
            assertEquals(Double.NEGATIVE_INFINITY, iv.getInf());
            assertEquals(5.0, iv.getSup());
            assertTrue(Interval.ofBounds(-1e25, 1e25, 1e20).isEntire());
        }

        @Test
        @DisplayName("-0.0 被统一为 0.0")
        void testNegativeZero() {
            assertEquals(Interval.ZERO, Interval.of(-0.0, 0.0));
            assertEquals(Interval.of(0.0, 1.0).hashCode(), Interval.of(-0.0, 1.0).hashCode());
        }
    }

    @Nested
    @DisplayName("算术 (Arithmetic)")
    class ArithmeticTests {

        @Test
        @DisplayName("[0,2] + [0,3] = [0,5]")
        void testAdd() {
            assertEquals(Interval.of(0.0, 5.0), Interval.of(0.0, 2.0).add(Interval.of(0.0, 3.0)));
        }

        @Test
        @DisplayName("与空区间运算得到空区间")
        void testEmptyPropagates() {
            assertTrue(Interval.EMPTY.add(Interval.of(0.0, 1.0)).isEmpty());
            assertTrue(Interval.of(0.0, 1.0).mul(Interval.EMPTY).isEmpty());
        }

        @Test
        @DisplayName("乘以负数会交换端点")
        void testMulScalarNegative() {
            assertEquals(Interval.of(-6.0, 2.0), Interval.of(-1.0, 3.0).mulScalar(-2.0));
        }

        @Test
        @DisplayName("[-1,2] * [3,4] = [-4,8]")
        void testMul() {
            assertEquals(Interval.of(-4.0, 8.0), Interval.of(-1.0, 2.0).mul(Interval.of(3.0, 4.0)));
        }

        @Test
        @DisplayName("除数包含 0 时给出半无界结果或整个实数轴")
        void testDivByZeroContaining() {
            assertAll(
                    () -> assertEquals(Interval.of(0.5, INF), Interval.of(1.0, 2.0).div(Interval.of(0.0, 2.0))),
                    () -> assertEquals(Interval.of(-INF, -0.5), Interval.of(1.0, 2.0).div(Interval.of(-2.0, 0.0))),
                    () -> assertTrue(Interval.of(-1.0, 2.0).div(Interval.of(0.0, 2.0)).isEntire()),
                    () -> assertTrue(Interval.of(1.0, 2.0).div(Interval.ZERO).isEntire())
            );
        }

        @Test
        @DisplayName("交与包")
        void testIntersectAndHull() {
            Interval a = Interval.of(0.0, 2.0);
            Interval b = Interval.of(1.0, 3.0);
            assertEquals(Interval.of(1.0, 2.0), a.intersect(b));
            assertEquals(Interval.of(0.0, 3.0), a.hull(b));
            assertTrue(a.intersect(Interval.of(5.0, 6.0)).isEmpty());
            assertEquals(a, Interval.EMPTY.hull(a));
        }
    }

    @Nested
    @DisplayName("幂 (Power)")
    class PowerTests {

        @Test
        @DisplayName("偶数次幂在跨 0 的区间上下界为 0")
        void testEvenPowerAcrossZero() {
            Interval sq = Interval.of(-2.0, 3.0).powerScalar(2.0);
            assertEquals(0.0, sq.getInf());
            assertEquals(9.0, sq.getSup());
        }

        @Test
        @DisplayName("奇数次幂保持单调并向外舍入")
        void testOddPower() {
            Interval cube = Interval.of(-2.0, 3.0).powerScalar(3.0);
            assertTrue(cube.contains(-8.0));
            assertTrue(cube.contains(27.0));
            assertTrue(cube.getInf() >= -8.0 - 1e-12 && cube.getSup() <= 27.0 + 1e-12);
        }

        @Test
        @DisplayName("非整数指数只取非负部分")
        void testFractionalPower() {
            Interval root = Interval.of(-4.0, 4.0).powerScalar(0.5);
            assertEquals(0.0, root.getInf());
            assertTrue(root.contains(2.0));
            assertTrue(Interval.of(-4.0, -1.0).powerScalar(0.5).isEmpty());
        }

        @Test
        @DisplayName("负指数：x^-1 在 [0,2] 上为 [0.5, +∞]")
        void testNegativeExponent() {
            Interval inv = Interval.of(0.0, 2.0).powerScalar(-1.0);
            assertTrue(inv.contains(0.5));
            assertEquals(INF, inv.getSup());
            assertTrue(Interval.ZERO.powerScalar(-1.0).isEmpty());
        }

        @Test
        @DisplayName("平方的逆：y ∈ [1,4] 且 x ∈ [-10,10] 时 x ∈ [-2,2] 的外包")
        void testSquareInverse() {
            Interval x = Interval.of(1.0, 4.0).powerScalarInverse(Interval.of(-10.0, 10.0), 2.0);
            assertTrue(x.contains(-2.0) && x.contains(2.0));
            assertTrue(x.getSup() < 2.0 + 1e-9 && x.getInf() > -2.0 - 1e-9);
        }

        @Test
        @DisplayName("平方的逆与子节点非负范围取交")
        void testSquareInverse_WithPositiveChild() {
            Interval x = Interval.of(1.0, 4.0).powerScalarInverse(Interval.of(0.0, 10.0), 2.0);
            assertTrue(x.getInf() > 0.99 && x.getInf() <= 1.0);
            assertTrue(x.getSup() >= 2.0 && x.getSup() < 2.0 + 1e-9);
        }

        @Test
        @DisplayName("倒数的逆：y ∈ [0.25, 0.5] 时 x ∈ [2, 4]，负支为空")
        void testReciprocalInverse_PositiveBranch() {
            Interval x = Interval.of(0.25, 0.5).powerScalarInverse(Interval.of(-10.0, 10.0), -1.0);
            assertAll(
                    () -> assertTrue(x.contains(2.0) && x.contains(4.0)),
                    () -> assertEquals(2.0, x.getInf(), 1e-9),
                    () -> assertEquals(4.0, x.getSup(), 1e-9)
            );
        }

        @Test
        @DisplayName("倒数的逆：y ∈ [-1, -0.5] 时 x ∈ [-2, -1]")
        void testReciprocalInverse_NegativeBranch() {
            Interval x = Interval.of(-1.0, -0.5).powerScalarInverse(Interval.of(-10.0, 10.0), -1.0);
            assertAll(
                    () -> assertTrue(x.contains(-2.0) && x.contains(-1.0)),
                    () -> assertEquals(-2.0, x.getInf(), 1e-9),
                    () -> assertEquals(-1.0, x.getSup(), 1e-9)
            );
        }

        @Test
        @DisplayName("x^-2 的逆取两支的并，再与子节点范围取交")
        void testEvenNegativeInverse() {
            Interval both = Interval.of(0.25, 1.0).powerScalarInverse(Interval.of(-10.0, 10.0), -2.0);
            assertEquals(-2.0, both.getInf(), 1e-9);
            assertEquals(2.0, both.getSup(), 1e-9);

            Interval positiveOnly = Interval.of(0.25, 1.0).powerScalarInverse(Interval.of(0.0, 10.0), -2.0);
            assertEquals(1.0, positiveOnly.getInf(), 1e-9);
            assertEquals(2.0, positiveOnly.getSup(), 1e-9);

            assertTrue(Interval.of(-3.0, -1.0).powerScalarInverse(Interval.of(-10.0, 10.0), -2.0).isEmpty());
        }
    }
}
