package org.cipexpr.utils;

import java.math.BigDecimal;

/**
 * 有向舍入的浮点运算。
 * 向下舍入的结果保证不大于精确值，向上舍入的结果保证不小于精确值。
 * Java 无法切换 FPU 舍入模式，这里用无误差变换 (TwoSum / FMA) 判断最近舍入的方向，
 * 只在需要时把结果挪动一个 ulp。
 * 向上舍入一律通过对向下舍入的结果取反得到。
 */
public final class DirectedRounding {

    private DirectedRounding() {
    }

    /**
     * 向下舍入的加法。
     * 相反符号的无穷相加时返回 -∞。
     */
    public static double addDown(double a, double b) {
        double s = a + b;
        if (Double.isNaN(s)) {
            return Double.NEGATIVE_INFINITY;
        }
        if (Double.isInfinite(a) || Double.isInfinite(b)) {
            return s;
        }
        if (s == Double.POSITIVE_INFINITY) {
            // 有限数相加溢出
            return Double.MAX_VALUE;
        }
        if (s == Double.NEGATIVE_INFINITY) {
            return s;
        }
        double bb = s - a;
        double err = (a - (s - bb)) + (b - bb);
        return err < 0.0 ? Math.nextDown(s) : s;
    }

    public static double addUp(double a, double b) {
        return -addDown(-a, -b);
    }

    public static double subDown(double a, double b) {
        return addDown(a, -b);
    }

    public static double subUp(double a, double b) {
        return addUp(a, -b);
    }

    /**
     * 向下舍入的乘法。0 * ∞ 按区间算术的约定取 0。
     */
    public static double mulDown(double a, double b) {
        if (a == 0.0 || b == 0.0) {
            return 0.0;
        }
        double p = a * b;
        if (Double.isInfinite(a) || Double.isInfinite(b)) {
            return p;
        }
        if (p == Double.POSITIVE_INFINITY) {
            return Double.MAX_VALUE;
        }
        if (p == Double.NEGATIVE_INFINITY) {
            return p;
        }
        if (Math.abs(p) < Double.MIN_NORMAL) {
            // 下溢区间内 FMA 的余项不再精确，改用精确的十进制乘积比较
            BigDecimal exactProduct = new BigDecimal(a).multiply(new BigDecimal(b));
            return new BigDecimal(p).compareTo(exactProduct) > 0 ? Math.nextDown(p) : p;
        }
        double err = Math.fma(a, b, -p);
        return err < 0.0 ? Math.nextDown(p) : p;
    }

    public static double mulUp(double a, double b) {
        return -mulDown(-a, b);
    }

    /**
     * 向下舍入的除法。调用方保证 b != 0；∞/∞ 返回 -∞。
     */
    public static double divDown(double a, double b) {
        double q = a / b;
        if (Double.isNaN(q)) {
            return Double.NEGATIVE_INFINITY;
        }
        if (Double.isInfinite(a) || Double.isInfinite(b)) {
            return q;
        }
        if (q == Double.POSITIVE_INFINITY) {
            return Double.MAX_VALUE;
        }
        if (q == Double.NEGATIVE_INFINITY) {
            return q;
        }
        if (a == 0.0) {
            return 0.0;
        }
        if (Math.abs(q) < Double.MIN_NORMAL) {
            // 精确商低于 q 当且仅当 q * b 与 a 的差和 b 同号
            int cmp = new BigDecimal(q).multiply(new BigDecimal(b)).compareTo(new BigDecimal(a));
            if (cmp == 0) {
                return q;
            }
            return (cmp > 0) == (b > 0.0) ? Math.nextDown(q) : q;
        }
        double r = Math.fma(-q, b, a);
        if (r == 0.0) {
            return q;
        }
        // 精确商 = q + r/b
        boolean trueBelow = (r < 0.0) != (b < 0.0);
        return trueBelow ? Math.nextDown(q) : q;
    }

    public static double divUp(double a, double b) {
        return -divDown(-a, b);
    }

    /**
     * 向下舍入的幂运算。{@link Math#pow} 的误差不超过 1 ulp，因此挪动一个 ulp 即可。
     * 有限底数上溢为 +∞ 时取 MAX_VALUE，下溢为 -0 时取 -MIN_VALUE。
     */
    public static double powDown(double base, double exponent) {
        if (exponent == 2.0) {
            return Math.max(0.0, mulDown(base, base));
        }
        double r = Math.pow(base, exponent);
        if (Double.isNaN(r)) {
            return Double.NEGATIVE_INFINITY;
        }
        if (isExactPower(base, exponent, r)) {
            return r;
        }
        if (Double.isInfinite(r)) {
            return r > 0.0 ? Double.MAX_VALUE : r;
        }
        if (r == 0.0) {
            return isNegativeZero(r) ? -Double.MIN_VALUE : 0.0;
        }
        return Math.nextDown(r);
    }

    public static double powUp(double base, double exponent) {
        if (exponent == 2.0) {
            return mulUp(base, base);
        }
        double r = Math.pow(base, exponent);
        if (Double.isNaN(r)) {
            return Double.POSITIVE_INFINITY;
        }
        if (isExactPower(base, exponent, r)) {
            return r;
        }
        if (Double.isInfinite(r)) {
            return r < 0.0 ? -Double.MAX_VALUE : r;
        }
        if (r == 0.0) {
            return isNegativeZero(r) ? 0.0 : Double.MIN_VALUE;
        }
        return Math.nextUp(r);
    }

    // 底数为 0、±∞ 或 1，或指数为 0 时 Math.pow 的结果是精确的
    private static boolean isExactPower(double base, double exponent, double r) {
        return base == 0.0 || Double.isInfinite(base)
                || r == 1.0 && (base == 1.0 || exponent == 0.0);
    }

    private static boolean isNegativeZero(double value) {
        return Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(-0.0);
    }
}
