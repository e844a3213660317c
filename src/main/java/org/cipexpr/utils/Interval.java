package org.cipexpr.utils; // 放在 utils 包下

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.cipexpr.utils.DirectedRounding.*;

/**
 * 闭区间 [inf, sup]，端点可以是 ±∞。
 * 所有运算都用有向舍入计算，结果区间一定包含精确结果。
 * 此类是不可变的。
 *
 * @author Ayalyt
 */
@Getter
public final class Interval {

    private static final Logger logger = LoggerFactory.getLogger(Interval.class);

    private final double inf;
    private final double sup;

    // 常用常量
    public static final Interval ENTIRE = new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    public static final Interval EMPTY = new Interval(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);
    public static final Interval ZERO = new Interval(0.0, 0.0);
    public static final Interval NONNEGATIVE = new Interval(0.0, Double.POSITIVE_INFINITY);

    /**
     * 私有构造函数，端点不做检查。
     */
    private Interval(double inf, double sup) {
        this.inf = inf;
        this.sup = sup;
    }

    // ========== 工厂方法 ==========

    /**
     * 创建区间 [inf, sup]。inf > sup 时返回 {@link #EMPTY}。
     * @throws IllegalArgumentException 如果任一端点为 NaN。
     */
    public static Interval of(double inf, double sup) {
        if (Double.isNaN(inf) || Double.isNaN(sup)) {
            logger.error("Interval.of: 端点不能为 NaN: [{}, {}]", inf, sup);
            throw new IllegalArgumentException("区间端点不能为 NaN: [" + inf + ", " + sup + "]");
        }
        if (inf > sup) {
            return EMPTY;
        }
        if (inf == Double.NEGATIVE_INFINITY && sup == Double.POSITIVE_INFINITY) {
            return ENTIRE;
        }
        // -0.0 统一成 0.0
        return new Interval(inf == 0.0 ? 0.0 : inf, sup == 0.0 ? 0.0 : sup);
    }

    public static Interval point(double value) {
        if (Double.isInfinite(value)) {
            logger.error("Interval.point: 无法用无穷值 {} 创建单点区间", value);
            throw new IllegalArgumentException("单点区间的值必须有限: " + value);
        }
        return of(value, value);
    }

    /**
     * 把绝对值不小于 infinity 的端点视为无穷后创建区间。
     */
    public static Interval ofBounds(double lb, double ub, double infinity) {
        double lo = lb <= -infinity ? Double.NEGATIVE_INFINITY : lb;
        double hi = ub >= infinity ? Double.POSITIVE_INFINITY : ub;
        return of(lo, hi);
    }

    // ========== 谓词 ==========

    public boolean isEmpty() {
        return inf > sup;
    }

    public boolean isEntire() {
        return inf == Double.NEGATIVE_INFINITY && sup == Double.POSITIVE_INFINITY;
    }

    public boolean isPoint() {
        return inf == sup;
    }

    public boolean contains(double value) {
        return !isEmpty() && inf <= value && value <= sup;
    }

    public boolean contains(Interval other) {
        if (other.isEmpty()) {
            return true;
        }
        return !isEmpty() && inf <= other.inf && other.sup <= sup;
    }

    // ========== 集合运算 ==========

    public Interval intersect(Interval other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        return of(Math.max(inf, other.inf), Math.min(sup, other.sup));
    }

    public Interval hull(Interval other) {
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        return of(Math.min(inf, other.inf), Math.max(sup, other.sup));
    }

    /**
     * 两侧各放宽 amount。
     */
    public Interval widen(double amount) {
        if (isEmpty() || amount <= 0.0) {
            return this;
        }
        return of(subDown(inf, amount), addUp(sup, amount));
    }

    // ========== 算术运算 ==========

    public Interval negate() {
        if (isEmpty()) {
            return EMPTY;
        }
        return of(-sup, -inf);
    }

    public Interval add(Interval other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        return of(addDown(inf, other.inf), addUp(sup, other.sup));
    }

    public Interval add(double scalar) {
        return add(point(scalar));
    }

    public Interval mulScalar(double scalar) {
        if (isEmpty()) {
            return EMPTY;
        }
        if (scalar == 0.0) {
            return ZERO;
        }
        if (scalar > 0.0) {
            return of(mulDown(inf, scalar), mulUp(sup, scalar));
        }
        return of(mulDown(sup, scalar), mulUp(inf, scalar));
    }

    public Interval mul(Interval other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        double lo = Math.min(Math.min(mulDown(inf, other.inf), mulDown(inf, other.sup)),
                Math.min(mulDown(sup, other.inf), mulDown(sup, other.sup)));
        double hi = Math.max(Math.max(mulUp(inf, other.inf), mulUp(inf, other.sup)),
                Math.max(mulUp(sup, other.inf), mulUp(sup, other.sup)));
        return of(lo, hi);
    }

    /**
     * 区间除法。除数包含 0 时只在能确定符号的情况下给出半无界结果，否则返回 {@link #ENTIRE}。
     */
    public Interval div(Interval divisor) {
        if (isEmpty() || divisor.isEmpty()) {
            return EMPTY;
        }
        if (divisor.contains(0.0)) {
            if (divisor.isPoint()) {
                return ENTIRE;
            }
            if (divisor.inf == 0.0) {
                // 除数为 [0, s]，s > 0
                if (inf >= 0.0) {
                    return of(divDown(inf, divisor.sup), Double.POSITIVE_INFINITY);
                }
                if (sup <= 0.0) {
                    return of(Double.NEGATIVE_INFINITY, divUp(sup, divisor.sup));
                }
            } else if (divisor.sup == 0.0) {
                // 除数为 [s, 0]，s < 0
                if (inf >= 0.0) {
                    return of(Double.NEGATIVE_INFINITY, divUp(inf, divisor.inf));
                }
                if (sup <= 0.0) {
                    return of(divDown(sup, divisor.inf), Double.POSITIVE_INFINITY);
                }
            }
            return ENTIRE;
        }
        double lo = Math.min(Math.min(divDown(inf, divisor.inf), divDown(inf, divisor.sup)),
                Math.min(divDown(sup, divisor.inf), divDown(sup, divisor.sup)));
        double hi = Math.max(Math.max(divUp(inf, divisor.inf), divUp(inf, divisor.sup)),
                Math.max(divUp(sup, divisor.inf), divUp(sup, divisor.sup)));
        return of(lo, hi);
    }

    /**
     * 计算 { x^exponent : x ∈ this }。
     * 非整数指数只在 x ≥ 0 的部分有定义；负指数时去掉 0。
     */
    public Interval powerScalar(double exponent) {
        if (isEmpty()) {
            return EMPTY;
        }
        if (exponent == 0.0) {
            return point(1.0);
        }
        if (exponent == 1.0) {
            return this;
        }
        boolean integral = exponent == Math.rint(exponent);
        if (!integral) {
            Interval domain = intersect(NONNEGATIVE);
            if (domain.isEmpty()) {
                return EMPTY;
            }
            return monotonePower(domain, exponent);
        }
        boolean even = Math.abs(exponent % 2.0) == 0.0;
        if (exponent > 0.0) {
            if (even) {
                if (inf >= 0.0) {
                    return of(powDown(inf, exponent), powUp(sup, exponent));
                }
                if (sup <= 0.0) {
                    return of(powDown(-sup, exponent), powUp(-inf, exponent));
                }
                double m = Math.max(-inf, sup);
                return of(0.0, powUp(m, exponent));
            }
            // 奇数次幂单调递增
            return of(signedPowDown(inf, exponent), signedPowUp(sup, exponent));
        }
        // 负整数指数
        if (inf > 0.0 || sup < 0.0) {
            if (inf > 0.0) {
                return of(powDown(sup, exponent), powUp(inf, exponent));
            }
            if (even) {
                return of(powDown(-inf, exponent), powUp(-sup, exponent));
            }
            return of(signedPowDown(sup, exponent), signedPowUp(inf, exponent));
        }
        if (isPoint()) {
            // {0}
            return EMPTY;
        }
        if (inf == 0.0) {
            return of(powDown(sup, exponent), Double.POSITIVE_INFINITY);
        }
        if (sup == 0.0) {
            if (even) {
                return of(powDown(-inf, exponent), Double.POSITIVE_INFINITY);
            }
            return of(Double.NEGATIVE_INFINITY, signedPowUp(inf, exponent));
        }
        // 区间内部含 0
        if (even) {
            return of(0.0, Double.POSITIVE_INFINITY);
        }
        return ENTIRE;
    }

    /**
     * 幂运算的逆：给定 y = x^exponent 的范围 this 与 x 的当前范围 childBounds，
     * 返回包含所有可行 x 的区间。无法有效求逆的情况直接返回 childBounds。
     */
    public Interval powerScalarInverse(Interval childBounds, double exponent) {
        if (isEmpty() || childBounds.isEmpty()) {
            return EMPTY;
        }
        if (exponent == 0.0) {
            return contains(1.0) ? childBounds : EMPTY;
        }
        if (exponent == 1.0) {
            return intersect(childBounds);
        }
        boolean integral = exponent == Math.rint(exponent);
        if (!integral || exponent < 0.0) {
            if (!integral && exponent > 0.0) {
                // x ≥ 0 上单调递增，x = y^(1/e)
                Interval image = intersect(NONNEGATIVE);
                if (image.isEmpty()) {
                    return EMPTY;
                }
                Interval root = of(
                        Math.max(0.0, powDown(image.inf, 1.0 / exponent)),
                        powUp(image.sup, 1.0 / exponent));
                return root.widen(ulpOf(root)).intersect(childBounds.intersect(NONNEGATIVE));
            }
            if (!integral) {
                // 负的非整数指数：x > 0 上单调递减
                return decreasingRoot(this, exponent).intersect(childBounds);
            }
            // 负整数指数：x > 0 与 x < 0 两支分别单调，分别求逆后取并
            boolean even = Math.abs(exponent % 2.0) == 0.0;
            Interval positive = decreasingRoot(this, exponent).intersect(childBounds);
            // 偶数次时负支与正支关于 0 对称；奇数次时负支的像是正支像的相反数
            Interval mirrored = even ? this : negate();
            Interval negative = decreasingRoot(mirrored, exponent).negate().intersect(childBounds);
            return positive.hull(negative);
        }
        boolean even = Math.abs(exponent % 2.0) == 0.0;
        if (even) {
            Interval image = intersect(NONNEGATIVE);
            if (image.isEmpty()) {
                return EMPTY;
            }
            double rootSup = powUp(image.sup, 1.0 / exponent);
            double rootInf = Math.max(0.0, powDown(image.inf, 1.0 / exponent));
            rootSup = addUp(rootSup, Math.ulp(rootSup));
            rootInf = Math.max(0.0, subDown(rootInf, Math.ulp(rootInf)));
            Interval positive = of(rootInf, rootSup).intersect(childBounds);
            Interval negative = of(-rootSup, -rootInf).intersect(childBounds);
            return positive.hull(negative);
        }
        // 奇数次幂单调递增
        double lo = signedRootDown(inf, exponent);
        double hi = signedRootUp(sup, exponent);
        return of(lo, hi).intersect(childBounds);
    }

    /**
     * 负指数 exponent 在 x ≥ 0 上单调递减，返回像落在 image 内的 x 的范围，向外放宽。
     */
    private static Interval decreasingRoot(Interval image, double exponent) {
        Interval positive = image.intersect(NONNEGATIVE);
        if (positive.isEmpty() || positive.sup <= 0.0) {
            return EMPTY;
        }
        double lo = positive.sup == Double.POSITIVE_INFINITY ? 0.0 : powDown(positive.sup, 1.0 / exponent);
        double hi = positive.inf <= 0.0 ? Double.POSITIVE_INFINITY : powUp(positive.inf, 1.0 / exponent);
        Interval root = of(Math.max(0.0, lo), hi);
        return root.widen(ulpOf(root)).intersect(NONNEGATIVE);
    }

    private static Interval monotonePower(Interval domain, double exponent) {
        if (exponent > 0.0) {
            return of(powDown(domain.inf, exponent), powUp(domain.sup, exponent));
        }
        if (domain.sup == 0.0) {
            return EMPTY;
        }
        double hi = domain.inf == 0.0 ? Double.POSITIVE_INFINITY : powUp(domain.inf, exponent);
        return of(powDown(domain.sup, exponent), hi);
    }

    private static double signedPowDown(double x, double exponent) {
        if (x >= 0.0) {
            return powDown(x, exponent);
        }
        return -powUp(-x, exponent);
    }

    private static double signedPowUp(double x, double exponent) {
        if (x >= 0.0) {
            return powUp(x, exponent);
        }
        return -powDown(-x, exponent);
    }

    private static double signedRootDown(double y, double exponent) {
        if (Double.isInfinite(y)) {
            return y;
        }
        double r = y >= 0.0 ? Math.pow(y, 1.0 / exponent) : -Math.pow(-y, 1.0 / exponent);
        return subDown(r, Math.ulp(r) * 2.0);
    }

    private static double signedRootUp(double y, double exponent) {
        if (Double.isInfinite(y)) {
            return y;
        }
        double r = y >= 0.0 ? Math.pow(y, 1.0 / exponent) : -Math.pow(-y, 1.0 / exponent);
        return addUp(r, Math.ulp(r) * 2.0);
    }

    private static double ulpOf(Interval interval) {
        double m = Math.max(Math.abs(interval.inf), Math.abs(interval.sup));
        return Double.isFinite(m) ? Math.ulp(m) * 2.0 : 0.0;
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Interval that = (Interval) o;
        if (isEmpty() && that.isEmpty()) {
            return true;
        }
        return Double.compare(inf, that.inf) == 0 && Double.compare(sup, that.sup) == 0;
    }

    @Override
    public int hashCode() {
        if (isEmpty()) {
            return 0;
        }
        return Double.hashCode(inf) * 31 + Double.hashCode(sup);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "∅";
        }
        return "[" + inf + ", " + sup + "]";
    }
}
