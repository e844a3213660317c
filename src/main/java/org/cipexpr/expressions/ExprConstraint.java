package org.cipexpr.expressions; // 放在 expressions 包下

import lombok.Getter;
import org.cipexpr.core.PointValuation;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 非线性约束 lhs <= root <= rhs，lhs 可以为 -∞，rhs 可以为 +∞。
 * 创建时持有 root 的一个引用，并按两侧是否有限给 root 加锁：
 * rhs 有限时加向上锁，lhs 有限时加向下锁。{@link #release()} 撤销这两件事。
 *
 * @author Ayalyt
 */
@Getter
public final class ExprConstraint {

    private static final Logger logger = LoggerFactory.getLogger(ExprConstraint.class);

    private final String name;
    private final Expression root;
    private final double lhs;
    private final double rhs;
    private boolean released;

    private ExprConstraint(String name, Expression root, double lhs, double rhs) {
        Objects.requireNonNull(root, "ExprConstraint-构造函数: root 不能为 null");
        if (Double.isNaN(lhs) || Double.isNaN(rhs)) {
            throw new IllegalArgumentException("ExprConstraint-构造函数: 约束两侧不能为 NaN");
        }
        if (lhs > rhs) {
            logger.warn("ExprConstraint-构造函数: 创建了一个恒假约束 {}: lhs {} > rhs {}", name, lhs, rhs);
        }
        this.name = name;
        this.root = root;
        this.lhs = lhs;
        this.rhs = rhs;
        ExprEngine engine = root.getEngine();
        engine.capture(root);
        engine.addLocks(root, upLocks(), downLocks());
        logger.debug("创建 ExprConstraint: {}", this);
    }

    /**
     * 工厂方法：创建 lhs <= root <= rhs。
     */
    public static ExprConstraint of(String name, Expression root, double lhs, double rhs) {
        return new ExprConstraint(name, root, lhs, rhs);
    }

    /**
     * 工厂方法：创建 root ~ bound。
     */
    public static ExprConstraint of(String name, Expression root, RelationType relation, double bound) {
        Interval sides = relation.toSides(bound);
        return new ExprConstraint(name, root, sides.getInf(), sides.getSup());
    }

    private int upLocks() {
        return rhs < Double.POSITIVE_INFINITY ? 1 : 0;
    }

    private int downLocks() {
        return lhs > Double.NEGATIVE_INFINITY ? 1 : 0;
    }

    /**
     * 约束两侧构成的区间。
     */
    public Interval getSides() {
        return Interval.of(lhs, rhs);
    }

    /**
     * 在 point 处的违反量 max(lhs - v, v - rhs, 0)；值无效时返回 +∞。
     */
    public double getViolation(PointValuation point) {
        double value = new ExpressionEvaluator(root.getEngine()).evaluate(root, point, 0);
        if (Double.isNaN(value)) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, Math.max(lhs - value, value - rhs));
    }

    public boolean isFeasible(PointValuation point, double tolerance) {
        return getViolation(point) <= tolerance;
    }

    /**
     * 撤销锁并释放 root 的引用。重复调用会抛出 {@link IllegalStateException}。
     */
    public void release() {
        if (released) {
            logger.error("ExprConstraint: 约束 {} 被重复释放", name);
            throw new IllegalStateException("约束 '" + name + "' 已被释放");
        }
        ExprEngine engine = root.getEngine();
        engine.addLocks(root, -upLocks(), -downLocks());
        engine.release(root);
        released = true;
    }

    @Override
    public String toString() {
        if (lhs == rhs) {
            return name + ": " + root + " " + RelationType.EQ.getSymbol() + " " + rhs;
        }
        if (lhs == Double.NEGATIVE_INFINITY) {
            return name + ": " + root + " " + RelationType.LE.getSymbol() + " " + rhs;
        }
        if (rhs == Double.POSITIVE_INFINITY) {
            return name + ": " + root + " " + RelationType.GE.getSymbol() + " " + lhs;
        }
        return name + ": " + lhs + " <= " + root + " <= " + rhs;
    }
}
