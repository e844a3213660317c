package org.cipexpr.core; // 放在 core 包下

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 问题变量。持有当前的局部定义域 [lb, ub] 与上下锁计数。
 * 变量以 id 区分身份，定义域可以被传播收紧，但不会被放宽。
 *
 * @author Ayalyt
 */
@Getter
public final class Variable implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    // AtomicInteger 保证唯一性和线程安全
    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final int id;
    // 默认命名规则是 "v" + ID
    private final String name;
    private final VariableType type;

    private double lowerBound;
    private double upperBound;

    // 向下锁：减小变量值可能破坏某个约束；向上锁同理
    private int locksDown;
    private int locksUp;

    private final int hashCode;

    private Variable(int id, String name, VariableType type, double lowerBound, double upperBound) {
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound)) {
            logger.error("Variable-构造函数: 变量 {} 的界不能为 NaN", name);
            throw new IllegalArgumentException("变量 '" + name + "' 的界不能为 NaN");
        }
        if (lowerBound > upperBound) {
            logger.error("Variable-构造函数: 变量 {} 的下界 {} 大于上界 {}", name, lowerBound, upperBound);
            throw new IllegalArgumentException("变量 '" + name + "' 的下界大于上界");
        }
        this.id = id;
        this.name = name;
        this.type = type;
        this.lowerBound = type.isIntegral() ? Math.ceil(lowerBound) : lowerBound;
        this.upperBound = type.isIntegral() ? Math.floor(upperBound) : upperBound;
        this.hashCode = Objects.hash(id);
        logger.debug("创建了一个Variable: {} with id {}, 类型 {}, 定义域 [{}, {}]", name, id, type, this.lowerBound, this.upperBound);
    }

    /**
     * 创建一个新的变量。
     * @param name 变量名称，为 null 时使用 "v" + ID。
     * @param type 变量类型。
     * @param lowerBound 下界，可以是 -∞。
     * @param upperBound 上界，可以是 +∞。
     * @return 新的 Variable 实例。
     */
    public static Variable create(String name, VariableType type, double lowerBound, double upperBound) {
        Objects.requireNonNull(type, "Variable-create: type 不能为 null");
        int id = NEXT_ID.getAndIncrement();
        return new Variable(id, name == null ? "v" + id : name, type, lowerBound, upperBound);
    }

    public static Variable createContinuous(String name, double lowerBound, double upperBound) {
        return create(name, VariableType.CONTINUOUS, lowerBound, upperBound);
    }

    public static Variable createInteger(String name, double lowerBound, double upperBound) {
        return create(name, VariableType.INTEGER, lowerBound, upperBound);
    }

    public static Variable createBinary(String name) {
        return create(name, VariableType.BINARY, 0.0, 1.0);
    }

    /**
     * 创建一个辅助变量，定义域为 [lowerBound, upperBound]。
     */
    public static Variable createAuxiliary(String name, double lowerBound, double upperBound) {
        return create(name, VariableType.AUXILIARY, lowerBound, upperBound);
    }

    public boolean isIntegral() {
        return type.isIntegral();
    }

    public boolean isBinary() {
        return type == VariableType.BINARY
                || type == VariableType.INTEGER && lowerBound >= 0.0 && upperBound <= 1.0;
    }

    /**
     * 收紧下界。整数变量的新界会先向上取整。
     * @return 如果下界确实变大则返回 true。
     */
    public boolean tightenLowerBound(double newBound) {
        double bound = isIntegral() ? Math.ceil(newBound) : newBound;
        if (bound <= lowerBound) {
            return false;
        }
        logger.debug("变量 {} 的下界从 {} 收紧到 {}", name, lowerBound, bound);
        lowerBound = bound;
        return true;
    }

    /**
     * 收紧上界。整数变量的新界会先向下取整。
     * @return 如果上界确实变小则返回 true。
     */
    public boolean tightenUpperBound(double newBound) {
        double bound = isIntegral() ? Math.floor(newBound) : newBound;
        if (bound >= upperBound) {
            return false;
        }
        logger.debug("变量 {} 的上界从 {} 收紧到 {}", name, upperBound, bound);
        upperBound = bound;
        return true;
    }

    /**
     * 检查当前定义域是否为空（下界超过上界）。
     */
    public boolean isDomainEmpty() {
        return lowerBound > upperBound;
    }

    public void addLocks(int down, int up) {
        locksDown += down;
        locksUp += up;
        if (locksDown < 0 || locksUp < 0) {
            logger.error("变量 {} 的锁计数变为负数: down={}, up={}", name, locksDown, locksUp);
            throw new IllegalStateException("变量 '" + name + "' 的锁计数变为负数");
        }
    }

    @Override
    public int compareTo(Variable other) {
        return Integer.compare(this.id, other.id);
    }

    @Override
    public String toString() {
        return this.name;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Variable variable = (Variable) obj;
        return this.id == variable.id;
    }
}
