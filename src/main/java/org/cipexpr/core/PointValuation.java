package org.cipexpr.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 一个点：变量到取值的映射。用于表达式求值、求梯度与线性估计。
 *
 * @author Ayalyt
 */
@Getter
public final class PointValuation {

    private static final Logger logger = LoggerFactory.getLogger(PointValuation.class);

    private final SortedMap<Variable, Double> values;

    private PointValuation(Map<Variable, Double> values) {
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
        logger.debug("创建 PointValuation: {}", this);
    }

    /**
     * 工厂方法：从 Map 创建 PointValuation 实例。
     * @throws NullPointerException 如果任何值为 null。
     */
    public static PointValuation of(Map<Variable, Double> values) {
        for (Map.Entry<Variable, Double> entry : values.entrySet()) {
            Objects.requireNonNull(entry.getValue(), "变量 '" + entry.getKey() + "' 的取值不能为 null");
        }
        return new PointValuation(values);
    }

    /**
     * 工厂方法：创建一个全零的 PointValuation。
     */
    public static PointValuation zero(Collection<Variable> variables) {
        Map<Variable, Double> zeroValues = new HashMap<>();
        for (Variable var : variables) {
            zeroValues.put(var, 0.0);
        }
        return new PointValuation(zeroValues);
    }

    /**
     * 返回在原有取值基础上修改一个变量后的新点。
     */
    public PointValuation with(Variable var, double value) {
        Map<Variable, Double> copy = new HashMap<>(values);
        copy.put(var, value);
        return new PointValuation(copy);
    }

    public boolean contains(Variable var) {
        return values.containsKey(var);
    }

    /**
     * 获取指定变量的值。
     * @throws IllegalArgumentException 如果该变量不在此点中。
     */
    public double getValue(Variable var) {
        Double value = values.get(var);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前点 {} 中。", var.getName(), this);
            throw new IllegalArgumentException("变量 '" + var.getName() + "' 不存在于当前点中。");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PointValuation that = (PointValuation) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "{" +
                values.entrySet().stream()
                        .map(entry -> entry.getKey().getName() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
