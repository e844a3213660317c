package org.cipexpr.config;

import lombok.Getter;
import org.cipexpr.propagation.VarBoundRelaxation;

import java.util.Objects;

/**
 * 表达式引擎的数值与传播参数。此类是不可变的，用 {@link #builder()} 构造。
 *
 * @author Ayalyt
 */
@Getter
public final class EngineConfig {

    public static final double DEFAULT_INFINITY = 1e20;
    public static final double DEFAULT_FEASIBILITY_TOLERANCE = 1e-6;
    public static final double DEFAULT_VAR_BOUND_RELAX_AMOUNT = 1e-9;
    public static final double DEFAULT_MIN_TIGHTENING_RATIO = 1e-9;
    public static final int DEFAULT_MAX_PROPAGATION_ROUNDS = 10;

    /** 绝对值不小于此值的界视为无穷。 */
    private final double infinity;
    private final double feasibilityTolerance;
    private final VarBoundRelaxation varBoundRelax;
    private final double varBoundRelaxAmount;
    /** 收紧量相对于 max(1, |旧界|) 不超过此比例时不计为收紧。 */
    private final double minTighteningRatio;
    private final int maxPropagationRounds;

    private EngineConfig(Builder builder) {
        this.infinity = builder.infinity;
        this.feasibilityTolerance = builder.feasibilityTolerance;
        this.varBoundRelax = builder.varBoundRelax;
        this.varBoundRelaxAmount = builder.varBoundRelaxAmount;
        this.minTighteningRatio = builder.minTighteningRatio;
        this.maxPropagationRounds = builder.maxPropagationRounds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * 以当前配置为起点的 builder。
     */
    public Builder toBuilder() {
        return new Builder()
                .infinity(infinity)
                .feasibilityTolerance(feasibilityTolerance)
                .varBoundRelax(varBoundRelax)
                .varBoundRelaxAmount(varBoundRelaxAmount)
                .minTighteningRatio(minTighteningRatio)
                .maxPropagationRounds(maxPropagationRounds);
    }

    public boolean isInfinity(double value) {
        return value >= infinity;
    }

    @Override
    public String toString() {
        return "EngineConfig{infinity=" + infinity
                + ", feasibilityTolerance=" + feasibilityTolerance
                + ", varBoundRelax=" + varBoundRelax
                + ", varBoundRelaxAmount=" + varBoundRelaxAmount
                + ", minTighteningRatio=" + minTighteningRatio
                + ", maxPropagationRounds=" + maxPropagationRounds + "}";
    }

    public static final class Builder {
        private double infinity = DEFAULT_INFINITY;
        private double feasibilityTolerance = DEFAULT_FEASIBILITY_TOLERANCE;
        private VarBoundRelaxation varBoundRelax = VarBoundRelaxation.RELATIVE;
        private double varBoundRelaxAmount = DEFAULT_VAR_BOUND_RELAX_AMOUNT;
        private double minTighteningRatio = DEFAULT_MIN_TIGHTENING_RATIO;
        private int maxPropagationRounds = DEFAULT_MAX_PROPAGATION_ROUNDS;

        private Builder() {
        }

        public Builder infinity(double infinity) {
            this.infinity = infinity;
            return this;
        }

        public Builder feasibilityTolerance(double feasibilityTolerance) {
            this.feasibilityTolerance = feasibilityTolerance;
            return this;
        }

        public Builder varBoundRelax(VarBoundRelaxation varBoundRelax) {
            this.varBoundRelax = Objects.requireNonNull(varBoundRelax, "varBoundRelax 不能为 null");
            return this;
        }

        public Builder varBoundRelaxAmount(double varBoundRelaxAmount) {
            this.varBoundRelaxAmount = varBoundRelaxAmount;
            return this;
        }

        public Builder minTighteningRatio(double minTighteningRatio) {
            this.minTighteningRatio = minTighteningRatio;
            return this;
        }

        public Builder maxPropagationRounds(int maxPropagationRounds) {
            this.maxPropagationRounds = maxPropagationRounds;
            return this;
        }

        /**
         * @throws IllegalArgumentException 如果某个取值越界。
         */
        public EngineConfig build() {
            if (!(infinity > 0.0)) {
                throw new IllegalArgumentException("infinity 必须为正数: " + infinity);
            }
            if (!(feasibilityTolerance >= 0.0)) {
                throw new IllegalArgumentException("feasibilityTolerance 不能为负: " + feasibilityTolerance);
            }
            if (!(varBoundRelaxAmount >= 0.0)) {
                throw new IllegalArgumentException("varBoundRelaxAmount 不能为负: " + varBoundRelaxAmount);
            }
            if (!(minTighteningRatio >= 0.0)) {
                throw new IllegalArgumentException("minTighteningRatio 不能为负: " + minTighteningRatio);
            }
            if (maxPropagationRounds < 1) {
                throw new IllegalArgumentException("maxPropagationRounds 至少为 1: " + maxPropagationRounds);
            }
            return new EngineConfig(this);
        }
    }
}
