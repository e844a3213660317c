package org.cipexpr.propagation;

import org.cipexpr.config.EngineConfig;
import org.cipexpr.core.Variable;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.cipexpr.utils.DirectedRounding.addUp;
import static org.cipexpr.utils.DirectedRounding.mulUp;
import static org.cipexpr.utils.DirectedRounding.subDown;

/**
 * 以变量当前定义域作为叶子区间，按配置的方式向外放宽连续变量的界。
 * 绝对值不小于 infinity 的界视为无穷。整数变量不放宽；放宽不会让界越过 0。
 *
 * @author Ayalyt
 */
public final class VariableBoundsIntervalSource implements LeafIntervalSource {

    private static final Logger logger = LoggerFactory.getLogger(VariableBoundsIntervalSource.class);

    private final EngineConfig config;

    public VariableBoundsIntervalSource(EngineConfig config) {
        this.config = config;
    }

    @Override
    public Interval getInterval(Variable variable) {
        double infinity = config.getInfinity();
        double lb = variable.getLowerBound() <= -infinity ? Double.NEGATIVE_INFINITY : variable.getLowerBound();
        double ub = variable.getUpperBound() >= infinity ? Double.POSITIVE_INFINITY : variable.getUpperBound();
        if (lb > ub) {
            logger.debug("变量 {} 的定义域为空", variable);
            return Interval.EMPTY;
        }
        if (variable.isIntegral() || config.getVarBoundRelax() == VarBoundRelaxation.NONE) {
            return Interval.of(lb, ub);
        }
        if (Double.isFinite(lb)) {
            double relaxed = subDown(lb, relaxAmount(lb));
            lb = lb >= 0.0 && relaxed < 0.0 ? 0.0 : relaxed;
        }
        if (Double.isFinite(ub)) {
            double relaxed = addUp(ub, relaxAmount(ub));
            ub = ub <= 0.0 && relaxed > 0.0 ? 0.0 : relaxed;
        }
        return Interval.of(lb, ub);
    }

    private double relaxAmount(double bound) {
        double amount = config.getVarBoundRelaxAmount();
        if (config.getVarBoundRelax() == VarBoundRelaxation.RELATIVE) {
            return mulUp(amount, Math.max(1.0, Math.abs(bound)));
        }
        return amount;
    }
}
