package org.cipexpr.propagation;

import lombok.Getter;
import org.cipexpr.config.EngineConfig;
import org.cipexpr.expressions.ExprConstraint;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 对一组约束做多轮定义域传播。每一轮：换新的边界标签，正向传播每个约束的根，
 * 把根的区间收紧到约束两侧，再从被收紧的根出发逆向传播。
 * 某一轮没有任何收紧、发现不可行或达到最大轮数时停止。收紧的结果写回变量定义域。
 *
 * @author Ayalyt
 */
public final class DomainPropagator {

    private static final Logger logger = LoggerFactory.getLogger(DomainPropagator.class);

    private final IntervalPropagator propagator;
    private final PropagationSession session;
    private final LeafIntervalSource leafSource;
    private final int maxRounds;

    public DomainPropagator(ExprEngine engine, PropagationSession session) {
        EngineConfig config = engine.getConfig();
        this.propagator = new IntervalPropagator(engine);
        this.session = session;
        this.leafSource = new VariableBoundsIntervalSource(config);
        this.maxRounds = config.getMaxPropagationRounds();
    }

    /**
     * @return 传播结果：是否不可行、执行的轮数、收紧的总次数。
     */
    public Outcome propagate(List<ExprConstraint> constraints) {
        List<Expression> roots = new ArrayList<>(constraints.size());
        for (ExprConstraint constraint : constraints) {
            roots.add(constraint.getRoot());
        }
        int totalTightenings = 0;
        int round = 0;
        while (round < maxRounds) {
            round++;
            int boxTag = session.nextBoxTag();
            int roundTightenings = 0;
            for (ExprConstraint constraint : constraints) {
                ForwardPropagationResult forward = propagator.propagateForward(constraint.getRoot(), boxTag, leafSource, false);
                if (forward.isInfeasible()) {
                    logger.debug("第 {} 轮: 约束 {} 正向传播不可行", round, constraint.getName());
                    return new Outcome(true, round, totalTightenings);
                }
                TighteningOutcome sides = propagator.tightenInterval(constraint.getRoot(), constraint.getSides(), false, null);
                if (sides.isInfeasible()) {
                    logger.debug("第 {} 轮: 约束 {} 的根区间 {} 与两侧不相交", round, constraint.getName(),
                            forward.getRootInterval());
                    return new Outcome(true, round, totalTightenings);
                }
                if (sides == TighteningOutcome.TIGHTENED) {
                    roundTightenings++;
                }
            }
            ReversePropagationResult reverse = propagator.propagateReverse(roots, false, false);
            roundTightenings += reverse.getTighteningCount();
            totalTightenings += roundTightenings;
            if (reverse.isInfeasible()) {
                logger.debug("第 {} 轮: 逆向传播不可行", round);
                return new Outcome(true, round, totalTightenings);
            }
            if (reverse.getTighteningCount() == 0) {
                break;
            }
        }
        logger.debug("定义域传播结束: {} 轮，收紧 {} 次", round, totalTightenings);
        return new Outcome(false, round, totalTightenings);
    }

    /**
     * 传播结果。
     */
    @Getter
    public static final class Outcome {
        private final boolean infeasible;
        private final int rounds;
        private final int tighteningCount;

        Outcome(boolean infeasible, int rounds, int tighteningCount) {
            this.infeasible = infeasible;
            this.rounds = rounds;
            this.tighteningCount = tighteningCount;
        }

        @Override
        public String toString() {
            return "DomainPropagation{infeasible=" + infeasible + ", rounds=" + rounds
                    + ", tightenings=" + tighteningCount + "}";
        }
    }
}
