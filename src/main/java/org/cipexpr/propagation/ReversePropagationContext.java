package org.cipexpr.propagation;

import lombok.Getter;
import org.cipexpr.expressions.Expression;
import org.cipexpr.utils.Interval;

import java.util.Deque;

/**
 * 一次逆向传播的状态：待处理队列、是否强制收紧、收紧次数以及是否已发现不可行。
 * 处理器的逆向传播回调通过 {@link #tighten} 收紧子节点。
 */
@Getter
public final class ReversePropagationContext {

    private final IntervalPropagator propagator;
    private final Deque<Expression> queue;
    private final boolean force;
    private int tighteningCount;
    private boolean infeasible;

    ReversePropagationContext(IntervalPropagator propagator, Deque<Expression> queue, boolean force) {
        this.propagator = propagator;
        this.queue = queue;
        this.force = force;
    }

    /**
     * 把 expr 的区间收紧到 bounds 内，真正收紧时把 expr 加入队列。
     * @return 如果出现空区间（不可行）则返回 true。
     */
    public boolean tighten(Expression expr, Interval bounds) {
        if (infeasible) {
            return true;
        }
        TighteningOutcome outcome = propagator.tightenInterval(expr, bounds, force, queue);
        if (outcome == TighteningOutcome.TIGHTENED) {
            tighteningCount++;
        } else if (outcome.isInfeasible()) {
            infeasible = true;
        }
        return infeasible;
    }
}
