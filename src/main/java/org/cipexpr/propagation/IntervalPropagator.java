package org.cipexpr.propagation;

import org.cipexpr.config.EngineConfig;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprCapability;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.ExprHandler;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.walk.WalkResult;
import org.cipexpr.nlhdlr.EnforcementBinding;
import org.cipexpr.nlhdlr.NlhdlrCapability;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 区间传播。
 * <p>
 * 正向：自底向上为每个节点计算包含其全部取值的区间。节点区间只对计算时的边界标签有效；
 * 标签相同且节点未被标记为已变化时直接复用。同一标签下重新计算的结果与旧区间取交，
 * 有辅助变量时再与放宽了可行性容差的辅助变量界取交。出现空区间即不可行，遍历立刻终止。
 * <p>
 * 逆向：从被收紧过的节点出发，按队列先进先出地调用逆向传播回调收紧子节点，
 * 被收紧且有子节点的节点重新入队，直到队列为空或出现空区间。
 *
 * @author Ayalyt
 */
public final class IntervalPropagator {

    private static final Logger logger = LoggerFactory.getLogger(IntervalPropagator.class);

    private final ExprEngine engine;
    private final EngineConfig config;

    public IntervalPropagator(ExprEngine engine) {
        this.engine = engine;
        this.config = engine.getConfig();
    }

    // ========== 正向 ==========

    /**
     * @param boxTag 当前变量定义域对应的标签，定义域改变后应换用新标签。
     * @param leafSource 变量叶子的区间来源。
     * @param force 为 true 时忽略缓存，重新计算每个节点。
     */
    public ForwardPropagationResult propagateForward(Expression root, int boxTag, LeafIntervalSource leafSource,
                                                     boolean force) {
        Set<Expression> done = Collections.newSetFromMap(new IdentityHashMap<>());
        WalkResult result = engine.getWalker().walk(root,
                frame -> isUpToDate(frame.getExpr(), boxTag, force, done) ? WalkResult.SKIP : WalkResult.CONTINUE,
                frame -> isUpToDate(frame.getCurrentChildExpr(), boxTag, force, done)
                        ? WalkResult.SKIP : WalkResult.CONTINUE,
                null,
                frame -> {
                    Expression expr = frame.getExpr();
                    if (isUpToDate(expr, boxTag, force, done)) {
                        return WalkResult.CONTINUE;
                    }
                    done.add(expr);
                    Interval interval = computeInterval(expr, leafSource);
                    if (expr.getIntervalTag() == boxTag) {
                        interval = interval.intersect(expr.getInterval());
                    }
                    Variable aux = expr.getAuxVariable();
                    if (aux != null) {
                        Interval auxBounds = Interval.ofBounds(aux.getLowerBound(), aux.getUpperBound(), config.getInfinity());
                        interval = interval.intersect(auxBounds.widen(config.getFeasibilityTolerance()));
                    }
                    expr.setInterval(interval, boxTag);
                    if (interval.isEmpty()) {
                        logger.debug("正向传播: 节点 {}#{} 的区间为空", expr.getHandler().getName(), expr.getSerial());
                        return WalkResult.ABORT;
                    }
                    return WalkResult.CONTINUE;
                });
        if (result == WalkResult.ABORT) {
            return new ForwardPropagationResult(true, Interval.EMPTY);
        }
        return new ForwardPropagationResult(false, root.getInterval());
    }

    private static boolean isUpToDate(Expression expr, int boxTag, boolean force, Set<Expression> done) {
        if (done.contains(expr)) {
            return true;
        }
        return !force && boxTag != 0 && expr.getIntervalTag() == boxTag && !expr.isChanged();
    }

    private Interval computeInterval(Expression expr, LeafIntervalSource leafSource) {
        for (Expression child : expr.getChildren()) {
            if (child.getInterval().isEmpty()) {
                return Interval.EMPTY;
            }
        }
        // 有强化绑定时取各绑定结果的交
        Interval result = null;
        for (EnforcementBinding binding : expr.getEnforcements()) {
            if (binding.getMethods().contains(NlhdlrCapability.INTERVAL_EVAL)) {
                Interval interval = binding.getHandler().intervalEval(expr, binding.getData(), leafSource);
                result = result == null ? interval : result.intersect(interval);
            }
        }
        if (result != null) {
            return result;
        }
        ExprHandler handler = expr.getHandler();
        if (handler.hasCapability(ExprCapability.INTERVAL_EVAL)) {
            return handler.intervalEval(expr, leafSource);
        }
        return Interval.ENTIRE;
    }

    // ========== 逆向 ==========

    /**
     * @param roots 逆向传播的起点。
     * @param force 为 true 时任何严格的收紧都会被采用。
     * @param allNodes 为 true 时把 roots 下的所有内部节点都作为起点，否则只用被标记为已变化的根。
     */
    public ReversePropagationResult propagateReverse(List<Expression> roots, boolean force, boolean allNodes) {
        Deque<Expression> queue = new ArrayDeque<>();
        if (allNodes) {
            Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Expression root : roots) {
                engine.getWalker().walk(root,
                        frame -> {
                            enqueue(frame.getExpr(), queue);
                            return WalkResult.CONTINUE;
                        },
                        frame -> seen.add(frame.getCurrentChildExpr()) ? WalkResult.CONTINUE : WalkResult.SKIP,
                        null, null);
            }
        } else {
            for (Expression root : roots) {
                if (root.isChanged()) {
                    enqueue(root, queue);
                }
            }
        }

        ReversePropagationContext context = new ReversePropagationContext(this, queue, force);
        while (!queue.isEmpty()) {
            Expression expr = queue.poll();
            expr.setInQueue(false);
            expr.setChanged(false);
            if (context.isInfeasible()) {
                // 已不可行，只清掉剩余节点的标记
                continue;
            }
            reversePropagate(expr, context);
        }
        logger.debug("逆向传播结束: 收紧 {} 次，不可行={}", context.getTighteningCount(), context.isInfeasible());
        return new ReversePropagationResult(context.isInfeasible(), context.getTighteningCount());
    }

    private void reversePropagate(Expression expr, ReversePropagationContext context) {
        boolean handled = false;
        for (EnforcementBinding binding : expr.getEnforcements()) {
            if (binding.getMethods().contains(NlhdlrCapability.REVERSE_PROP)) {
                binding.getHandler().reversePropagate(expr, binding.getData(), context);
                handled = true;
                if (context.isInfeasible()) {
                    return;
                }
            }
        }
        if (!handled && expr.getHandler().hasCapability(ExprCapability.REVERSE_PROP)) {
            expr.getHandler().reversePropagate(expr, context);
        }
    }

    private static void enqueue(Expression expr, Deque<Expression> queue) {
        if (expr.getNChildren() > 0 && !expr.isInQueue()) {
            queue.add(expr);
            expr.setInQueue(true);
        }
    }

    // ========== 收紧 ==========

    /**
     * 把 expr 的区间收紧到 bounds 内。整数值节点的界先取整；改进量不足时（且未强制）不采用。
     * 变量节点的新界写回变量定义域，有辅助变量时也写回辅助变量。
     * 被收紧且有子节点的节点标记为已变化，并在 queue 非空时入队。
     */
    public TighteningOutcome tightenInterval(Expression expr, Interval bounds, boolean force, Deque<Expression> queue) {
        Interval old = expr.getInterval();
        Variable variable = engine.isVariable(expr) ? engine.getVariable(expr) : null;
        Interval candidate = bounds;
        if (!candidate.isEmpty() && (expr.isIntegral() || variable != null && variable.isIntegral())) {
            candidate = roundToIntegers(candidate);
        }
        Interval tightened = old.intersect(candidate);
        if (tightened.isEmpty()) {
            logger.debug("节点 {}#{} 的区间 {} 与 {} 不相交", expr.getHandler().getName(), expr.getSerial(), old, bounds);
            expr.setInterval(Interval.EMPTY, expr.getIntervalTag());
            return TighteningOutcome.INFEASIBLE;
        }
        boolean lowerImproved = isBetterLower(old.getInf(), tightened.getInf(), force);
        boolean upperImproved = isBetterUpper(old.getSup(), tightened.getSup(), force);
        if (!lowerImproved && !upperImproved) {
            return TighteningOutcome.UNCHANGED;
        }
        Interval accepted = Interval.of(lowerImproved ? tightened.getInf() : old.getInf(),
                upperImproved ? tightened.getSup() : old.getSup());
        expr.setInterval(accepted, expr.getIntervalTag());
        expr.getHandler().recordDomainReduction();
        logger.debug("节点 {}#{} 的区间从 {} 收紧到 {}", expr.getHandler().getName(), expr.getSerial(), old, accepted);

        if (variable != null && writeBack(variable, accepted, lowerImproved, upperImproved)) {
            return TighteningOutcome.INFEASIBLE;
        }
        Variable aux = expr.getAuxVariable();
        if (aux != null && writeBack(aux, accepted, lowerImproved, upperImproved)) {
            return TighteningOutcome.INFEASIBLE;
        }
        if (expr.getNChildren() > 0) {
            expr.setChanged(true);
            if (queue != null) {
                enqueue(expr, queue);
            }
        }
        return TighteningOutcome.TIGHTENED;
    }

    private Interval roundToIntegers(Interval interval) {
        double tol = config.getFeasibilityTolerance();
        double lo = Double.isInfinite(interval.getInf()) ? interval.getInf() : Math.ceil(interval.getInf() - tol);
        double hi = Double.isInfinite(interval.getSup()) ? interval.getSup() : Math.floor(interval.getSup() + tol);
        return Interval.of(lo, hi);
    }

    private boolean isBetterLower(double oldBound, double newBound, boolean force) {
        if (newBound <= oldBound) {
            return false;
        }
        if (force || oldBound == Double.NEGATIVE_INFINITY) {
            return true;
        }
        return newBound - oldBound > config.getMinTighteningRatio() * Math.max(1.0, Math.abs(oldBound));
    }

    private boolean isBetterUpper(double oldBound, double newBound, boolean force) {
        if (newBound >= oldBound) {
            return false;
        }
        if (force || oldBound == Double.POSITIVE_INFINITY) {
            return true;
        }
        return oldBound - newBound > config.getMinTighteningRatio() * Math.max(1.0, Math.abs(oldBound));
    }

    /**
     * @return 如果写回后变量定义域为空则返回 true。
     */
    private static boolean writeBack(Variable variable, Interval interval, boolean lower, boolean upper) {
        if (lower && Double.isFinite(interval.getInf())) {
            variable.tightenLowerBound(interval.getInf());
        }
        if (upper && Double.isFinite(interval.getSup())) {
            variable.tightenUpperBound(interval.getSup());
        }
        return variable.isDomainEmpty();
    }
}
