package org.cipexpr.expressions;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.cipexpr.config.EngineConfig;
import org.cipexpr.core.PointValuation;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.handlers.*;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.simplify.Simplifier;
import org.cipexpr.expressions.walk.ExpressionWalker;
import org.cipexpr.expressions.walk.WalkResult;
import org.cipexpr.nlhdlr.DefaultNonlinearHandler;
import org.cipexpr.nlhdlr.EnforcementBinding;
import org.cipexpr.nlhdlr.NlhdlrCapability;
import org.cipexpr.nlhdlr.NonlinearHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 表达式引擎：创建节点、管理引用计数、修改结构，并持有遍历器、比较器、化简器等共享组件。
 * 同一个引擎创建的节点只能与同一引擎的节点组合。
 * <p>
 * 此类不是线程安全的。
 *
 * @author Ayalyt
 */
@Getter
public final class ExprEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExprEngine.class);

    private final EngineConfig config;
    private final ExprHandlerRegistry registry;
    private final ExpressionWalker walker;
    private final ExpressionComparator comparator;
    private final Simplifier simplifier;
    private final ExpressionPrinter printer;
    private final List<NonlinearHandler> nonlinearHandlers;

    private long nextSerial;
    /** 当前存活（未释放）的节点数。 */
    private int liveExpressionCount;

    public ExprEngine(EngineConfig config, ExprHandlerRegistry registry) {
        this.config = Objects.requireNonNull(config, "ExprEngine: config 不能为 null");
        this.registry = Objects.requireNonNull(registry, "ExprEngine: registry 不能为 null");
        this.walker = new ExpressionWalker(this);
        this.comparator = new ExpressionComparator();
        this.simplifier = new Simplifier(this);
        this.printer = new ExpressionPrinter(this);
        this.nonlinearHandlers = new ArrayList<>();
        logger.info("创建表达式引擎: {}", config);
    }

    /**
     * 使用默认配置、内置处理器与默认非线性处理器创建引擎。
     */
    public static ExprEngine create() {
        return create(EngineConfig.defaults());
    }

    public static ExprEngine create(EngineConfig config) {
        ExprEngine engine = new ExprEngine(config, ExprHandlerRegistry.withDefaultHandlers());
        engine.registerNonlinearHandler(new DefaultNonlinearHandler());
        return engine;
    }

    /**
     * 注册非线性处理器，按优先级从高到低排列。
     */
    public void registerNonlinearHandler(NonlinearHandler nlhdlr) {
        for (NonlinearHandler existing : nonlinearHandlers) {
            if (existing.getName().equals(nlhdlr.getName())) {
                throw new IllegalArgumentException("非线性处理器 '" + nlhdlr.getName() + "' 已注册");
            }
        }
        nonlinearHandlers.add(nlhdlr);
        nonlinearHandlers.sort(Comparator.comparingInt(NonlinearHandler::getPriority).reversed());
    }

    public List<NonlinearHandler> getNonlinearHandlers() {
        return Collections.unmodifiableList(nonlinearHandlers);
    }

    // ========== 创建 ==========

    /**
     * 创建节点。每个子节点被 capture 一次，返回的节点由调用方持有一个引用。
     * @throws IllegalArgumentException 如果处理器未注册到此引擎。
     */
    public Expression createExpression(ExprHandler handler, ExprData data, List<Expression> children) {
        if (!registry.contains(handler)) {
            logger.error("ExprEngine: 处理器 {} 未注册到此引擎", handler.getName());
            throw new IllegalArgumentException("处理器 '" + handler.getName() + "' 未注册到此引擎");
        }
        Expression expr = new Expression(this, nextSerial++, handler, data);
        for (Expression child : children) {
            checkOwnership(child);
            child.ensureAlive();
            child.incRef();
            expr.appendChildInternal(child);
        }
        expr.incRef();
        liveExpressionCount++;
        logger.trace("创建节点 {}#{}，子节点数 {}", handler.getName(), expr.getSerial(), children.size());
        return expr;
    }

    public Expression createValue(double value) {
        return createExpression(registry.getValueHandler(), new ValueData(value), List.of());
    }

    public Expression createVariable(Variable variable) {
        return createExpression(registry.getVariableHandler(), new VariableData(variable), List.of());
    }

    /**
     * 创建和式 constant + Σ coefficients[i] * children[i]。
     */
    public Expression createSum(List<Expression> children, double[] coefficients, double constant) {
        if (coefficients.length != children.size()) {
            throw new IllegalArgumentException("和式的系数个数 " + coefficients.length
                    + " 与子节点个数 " + children.size() + " 不一致");
        }
        return createExpression(registry.getSumHandler(), new SumData(constant, coefficients), children);
    }

    /**
     * 创建系数全为 1、常数项为 0 的和式。
     */
    public Expression createSum(List<Expression> children) {
        double[] ones = new double[children.size()];
        Arrays.fill(ones, 1.0);
        return createSum(children, ones, 0.0);
    }

    public Expression createProduct(List<Expression> children, double coefficient) {
        return createExpression(registry.getProductHandler(), new ProductData(coefficient), children);
    }

    public Expression createPow(Expression base, double exponent) {
        return createExpression(registry.getPowHandler(), new PowData(exponent), List.of(base));
    }

    // ========== 引用计数 ==========

    public void capture(Expression expr) {
        checkOwnership(expr);
        expr.ensureAlive();
        expr.incRef();
    }

    /**
     * 释放一个引用。引用计数归零时，节点以及只被它引用的后代都会被释放。
     * 释放过程通过遍历器完成，不会因 DAG 过深而栈溢出。
     * @throws IllegalStateException 如果引用计数已经为 0。
     */
    public void release(Expression expr) {
        checkOwnership(expr);
        if (expr.isFreed() || expr.getRefCount() <= 0) {
            logger.error("ExprEngine: 释放了引用计数为 {} 的节点 {}#{}", expr.getRefCount(),
                    expr.getHandler().getName(), expr.getSerial());
            throw new IllegalStateException("释放了一个未被持有的表达式节点");
        }
        expr.decRef();
        if (expr.getRefCount() > 0) {
            return;
        }
        walker.walkUncaptured(expr, null,
                frame -> {
                    Expression child = frame.getCurrentChildExpr();
                    child.decRef();
                    return child.getRefCount() > 0 ? WalkResult.SKIP : WalkResult.CONTINUE;
                },
                null,
                frame -> {
                    freeNode(frame.getExpr());
                    return WalkResult.CONTINUE;
                });
    }

    private void freeNode(Expression expr) {
        for (EnforcementBinding binding : expr.clearEnforcementsInternal()) {
            binding.getHandler().freeExpressionData(expr, binding.getData());
        }
        expr.getHandler().freeData(expr);
        expr.setAuxVariable(null);
        expr.clearChildrenInternal();
        expr.markFreed();
        liveExpressionCount--;
        logger.trace("释放节点 {}#{}", expr.getHandler().getName(), expr.getSerial());
    }

    // ========== 结构修改 ==========

    /**
     * 在末尾追加子节点，子节点被 capture 一次。
     * 和式请使用 {@link #appendSumChild}，以保持系数与子节点对应。
     */
    public void appendChild(Expression expr, Expression child) {
        if (expr.getHandler() instanceof SumHandler) {
            appendSumChild(expr, child, 1.0);
            return;
        }
        checkOwnership(child);
        expr.ensureAlive();
        child.ensureAlive();
        child.incRef();
        expr.appendChildInternal(child);
    }

    public void appendSumChild(Expression sum, Expression child, double coefficient) {
        if (!(sum.getHandler() instanceof SumHandler)) {
            throw new IllegalArgumentException("appendSumChild 只能用于和式，实际为 " + sum.getHandler().getName());
        }
        checkOwnership(child);
        sum.ensureAlive();
        child.ensureAlive();
        child.incRef();
        sum.appendChildInternal(child);
        ((SumData) sum.getData()).appendCoefficient(coefficient);
    }

    /**
     * 把第 index 个子节点替换为 newChild：先 capture 新节点，再释放旧节点。
     */
    public void replaceChild(Expression expr, int index, Expression newChild) {
        checkOwnership(newChild);
        expr.ensureAlive();
        if (index < 0 || index >= expr.getNChildren()) {
            throw new IndexOutOfBoundsException("子节点下标越界: " + index + "，子节点数 " + expr.getNChildren());
        }
        capture(newChild);
        Expression old = expr.setChildInternal(index, newChild);
        release(old);
    }

    /**
     * 深拷贝表达式。共享的子表达式在拷贝中仍然共享。
     * @return 拷贝，调用方持有一个引用。
     */
    public Expression duplicate(Expression expr) {
        Map<Expression, Expression> copies = new IdentityHashMap<>();
        walker.walk(expr, null,
                frame -> copies.containsKey(frame.getCurrentChildExpr()) ? WalkResult.SKIP : WalkResult.CONTINUE,
                null,
                frame -> {
                    Expression source = frame.getExpr();
                    if (copies.containsKey(source)) {
                        return WalkResult.CONTINUE;
                    }
                    List<Expression> copiedChildren = new ArrayList<>(source.getNChildren());
                    for (Expression child : source.getChildren()) {
                        copiedChildren.add(copies.get(child));
                    }
                    ExprHandler handler = source.getHandler();
                    copies.put(source, createExpression(handler, handler.copyData(source), copiedChildren));
                    return WalkResult.CONTINUE;
                });
        Expression result = copies.get(expr);
        capture(result);
        for (Expression copy : copies.values()) {
            release(copy);
        }
        return result;
    }

    /**
     * 收集表达式中出现的所有变量，按首次出现的顺序，不重复。
     */
    public List<Variable> collectVariables(Expression expr) {
        Set<Variable> variables = new LinkedHashSet<>();
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        walker.walk(expr,
                frame -> {
                    if (isVariable(frame.getExpr())) {
                        variables.add(getVariable(frame.getExpr()));
                    }
                    return WalkResult.CONTINUE;
                },
                frame -> visited.add(frame.getCurrentChildExpr()) ? WalkResult.CONTINUE : WalkResult.SKIP,
                null, null);
        return new ArrayList<>(variables);
    }

    // ========== 锁 ==========

    /**
     * 给表达式加锁（或以负数解锁），并按单调性传递到子节点：
     * 递增的子节点继承同向的锁，递减的子节点交换两个方向，单调性未知时两个方向都加。
     * 变量节点的锁传递到变量本身。节点的锁全部解除时，其强化绑定与辅助变量被清除。
     */
    public void addLocks(Expression expr, int locksPos, int locksNeg) {
        if (locksPos == 0 && locksNeg == 0) {
            return;
        }
        Deque<Pair<Integer, Integer>> stack = new ArrayDeque<>();
        stack.push(Pair.of(locksPos, locksNeg));
        walker.walk(expr,
                frame -> {
                    Expression e = frame.getExpr();
                    Pair<Integer, Integer> locks = stack.peek();
                    e.addLocksInternal(locks.getLeft(), locks.getRight());
                    if (isVariable(e)) {
                        getVariable(e).addLocks(locks.getRight(), locks.getLeft());
                    }
                    if (!e.isLocked()) {
                        for (EnforcementBinding binding : e.clearEnforcementsInternal()) {
                            binding.getHandler().freeExpressionData(e, binding.getData());
                        }
                        e.setAuxVariable(null);
                        e.setCurvature(Curvature.UNKNOWN);
                        e.setIntegral(false);
                    }
                    return WalkResult.CONTINUE;
                },
                frame -> {
                    Expression e = frame.getExpr();
                    Pair<Integer, Integer> locks = stack.peek();
                    ExprHandler handler = e.getHandler();
                    Monotonicity monotonicity = handler.hasCapability(ExprCapability.MONOTONICITY)
                            ? handler.monotonicity(e, frame.getCurrentChild())
                            : Monotonicity.UNKNOWN;
                    Pair<Integer, Integer> childLocks;
                    switch (monotonicity) {
                        case INCREASING:
                            childLocks = locks;
                            break;
                        case DECREASING:
                            childLocks = Pair.of(locks.getRight(), locks.getLeft());
                            break;
                        case CONSTANT:
                            return WalkResult.SKIP;
                        default:
                            int both = locks.getLeft() + locks.getRight();
                            childLocks = Pair.of(both, both);
                            break;
                    }
                    stack.push(childLocks);
                    return WalkResult.CONTINUE;
                },
                frame -> {
                    stack.pop();
                    return WalkResult.CONTINUE;
                },
                null);
    }

    // ========== 分支得分 ==========

    /**
     * 给 expr 及其所有后代加上分支得分，每个节点只加一次。
     */
    public void addBranchScore(Expression expr, int tag, double score) {
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(expr);
        walker.walk(expr,
                frame -> {
                    frame.getExpr().addBranchScore(score, tag);
                    return WalkResult.CONTINUE;
                },
                frame -> visited.add(frame.getCurrentChildExpr()) ? WalkResult.CONTINUE : WalkResult.SKIP,
                null, null);
    }

    /**
     * 对每个有辅助变量的节点计算其在 point 处的违反量，并分配给它的子节点。
     * 节点有承担 BRANCH_SCORE 的强化绑定时由绑定计算，否则在处理器支持时由处理器计算。
     * 调用前节点的值必须已经在 point 处求出。
     * @return 违反量为正的节点数。
     */
    public int scoreBranching(Expression root, PointValuation point, int tag) {
        int[] violated = {0};
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        walker.walk(root, null,
                frame -> visited.add(frame.getCurrentChildExpr()) ? WalkResult.CONTINUE : WalkResult.SKIP,
                null,
                frame -> {
                    Expression e = frame.getExpr();
                    if (e.getAuxVariable() == null || !point.contains(e.getAuxVariable())) {
                        return WalkResult.CONTINUE;
                    }
                    double violation = computeViolation(e, point);
                    if (violation > 0.0) {
                        violated[0]++;
                        for (Expression child : e.getChildren()) {
                            addBranchScore(child, tag, violation);
                        }
                    }
                    return WalkResult.CONTINUE;
                });
        return violated[0];
    }

    /**
     * 在 point 处给出 expr 关于其子节点的线性估计。
     * 节点有承担 ESTIMATE 的强化绑定时按优先级取第一个非 null 的结果，否则在处理器支持时由处理器给出。
     * @param overestimate true 表示求上估计。
     * @return 估计，无法估计时返回 null。
     */
    public LinearEstimate estimate(Expression expr, PointValuation point, boolean overestimate) {
        checkOwnership(expr);
        boolean delegated = false;
        for (EnforcementBinding binding : expr.getEnforcements()) {
            if (binding.getMethods().contains(NlhdlrCapability.ESTIMATE)) {
                delegated = true;
                LinearEstimate estimate = binding.getHandler().estimate(expr, binding.getData(), point, overestimate);
                if (estimate != null) {
                    return estimate;
                }
            }
        }
        if (!delegated && expr.getHandler().hasCapability(ExprCapability.ESTIMATE)) {
            return expr.getHandler().estimate(expr, point, overestimate);
        }
        logger.debug("节点 {}#{} 没有可用的线性估计", expr.getHandler().getName(), expr.getSerial());
        return null;
    }

    private double computeViolation(Expression e, PointValuation point) {
        ExprHandler handler = e.getHandler();
        double violation = 0.0;
        boolean scored = false;
        for (EnforcementBinding binding : e.getEnforcements()) {
            if (binding.getMethods().contains(NlhdlrCapability.BRANCH_SCORE)) {
                violation = Math.max(violation, binding.getHandler().branchScore(e, binding.getData(), point));
                scored = true;
            }
        }
        if (!scored && handler.hasCapability(ExprCapability.BRANCH_SCORE)) {
            violation = handler.branchScore(e, point, point.getValue(e.getAuxVariable()));
            scored = true;
        }
        if (scored) {
            handler.recordBranchScore();
        }
        return violation;
    }

    // ========== 化简与比较 ==========

    /**
     * 化简为规范形式。
     * @return 规范形式，调用方持有一个引用；expr 仍需调用方单独释放。
     */
    public Expression simplify(Expression expr) {
        return simplifier.simplify(expr);
    }

    public int compare(Expression expr1, Expression expr2) {
        return comparator.compare(expr1, expr2);
    }

    // ========== 类型判断 ==========

    public boolean isValue(Expression expr) {
        return expr.getHandler() instanceof ValueHandler;
    }

    public boolean isVariable(Expression expr) {
        return expr.getHandler() instanceof VariableHandler;
    }

    public boolean isSum(Expression expr) {
        return expr.getHandler() instanceof SumHandler;
    }

    public boolean isProduct(Expression expr) {
        return expr.getHandler() instanceof ProductHandler;
    }

    public boolean isPow(Expression expr) {
        return expr.getHandler() instanceof PowHandler;
    }

    public double getValue(Expression valueExpr) {
        return ((ValueData) valueExpr.getData()).getValue();
    }

    public Variable getVariable(Expression varExpr) {
        return ((VariableData) varExpr.getData()).getVariable();
    }

    private void checkOwnership(Expression expr) {
        if (expr.getEngine() != this) {
            logger.error("ExprEngine: 节点 {}#{} 属于另一个引擎", expr.getHandler().getName(), expr.getSerial());
            throw new IllegalArgumentException("表达式节点属于另一个引擎");
        }
    }
}
