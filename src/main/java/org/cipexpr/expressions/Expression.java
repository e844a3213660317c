package org.cipexpr.expressions; // 放在 expressions 包下

import lombok.Getter;
import org.cipexpr.core.Variable;
import org.cipexpr.nlhdlr.EnforcementBinding;
import org.cipexpr.utils.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 表达式 DAG 的节点。节点由处理器、处理器私有数据与有序的子节点列表组成，
 * 子节点可以被多个父节点共享。节点的生命周期由显式引用计数管理：
 * 通过 {@link ExprEngine#capture} 增加引用，{@link ExprEngine#release} 减少引用，
 * 引用计数归零时节点连同不再被引用的后代一起释放。
 * <p>
 * 除结构外，节点还缓存求值结果、区间、导数与各种分析结果，每个缓存都带有一个标签，
 * 标签与当前会话的标签一致时缓存才有效。
 *
 * @author Ayalyt
 */
@Getter
public final class Expression {

    private static final Logger logger = LoggerFactory.getLogger(Expression.class);

    /** 求值失败（定义域之外）时的取值。 */
    public static final double INVALID_VALUE = Double.NaN;

    public static boolean isInvalid(double value) {
        return Double.isNaN(value);
    }

    private final ExprEngine engine;
    private final long serial;
    private final ExprHandler handler;
    private ExprData data;
    private final List<Expression> children;

    private int refCount;
    private boolean freed;

    // 求值与求导缓存
    private double value = INVALID_VALUE;
    private int valueTag;
    private double derivative;
    private int diffTag;

    // 区间传播状态
    private Interval interval = Interval.ENTIRE;
    private int intervalTag;
    private boolean changed;
    private boolean inQueue;

    // 分析结果
    private Curvature curvature = Curvature.UNKNOWN;
    private boolean integral;

    // 锁：locksPos 表示增大此表达式的值可能破坏约束，locksNeg 同理
    private int locksPos;
    private int locksNeg;

    private Variable auxVariable;
    private final List<EnforcementBinding> enforcements;

    private double branchScore;
    private int branchScoreTag;

    Expression(ExprEngine engine, long serial, ExprHandler handler, ExprData data) {
        this.engine = engine;
        this.serial = serial;
        this.handler = handler;
        this.data = data;
        this.children = new ArrayList<>();
        this.enforcements = new ArrayList<>();
    }

    // ========== 结构 ==========

    /**
     * @return 子节点的只读视图。
     */
    public List<Expression> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getNChildren() {
        return children.size();
    }

    public Expression getChild(int index) {
        return children.get(index);
    }

    /**
     * 替换处理器数据。只应由处理器自身或构造阶段调用。
     */
    public void setData(ExprData data) {
        this.data = data;
    }

    void appendChildInternal(Expression child) {
        children.add(child);
    }

    Expression setChildInternal(int index, Expression child) {
        return children.set(index, child);
    }

    List<Expression> clearChildrenInternal() {
        List<Expression> old = new ArrayList<>(children);
        children.clear();
        return old;
    }

    void incRef() {
        refCount++;
    }

    void decRef() {
        refCount--;
    }

    void markFreed() {
        freed = true;
    }

    void ensureAlive() {
        if (freed) {
            logger.error("Expression: 访问了已释放的节点 {}#{}", handler.getName(), serial);
            throw new IllegalStateException("表达式节点 " + handler.getName() + "#" + serial + " 已被释放");
        }
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    // ========== 缓存 ==========

    public void setValue(double value, int tag) {
        this.value = value;
        this.valueTag = tag;
    }

    public void setDerivative(double derivative, int tag) {
        this.derivative = derivative;
        this.diffTag = tag;
    }

    /**
     * 记录区间及其对应的边界标签。
     */
    public void setInterval(Interval interval, int tag) {
        this.interval = interval;
        this.intervalTag = tag;
    }

    public void setChanged(boolean changed) {
        this.changed = changed;
    }

    public void setInQueue(boolean inQueue) {
        this.inQueue = inQueue;
    }

    public void setCurvature(Curvature curvature) {
        this.curvature = curvature;
    }

    public void setIntegral(boolean integral) {
        this.integral = integral;
    }

    void addLocksInternal(int pos, int neg) {
        locksPos += pos;
        locksNeg += neg;
        if (locksPos < 0 || locksNeg < 0) {
            logger.error("Expression: 节点 {}#{} 的锁计数变为负数: pos={}, neg={}", handler.getName(), serial, locksPos, locksNeg);
            throw new IllegalStateException("表达式节点的锁计数变为负数");
        }
    }

    public boolean isLocked() {
        return locksPos > 0 || locksNeg > 0;
    }

    public void setAuxVariable(Variable auxVariable) {
        this.auxVariable = auxVariable;
    }

    public List<EnforcementBinding> getEnforcements() {
        return Collections.unmodifiableList(enforcements);
    }

    public void addEnforcement(EnforcementBinding binding) {
        enforcements.add(binding);
    }

    List<EnforcementBinding> clearEnforcementsInternal() {
        List<EnforcementBinding> old = new ArrayList<>(enforcements);
        enforcements.clear();
        return old;
    }

    /**
     * 累加分支得分；标签变化时先清零。
     */
    public void addBranchScore(double score, int tag) {
        if (branchScoreTag != tag) {
            branchScore = 0.0;
            branchScoreTag = tag;
        }
        branchScore += score;
    }

    @Override
    public String toString() {
        if (freed) {
            return handler.getName() + "#" + serial + "(freed)";
        }
        return engine.getPrinter().print(this);
    }
}
