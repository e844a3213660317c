package org.cipexpr.nlhdlr;

import lombok.Getter;

import java.util.Set;

/**
 * 节点上的一个强化绑定：哪个非线性处理器、它的私有数据、它承担的方法与强化的一侧。
 * 绑定随节点释放或解锁而被清除，届时调用 {@link NonlinearHandler#freeExpressionData}。
 */
@Getter
public final class EnforcementBinding {

    private final NonlinearHandler handler;
    private final Object data;
    private final Set<NlhdlrCapability> methods;
    private final boolean enforcesBelow;
    private final boolean enforcesAbove;

    public EnforcementBinding(NonlinearHandler handler, DetectionResult detection) {
        this.handler = handler;
        this.data = detection.getData();
        this.methods = detection.getMethods();
        this.enforcesBelow = detection.isEnforcesBelow();
        this.enforcesAbove = detection.isEnforcesAbove();
    }

    @Override
    public String toString() {
        return handler.getName() + methods;
    }
}
