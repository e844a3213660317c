package org.cipexpr.nlhdlr;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * {@link NonlinearHandler#detect} 的结果：处理器承担哪些方法、负责强化哪一侧，以及它为该节点保存的私有数据。
 */
@Getter
public final class DetectionResult {

    public static final DetectionResult NONE = new DetectionResult(EnumSet.noneOf(NlhdlrCapability.class), false, false, null);

    private final Set<NlhdlrCapability> methods;
    private final boolean enforcesBelow;
    private final boolean enforcesAbove;
    private final Object data;

    private DetectionResult(Set<NlhdlrCapability> methods, boolean enforcesBelow, boolean enforcesAbove, Object data) {
        this.methods = Collections.unmodifiableSet(methods.isEmpty()
                ? EnumSet.noneOf(NlhdlrCapability.class) : EnumSet.copyOf(methods));
        this.enforcesBelow = enforcesBelow;
        this.enforcesAbove = enforcesAbove;
        this.data = data;
    }

    public static DetectionResult of(Set<NlhdlrCapability> methods, boolean enforcesBelow, boolean enforcesAbove, Object data) {
        return new DetectionResult(methods, enforcesBelow, enforcesAbove, data);
    }

    /**
     * 处理器是否需要参与这个节点。
     */
    public boolean isSuccess() {
        return !methods.isEmpty() || enforcesBelow || enforcesAbove;
    }

    @Override
    public String toString() {
        return "Detection{methods=" + methods + ", below=" + enforcesBelow + ", above=" + enforcesAbove + "}";
    }
}
