package org.cipexpr.propagation;

import org.cipexpr.core.Variable;
import org.cipexpr.utils.Interval;

/**
 * 正向传播时为变量叶子提供区间。
 */
@FunctionalInterface
public interface LeafIntervalSource {

    Interval getInterval(Variable variable);
}
