package org.cipexpr.expressions;

/**
 * 表达式处理器私有的节点数据，例如和式的系数或幂的指数。
 */
public interface ExprData {

    /**
     * 深拷贝，用于复制表达式。
     */
    ExprData copy();
}
