package org.cipexpr.core;

/**
 * 变量类型。二元变量与整数变量都是整数型的。
 */
public enum VariableType {
    CONTINUOUS,
    INTEGER,
    BINARY,
    // 非线性约束为子表达式引入的辅助变量
    AUXILIARY;

    public boolean isIntegral() {
        return this == INTEGER || this == BINARY;
    }
}
