package org.cipexpr.expressions.handlers;

import lombok.Getter;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprData;

import java.util.Objects;

/**
 * 变量节点引用的问题变量。
 */
@Getter
public final class VariableData implements ExprData {

    private final Variable variable;

    public VariableData(Variable variable) {
        this.variable = Objects.requireNonNull(variable, "VariableData: variable 不能为 null");
    }

    @Override
    public VariableData copy() {
        return this;
    }
}
