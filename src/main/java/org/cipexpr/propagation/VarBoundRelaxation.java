package org.cipexpr.propagation;

import java.util.Locale;

/**
 * 计算叶子区间时对连续变量界的放宽方式。
 */
public enum VarBoundRelaxation {
    NONE("n"),
    // 每个界放宽固定量
    ABSOLUTE("a"),
    // 放宽量乘以 max(1, |界|)
    RELATIVE("r");

    private final String symbol;

    VarBoundRelaxation(String symbol) {
        this.symbol = symbol;
    }

    /**
     * 按名称或单字符缩写解析，大小写不敏感。
     * @throws IllegalArgumentException 如果无法识别。
     */
    public static VarBoundRelaxation parse(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (VarBoundRelaxation value : values()) {
            if (value.symbol.equals(normalized) || value.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("未知的变量界放宽方式: " + text);
    }
}
