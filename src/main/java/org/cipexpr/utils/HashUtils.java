package org.cipexpr.utils;

/**
 * 结构哈希用到的混合函数。
 */
public final class HashUtils {

    // 2^64 / 黄金分割比
    private static final long FIBONACCI_MULTIPLIER = 0x9E3779B97F4A7C15L;

    private HashUtils() {
    }

    /**
     * 对浮点数做 Fibonacci 哈希。-0.0 与 0.0 得到相同的结果。
     */
    public static long fibHash(double value) {
        long bits = Double.doubleToLongBits(value == 0.0 ? 0.0 : value);
        return (bits * FIBONACCI_MULTIPLIER) >>> 16;
    }

    public static long fibHash(long value) {
        return (value * FIBONACCI_MULTIPLIER) >>> 16;
    }

    public static long stringHash(String s) {
        long h = 1125899906842597L;
        for (int i = 0; i < s.length(); i++) {
            h = 31 * h + s.charAt(i);
        }
        return h;
    }
}
