package org.cipexpr.config;

/**
 * 加载引擎配置失败时抛出：文件不存在、YAML 格式错误或取值非法。
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
