package io.github.vevoly.sandsnake.api.exception;

/**
 * 后端类型无法解析或配置缺失/非法。总是在建立任何连接之前抛出。
 * <p>
 * Thrown when the backend type cannot be resolved or required settings are missing or invalid.
 * Always raised before any connection is opened.
 *
 * @author vevoly
 */
public class SandsnakeConfigurationException extends SandsnakeException {

    public SandsnakeConfigurationException(String message) {
        super(message);
    }

    public SandsnakeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
