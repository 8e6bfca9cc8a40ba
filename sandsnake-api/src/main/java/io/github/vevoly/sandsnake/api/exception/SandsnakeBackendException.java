package io.github.vevoly.sandsnake.api.exception;

/**
 * 存储引擎返回了异常或无法识别的响应，当前操作被中止。
 * <p>
 * Malformed or unexpected response from the storage engine; the operation is aborted.
 *
 * @author vevoly
 */
public class SandsnakeBackendException extends SandsnakeException {

    public SandsnakeBackendException(String message) {
        super(message);
    }

    public SandsnakeBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    public SandsnakeBackendException(String message, String nodeName, Throwable cause) {
        super(message, nodeName, cause);
    }
}
