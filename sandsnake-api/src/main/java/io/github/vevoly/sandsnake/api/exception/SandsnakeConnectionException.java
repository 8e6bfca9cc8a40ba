package io.github.vevoly.sandsnake.api.exception;

/**
 * 访问后端节点时发生传输层错误（连接失败、超时）。
 * <p>
 * Transport failure while reaching a backend node (connect failure, timeout).
 *
 * @author vevoly
 */
public class SandsnakeConnectionException extends SandsnakeException {

    public SandsnakeConnectionException(String message, String nodeName) {
        super(message, nodeName);
    }

    public SandsnakeConnectionException(String message, String nodeName, Throwable cause) {
        super(message, nodeName, cause);
    }
}
