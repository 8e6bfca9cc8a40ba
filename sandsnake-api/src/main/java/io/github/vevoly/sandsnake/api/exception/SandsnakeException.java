package io.github.vevoly.sandsnake.api.exception;

/**
 * sandsnake 所有领域异常的基类。
 * <p>
 * 框架不做任何静默吞掉异常或自动重试的处理，所有异常都会原样抛给调用方。
 * <p>
 * Base exception for all sandsnake domain exceptions.
 * The framework never swallows errors and never retries; every exception surfaces to the caller.
 *
 * @author vevoly
 */
public abstract class SandsnakeException extends RuntimeException {

    /**
     * 发生错误的后端节点名称，可能为 null。
     * <p>
     * Name of the backend node involved, may be null.
     */
    private final String nodeName;

    protected SandsnakeException(String message) {
        super(message);
        this.nodeName = null;
    }

    protected SandsnakeException(String message, Throwable cause) {
        super(message, cause);
        this.nodeName = null;
    }

    protected SandsnakeException(String message, String nodeName) {
        super(message);
        this.nodeName = nodeName;
    }

    protected SandsnakeException(String message, String nodeName, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }

    /**
     * 返回与此异常关联的节点名称。
     * <p>
     * Returns the node name associated with this exception, if any.
     */
    public String getNodeName() {
        return nodeName;
    }
}
