package io.github.vevoly.sandsnake.api.exception;

/**
 * 节点列表为空，或某个 key 无法映射到节点。
 * <p>
 * Thrown when the node list is empty or a key cannot be mapped to a node.
 *
 * @author vevoly
 */
public class SandsnakeRoutingException extends SandsnakeException {

    public SandsnakeRoutingException(String message) {
        super(message);
    }
}
