package io.github.vevoly.sandsnake.api.routing;

import java.util.List;

/**
 * 将物理 key 映射到某个后端连接的路由器。
 * <p>
 * 对于同一份节点配置，同一个 key 总是路由到同一个节点。实现在构造后不可变，因此是线程安全的。
 * <p>
 * Maps a physical key to one of the configured backend connections.
 * For a fixed node configuration the same key always routes to the same node.
 * Implementations are immutable after construction and therefore thread-safe.
 *
 * @param <T> 节点类型 / the node type
 * @author vevoly
 */
public interface ConnectionRouter<T> {

    /**
     * 选择负责给定 key 的节点。
     * <p>
     * Selects the node responsible for the given key.
     *
     * @param key 物理 key / the physical key
     * @return 负责该 key 的节点 / the node owning the key
     * @throws io.github.vevoly.sandsnake.api.exception.SandsnakeRoutingException 如果 key 无法映射 / if the key cannot be mapped
     */
    T route(String key);

    /**
     * @return 参与路由的全部节点，按配置顺序 / every routed node, in configuration order
     */
    List<T> getNodes();
}
