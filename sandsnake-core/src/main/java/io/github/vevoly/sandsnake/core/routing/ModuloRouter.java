package io.github.vevoly.sandsnake.core.routing;

import io.github.vevoly.sandsnake.api.exception.SandsnakeRoutingException;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.CRC32;

/**
 * 取模路由器：{@code CRC32(key) mod N}。
 * 实现简单，但节点数量变化时几乎所有 key 都会被重新映射。
 * <p>
 * Modulo router: {@code CRC32(key) mod N}.
 * Simple, but changing the node count remaps nearly every key.
 *
 * @param <T> 节点类型 / the node type
 * @author vevoly
 */
public class ModuloRouter<T> implements ConnectionRouter<T> {

    private final List<T> nodes;

    public ModuloRouter(List<T> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new SandsnakeRoutingException("Cannot route without nodes");
        }
        this.nodes = List.copyOf(nodes);
    }

    @Override
    public T route(String key) {
        if (key == null) {
            throw new SandsnakeRoutingException("Cannot route a null key");
        }
        CRC32 crc = new CRC32();
        crc.update(key.getBytes(StandardCharsets.UTF_8));
        return nodes.get((int) (crc.getValue() % nodes.size()));
    }

    @Override
    public List<T> getNodes() {
        return nodes;
    }
}
