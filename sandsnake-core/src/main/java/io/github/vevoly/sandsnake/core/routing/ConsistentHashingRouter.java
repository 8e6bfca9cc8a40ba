package io.github.vevoly.sandsnake.core.routing;

import io.github.vevoly.sandsnake.api.exception.SandsnakeRoutingException;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 基于 ketama 算法的一致性哈希路由器。
 * <p>
 * 每个节点在环上放置 {@code virtualNodes} 个虚拟点，点的位置取自 {@code "<nodeId>-<i>"} 的 MD5 摘要，
 * 每个摘要切分出 4 个 32 位的点。Key 的 MD5 前 4 个字节决定它在环上的位置，顺时针找到的第一个点即负责节点。
 * 增加一个节点只会重新映射大约 1/N 的 key。
 * <p>
 * A ketama-style consistent hashing router.
 * Each node places {@code virtualNodes} points on the ring, derived from the MD5 digest of {@code "<nodeId>-<i>"},
 * four 32-bit points per digest. The first four bytes of the key's MD5 locate it on the ring and the first point
 * clockwise owns it. Adding a node remaps roughly 1/N of the keys.
 *
 * @param <T> 节点类型 / the node type
 * @author vevoly
 */
public class ConsistentHashingRouter<T> implements ConnectionRouter<T> {

    private static final int POINTS_PER_DIGEST = 4;

    private final List<T> nodes;
    private final NavigableMap<Long, T> ring;

    /**
     * @param nodes        节点，按配置顺序 / nodes in configuration order
     * @param nodeId       节点在环上的标识 / the identity of a node on the ring
     * @param virtualNodes 每个节点的虚拟点数 / ring points per node
     */
    public ConsistentHashingRouter(List<T> nodes, Function<T, String> nodeId, int virtualNodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new SandsnakeRoutingException("Cannot build a hash ring without nodes");
        }
        if (virtualNodes <= 0) {
            throw new SandsnakeRoutingException("Virtual node count must be positive, got " + virtualNodes);
        }
        this.nodes = List.copyOf(nodes);
        TreeMap<Long, T> points = new TreeMap<>();
        int digests = Math.max(1, virtualNodes / POINTS_PER_DIGEST);
        for (T node : this.nodes) {
            String id = nodeId.apply(node);
            for (int i = 0; i < digests; i++) {
                byte[] digest = md5(id + "-" + i);
                for (int h = 0; h < POINTS_PER_DIGEST; h++) {
                    // 同一位置冲突时保留先加入的节点 / On a collision the earlier node keeps the point
                    points.putIfAbsent(point(digest, h), node);
                }
            }
        }
        this.ring = Collections.unmodifiableNavigableMap(points);
    }

    @Override
    public T route(String key) {
        if (key == null) {
            throw new SandsnakeRoutingException("Cannot route a null key");
        }
        Map.Entry<Long, T> entry = ring.ceilingEntry(point(md5(key), 0));
        if (entry == null) {
            entry = ring.firstEntry();
        }
        return entry.getValue();
    }

    @Override
    public List<T> getNodes() {
        return nodes;
    }

    int ringSize() {
        return ring.size();
    }

    private static long point(byte[] digest, int index) {
        int offset = index * 4;
        return ((long) (digest[offset + 3] & 0xFF) << 24)
                | ((long) (digest[offset + 2] & 0xFF) << 16)
                | ((long) (digest[offset + 1] & 0xFF) << 8)
                | (digest[offset] & 0xFF);
    }

    private static byte[] md5(String value) {
        try {
            // MessageDigest 不是线程安全的，每次调用新建 / MessageDigest is not thread-safe, one per call
            return MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
