package io.github.vevoly.sandsnake.api.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 归一化后的单个后端节点配置。
 * <p>
 * 此对象是节点自身配置、{@code defaults} 以及框架默认值合并后的最终、不可变的结果。
 * 每个实例对应一个连接池。
 * <p>
 * The normalized configuration of a single backend node.
 * This object is the final, immutable result of merging the host entry, the shared {@code defaults} and framework defaults.
 * Each instance backs one connection pool.
 *
 * @author vevoly
 */
@Getter
@Builder
@ToString(exclude = "password")
@AllArgsConstructor
public final class ResolvedHostConfig {

    /**
     * 节点名称，也是一致性哈希环上的节点标识。
     * <p>
     * The node name, also its identity on the consistent hash ring.
     */
    private final String name;

    private final String host;

    private final int port;

    /**
     * Redis 数据库编号。
     * <p>
     * The Redis database index.
     */
    private final int db;

    private final String password;

    /**
     * 单条命令的超时时间。
     * <p>
     * Timeout of a single command.
     */
    private final Duration timeout;

    private final Duration connectTimeout;

    private final boolean ssl;

    /**
     * Redis Cluster 的种子节点 ("host:port")。为空表示单机模式。
     * <p>
     * Redis Cluster seed nodes ("host:port"). Empty means single-server mode.
     */
    @Builder.Default
    private final List<String> clusterNodes = List.of();

    private final int connectionPoolSize;

    private final int connectionMinimumIdleSize;

    public boolean isClusterMode() {
        return clusterNodes != null && !clusterNodes.isEmpty();
    }

    /**
     * 单机模式下的 Redis 连接地址，例如 {@code redis://localhost:6379}。
     * <p>
     * The Redis address in single-server mode, e.g. {@code redis://localhost:6379}.
     */
    public String getAddress() {
        return toAddress(host + ":" + port);
    }

    /**
     * 给 "host:port" 加上 {@code redis://} 或 {@code rediss://} 协议头。
     * <p>
     * Prefixes "host:port" with the {@code redis://} or {@code rediss://} scheme.
     */
    public String toAddress(String hostAndPort) {
        return (ssl ? "rediss://" : "redis://") + hostAndPort;
    }
}
