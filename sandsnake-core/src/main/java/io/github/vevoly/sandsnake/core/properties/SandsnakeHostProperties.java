package io.github.vevoly.sandsnake.core.properties;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.time.Duration;
import java.util.List;

/**
 * 映射单个 Redis 节点的连接参数。所有属性均可为空，为空时依次回退到 {@code defaults} 和框架默认值。
 * <p>
 * Maps the connection parameters of a single Redis node. Every property is optional and falls back
 * to {@code defaults}, then to framework defaults.
 *
 * @author vevoly
 */
@Data
public class SandsnakeHostProperties {

    /**
     * 节点名称，也是一致性哈希环上的标识。为空时使用 "host-{序号}"。
     * 修改名称会改变 key 的路由结果。
     * <p>
     * Node name, also its identity on the consistent hash ring. Defaults to "host-{index}".
     * Renaming a node changes where keys route.
     */
    private String name;

    private String host;

    private Integer port;

    /**
     * Redis 数据库编号。
     * <p>
     * The Redis database index.
     */
    private Integer db;

    private String password;

    /**
     * 单条命令的超时时间（例如 3s）。
     * <p>
     * Command timeout (e.g. 3s).
     */
    @JsonAlias("socket_timeout")
    private Duration timeout;

    @JsonAlias("connect_timeout")
    private Duration connectTimeout;

    private Boolean ssl;

    /**
     * Redis Cluster 的种子节点 ("host:port")。设置后该节点以集群模式连接。
     * <p>
     * Redis Cluster seed nodes ("host:port"). When set, the node connects in cluster mode.
     */
    @JsonAlias("cluster_nodes")
    private List<String> clusterNodes;

    @JsonAlias("connection_pool_size")
    private Integer connectionPoolSize;

    @JsonAlias("connection_minimum_idle_size")
    private Integer connectionMinimumIdleSize;
}
