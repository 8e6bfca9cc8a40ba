package io.github.vevoly.sandsnake.api.constants;

/**
 * 框架中使用的所有公共常量的集合。
 * <p>
 * A collection of all public constants used within the framework.
 *
 * @author vevoly
 */
public interface SandsnakeConstants {

    // ===================================================================
    // ====================== Key 相关常量 / Key Constants =================
    // ===================================================================

    /**
     * 所有物理 Key 的默认前缀。
     * <p>
     * The default prefix of every physical key.
     */
    String DEFAULT_PREFIX = "ssnake:";

    /**
     * 未指定名称时使用的默认 marker 名称。
     * <p>
     * The marker name used when none is given.
     */
    String DEFAULT_MARKER_NAME = "_ssdefault";

    // ===================================================================
    // ====================== 全局默认配置值 / Global Default Values ======================
    // ===================================================================

    /**
     * 默认的后端类型。
     * <p>
     * The default backend type.
     */
    String DEFAULT_BACKEND_TYPE = DefaultBackendTypes.REDIS;

    /**
     * 默认的路由算法。
     * <p>
     * The default routing algorithm.
     */
    String DEFAULT_ROUTER_TYPE = DefaultRouterTypes.CONSISTENT_HASH;

    /**
     * 一致性哈希环上每个节点的默认虚拟节点数 (ketama 惯例: 40 组 x 4 个点)。
     * <p>
     * Default number of virtual nodes per host on the consistent hash ring (ketama convention: 40 digests x 4 points).
     */
    int DEFAULT_VIRTUAL_NODES = 160;

    String DEFAULT_HOST = "localhost";

    int DEFAULT_PORT = 6379;

    int DEFAULT_DB = 0;

    /**
     * 命令默认超时时间（毫秒）。
     * <p>
     * Default command timeout in milliseconds.
     */
    long DEFAULT_TIMEOUT_MILLIS = 3000L;

    /**
     * 建连默认超时时间（毫秒）。
     * <p>
     * Default connect timeout in milliseconds.
     */
    long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000L;

    int DEFAULT_CONNECTION_POOL_SIZE = 64;

    int DEFAULT_CONNECTION_MINIMUM_IDLE_SIZE = 8;

    // ===================================================================
    // ====================== 分数相关常量 / Score Constants ================
    // ===================================================================

    /**
     * 时间戳分数中每秒的刻度数：分数 = 秒 * 10000 + 亚秒位 (100 微秒精度)。
     * <p>
     * Ticks per second in timestamp scores: score = seconds * 10000 + sub-second ticks (100 microsecond resolution).
     */
    long SCORE_TICKS_PER_SECOND = 10_000L;
}
