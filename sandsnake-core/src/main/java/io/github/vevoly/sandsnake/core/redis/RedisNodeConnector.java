package io.github.vevoly.sandsnake.core.redis;

import io.github.vevoly.sandsnake.api.config.ResolvedHostConfig;
import io.github.vevoly.sandsnake.api.redis.RedisClient;

/**
 * 为单个节点配置建立连接。
 * <p>
 * Opens the connection of a single node descriptor.
 *
 * @author vevoly
 */
@FunctionalInterface
public interface RedisNodeConnector {

    /**
     * @throws io.github.vevoly.sandsnake.api.exception.SandsnakeConnectionException 如果节点不可达 / if the node is unreachable
     */
    RedisClient connect(ResolvedHostConfig host);
}
