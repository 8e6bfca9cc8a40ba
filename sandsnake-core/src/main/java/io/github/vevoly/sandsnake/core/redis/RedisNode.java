package io.github.vevoly.sandsnake.core.redis;

import io.github.vevoly.sandsnake.api.redis.RedisClient;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 一个已连接的后端节点：节点名称加上它的单节点客户端。
 * <p>
 * A connected backend node: the node name and its single-node client.
 *
 * @author vevoly
 */
@Getter
@ToString(of = "name")
@RequiredArgsConstructor
public final class RedisNode {

    private final String name;
    private final RedisClient client;
}
