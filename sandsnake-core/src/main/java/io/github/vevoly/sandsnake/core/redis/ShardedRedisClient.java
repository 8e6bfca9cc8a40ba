package io.github.vevoly.sandsnake.core.redis;

import io.github.vevoly.sandsnake.api.exception.SandsnakeBackendException;
import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.api.redis.batch.BatchOperation;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.core.redis.batch.ShardedBatchOperation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 多节点的 {@link RedisClient}：每个 key 通过 {@link ConnectionRouter} 路由到一个节点客户端。
 * <p>
 * 单 key 命令直接转发给负责该 key 的节点；多 key 删除按节点分组后分别执行。
 * 同一个对象的不同 Key 可能位于不同节点上，因此这里不提供任何跨 key 的原子性。
 * <p>
 * A multi-node {@link RedisClient}: every key is routed through the {@link ConnectionRouter} to one node client.
 * Single-key commands go straight to the owning node; a multi-key delete is grouped per node.
 * Keys of one object may live on different nodes, so no cross-key atomicity is offered.
 *
 * @author vevoly
 */
@Slf4j
public class ShardedRedisClient implements RedisClient {

    @Getter
    private final ConnectionRouter<RedisNode> router;

    public ShardedRedisClient(ConnectionRouter<RedisNode> router) {
        this.router = router;
    }

    /**
     * 负责给定 key 的节点客户端。
     * <p>
     * The node client owning the given key.
     */
    public RedisClient clientFor(String key) {
        return router.route(key).getClient();
    }

    @Override
    public boolean exists(String key) {
        return clientFor(key).exists(key);
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0L;
        }
        Map<RedisNode, List<String>> grouped = new LinkedHashMap<>();
        for (String key : keys) {
            grouped.computeIfAbsent(router.route(key), n -> new ArrayList<>()).add(key);
        }
        long deleted = 0L;
        for (Map.Entry<RedisNode, List<String>> entry : grouped.entrySet()) {
            deleted += entry.getKey().getClient().delete(entry.getValue().toArray(new String[0]));
        }
        return deleted;
    }

    @Override
    public boolean zAdd(String key, String member, double score) {
        return clientFor(key).zAdd(key, member, score);
    }

    @Override
    public boolean zRem(String key, String member) {
        return clientFor(key).zRem(key, member);
    }

    @Override
    public List<ScoredMember> zRangeWithScores(String key, int start, int stop, boolean reversed) {
        return clientFor(key).zRangeWithScores(key, start, stop, reversed);
    }

    @Override
    public List<ScoredMember> zRangeByScore(String key, ScoreRange range, boolean reversed, int offset, Integer limit) {
        return clientFor(key).zRangeByScore(key, range, reversed, offset, limit);
    }

    @Override
    public long zCard(String key) {
        return clientFor(key).zCard(key);
    }

    @Override
    public void sAdd(String key, String... members) {
        clientFor(key).sAdd(key, members);
    }

    @Override
    public void sRem(String key, String... members) {
        clientFor(key).sRem(key, members);
    }

    @Override
    public Set<String> sMembers(String key) {
        return clientFor(key).sMembers(key);
    }

    @Override
    public long sCard(String key) {
        return clientFor(key).sCard(key);
    }

    @Override
    public String hGet(String key, String field) {
        return clientFor(key).hGet(key, field);
    }

    @Override
    public void hSet(String key, String field, String value) {
        clientFor(key).hSet(key, field, value);
    }

    @Override
    public void hDel(String key, String... fields) {
        clientFor(key).hDel(key, fields);
    }

    @Override
    public Map<String, String> hGetAll(String key) {
        return clientFor(key).hGetAll(key);
    }

    @Override
    public BatchOperation createBatchOperation() {
        return new ShardedBatchOperation(router);
    }

    /**
     * 关闭所有节点。某个节点关闭失败不会影响其他节点，最后抛出汇总的异常。
     * <p>
     * Closes every node. A node failing to close does not stop the others; the errors are thrown together at the end.
     */
    @Override
    public void close() {
        SandsnakeBackendException failure = null;
        for (RedisNode node : router.getNodes()) {
            try {
                node.getClient().close();
            } catch (RuntimeException e) {
                log.warn("[Sandsnake] Failed to close redis node '{}'.", node.getName(), e);
                if (failure == null) {
                    failure = new SandsnakeBackendException("Failed to close one or more redis nodes");
                }
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
