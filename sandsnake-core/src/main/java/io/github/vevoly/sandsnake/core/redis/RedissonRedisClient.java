package io.github.vevoly.sandsnake.core.redis;

import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.api.redis.batch.BatchOperation;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.core.redis.batch.RedissonBatchOperation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RMap;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.redisson.client.protocol.ScoredEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link RedisClient} 接口基于 Redisson 的单节点实现。
 * <p>
 * 所有数据结构都使用 {@link StringCodec}，成员、字段和值在 Redis 中以原样字符串保存。
 * Redisson 的异常在这里统一转换为 sandsnake 异常。
 * <p>
 * A single-node implementation of the {@link RedisClient} interface based on Redisson.
 * Every structure uses {@link StringCodec}, so members, fields and values are stored as plain strings.
 * Redisson exceptions are translated into sandsnake exceptions here.
 *
 * @author vevoly
 */
@Slf4j
public class RedissonRedisClient implements RedisClient {

    @Getter
    private final String nodeName;
    private final RedissonClient redisson;

    public RedissonRedisClient(String nodeName, RedissonClient redisson) {
        this.nodeName = nodeName;
        this.redisson = redisson;
    }

    @Override
    public boolean exists(String key) {
        return call(() -> redisson.getKeys().countExists(key) > 0);
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0L;
        }
        return call(() -> redisson.getKeys().delete(keys));
    }

    // ===================================================================
    // ======================== ZSet Operations ==========================
    // ===================================================================

    @Override
    public boolean zAdd(String key, String member, double score) {
        return call(() -> zset(key).add(score, member));
    }

    @Override
    public boolean zRem(String key, String member) {
        return call(() -> zset(key).remove(member));
    }

    @Override
    public List<ScoredMember> zRangeWithScores(String key, int start, int stop, boolean reversed) {
        return call(() -> {
            RScoredSortedSet<String> zset = zset(key);
            return toScoredMembers(reversed ? zset.entryRangeReversed(start, stop) : zset.entryRange(start, stop));
        });
    }

    @Override
    public List<ScoredMember> zRangeByScore(String key, ScoreRange range, boolean reversed, int offset, Integer limit) {
        return call(() -> {
            RScoredSortedSet<String> zset = zset(key);
            Collection<ScoredEntry<String>> entries;
            if (offset == 0 && limit == null) {
                entries = reversed
                        ? zset.entryRangeReversed(range.getMin(), range.isMinInclusive(), range.getMax(), range.isMaxInclusive())
                        : zset.entryRange(range.getMin(), range.isMinInclusive(), range.getMax(), range.isMaxInclusive());
            } else {
                // LIMIT offset -1 表示不限制条数 / LIMIT offset -1 means no count limit
                int count = limit == null ? -1 : limit;
                entries = reversed
                        ? zset.entryRangeReversed(range.getMin(), range.isMinInclusive(), range.getMax(), range.isMaxInclusive(), offset, count)
                        : zset.entryRange(range.getMin(), range.isMinInclusive(), range.getMax(), range.isMaxInclusive(), offset, count);
            }
            return toScoredMembers(entries);
        });
    }

    @Override
    public long zCard(String key) {
        return call(() -> (long) zset(key).size());
    }

    // ===================================================================
    // ======================== Set Operations ===========================
    // ===================================================================

    @Override
    public void sAdd(String key, String... members) {
        if (members == null || members.length == 0) {
            return;
        }
        call(() -> set(key).addAll(Arrays.asList(members)));
    }

    @Override
    public void sRem(String key, String... members) {
        if (members == null || members.length == 0) {
            return;
        }
        call(() -> set(key).removeAll(Arrays.asList(members)));
    }

    @Override
    public Set<String> sMembers(String key) {
        return call(() -> set(key).readAll());
    }

    @Override
    public long sCard(String key) {
        return call(() -> (long) set(key).size());
    }

    // ===================================================================
    // ======================== Hash Operations ==========================
    // ===================================================================

    @Override
    public String hGet(String key, String field) {
        return call(() -> map(key).get(field));
    }

    @Override
    public void hSet(String key, String field, String value) {
        call(() -> map(key).fastPut(field, value));
    }

    @Override
    public void hDel(String key, String... fields) {
        if (fields == null || fields.length == 0) {
            return;
        }
        call(() -> map(key).fastRemove(fields));
    }

    @Override
    public Map<String, String> hGetAll(String key) {
        return call(() -> map(key).readAllMap());
    }

    @Override
    public BatchOperation createBatchOperation() {
        return new RedissonBatchOperation(nodeName, redisson.createBatch(BatchOptions.defaults()));
    }

    @Override
    public void close() {
        if (!redisson.isShutdown()) {
            log.debug("[Sandsnake] Shutting down redis node '{}'.", nodeName);
            redisson.shutdown();
        }
    }

    private RScoredSortedSet<String> zset(String key) {
        return redisson.getScoredSortedSet(key, StringCodec.INSTANCE);
    }

    private RSet<String> set(String key) {
        return redisson.getSet(key, StringCodec.INSTANCE);
    }

    private RMap<String, String> map(String key) {
        return redisson.getMap(key, StringCodec.INSTANCE);
    }

    private static List<ScoredMember> toScoredMembers(Collection<ScoredEntry<String>> entries) {
        List<ScoredMember> result = new ArrayList<>(entries.size());
        for (ScoredEntry<String> entry : entries) {
            result.add(new ScoredMember(entry.getValue(), entry.getScore()));
        }
        return result;
    }

    private <R> R call(Supplier<R> command) {
        try {
            return command.get();
        } catch (RedisException e) {
            throw RedissonExceptionTranslator.translate(nodeName, e);
        }
    }
}
