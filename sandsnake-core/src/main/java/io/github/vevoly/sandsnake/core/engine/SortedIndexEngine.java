package io.github.vevoly.sandsnake.core.engine;

import io.github.vevoly.sandsnake.api.exception.SandsnakeException;
import io.github.vevoly.sandsnake.api.exception.SandsnakeValidationException;
import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.api.redis.batch.BatchOperation;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.api.utils.IndexKeys;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 排序索引引擎，所有后端共享的核心逻辑。
 * <p>
 * <h3>存储结构 / Storage layout:</h3>
 * <ul>
 *     <li>每个 (对象, 索引) 对应一个 ZSet，成员唯一，按分数排序。<br>
 *         One ZSet per (object, index); members are unique and ordered by score.</li>
 *     <li>每个对象有一个 Set 记录它拥有哪些索引。删除成员不会把索引从集合中移除，只有 {@link #removeIndex} 会。<br>
 *         One Set per object records which indexes it owns. Removing a member never drops the index from it;
 *         only {@link #removeIndex} does.</li>
 * </ul>
 * 扇出写入在一个 {@link BatchOperation} 中完成，每个索引名称的结果单独记录，对象级 Key 的更新另行记录。
 * <p>
 * The sorted index engine: the logic shared by every backend.
 * Fan-out writes go through one {@link BatchOperation}; the outcome of every index name is tracked on its own,
 * apart from the updates of the object-level keys.
 *
 * @author vevoly
 */
@Slf4j
public class SortedIndexEngine {

    @Getter
    private final RedisClient redisClient;
    @Getter
    private final IndexKeys keys;
    private final ScoreGenerator scoreGenerator;

    public SortedIndexEngine(RedisClient redisClient, IndexKeys keys, ScoreGenerator scoreGenerator) {
        this.redisClient = redisClient;
        this.keys = keys;
        this.scoreGenerator = scoreGenerator;
    }

    // ===================================================================
    // ======================== 写入 / Writes ============================
    // ===================================================================

    /**
     * 向每个索引写入成员，并把索引名称登记到对象的索引集合中。
     * <p>
     * Writes the member to every index and registers the index names in the object's index collection.
     */
    public void add(String objectId, List<String> indexNames, String member, Double score) {
        List<String> names = normalizeIndexNames(indexNames);
        requireMember(member);
        double effectiveScore = score == null ? scoreGenerator.nextScore() : requireScore(score);
        String collectionKey = keys.collectionKey(objectId);

        BatchOperation batch = redisClient.createBatchOperation();
        FanOutTracker tracker = new FanOutTracker("add", objectId);
        for (String name : names) {
            tracker.track(name, batch.zAddAsync(keys.indexKey(objectId, name), member, effectiveScore));
            tracker.trackObjectUpdate(batch.setAddAsync(collectionKey, name));
        }
        execute(batch, tracker);
        log.debug("[Sandsnake] Added '{}' to {} of object '{}' with score {}.", member, names, objectId, effectiveScore);
    }

    /**
     * 从每个索引删除成员。索引或成员不存在时什么也不做。
     * <p>
     * Removes the member from every index. Missing indexes or members are a no-op.
     */
    public void remove(String objectId, List<String> indexNames, String member) {
        List<String> names = normalizeIndexNames(indexNames);
        requireMember(member);

        BatchOperation batch = redisClient.createBatchOperation();
        FanOutTracker tracker = new FanOutTracker("remove", objectId);
        for (String name : names) {
            tracker.track(name, batch.zRemAsync(keys.indexKey(objectId, name), member));
        }
        execute(batch, tracker);
    }

    public void removeIndex(String objectId, List<String> indexNames) {
        removeIndex(objectId, indexNames, null);
    }

    /**
     * 删除索引并将其从对象的索引集合中移除。{@code extra} 可以为每个索引追加额外的清理命令。
     * <p>
     * Deletes the indexes and drops them from the object's index collection.
     * {@code extra} may queue additional cleanup commands per index.
     */
    public void removeIndex(String objectId, List<String> indexNames, IndexCommand extra) {
        List<String> names = normalizeIndexNames(indexNames);
        String collectionKey = keys.collectionKey(objectId);

        BatchOperation batch = redisClient.createBatchOperation();
        FanOutTracker tracker = new FanOutTracker("removeIndex", objectId);
        for (String name : names) {
            String indexKey = keys.indexKey(objectId, name);
            tracker.track(name, batch.deleteAsync(indexKey));
            tracker.trackObjectUpdate(batch.setRemoveAsync(collectionKey, name));
            if (extra != null) {
                tracker.trackObjectUpdate(extra.enqueue(batch, name, indexKey));
            }
        }
        execute(batch, tracker);
        log.debug("[Sandsnake] Removed indexes {} of object '{}'.", names, objectId);
    }

    // ===================================================================
    // ======================== 查询 / Reads =============================
    // ===================================================================

    public List<String> get(String objectId, String indexName, int start, int stop, boolean reversed) {
        return members(getWithScores(objectId, indexName, start, stop, reversed));
    }

    public List<ScoredMember> getWithScores(String objectId, String indexName, int start, int stop, boolean reversed) {
        return redisClient.zRangeWithScores(indexKey(objectId, indexName), start, stop, reversed);
    }

    /**
     * 按分数区间读取。{@code limit == 0} 或空区间直接返回空列表，不访问 Redis。
     * <p>
     * Reads by score range. {@code limit == 0} or an empty range returns an empty list without a round trip.
     */
    public List<ScoredMember> getByScore(String objectId, String indexName, ScoreRange range, boolean reversed, Integer limit, int offset) {
        String key = indexKey(objectId, indexName);
        validatePaging(limit, offset);
        ScoreRange effective = range == null ? ScoreRange.all() : range;
        if ((limit != null && limit == 0) || effective.isEmpty()) {
            return Collections.emptyList();
        }
        return redisClient.zRangeByScore(key, effective, reversed, offset, limit);
    }

    public long count(String objectId, String indexName) {
        return redisClient.zCard(indexKey(objectId, indexName));
    }

    /**
     * 基于 marker 的分页读取：向前读取返回分数 {@code <= marker} 的成员（最新在前），
     * 向后读取返回分数 {@code >= marker} 的成员（最早在前）。
     * <p>
     * Marker pagination: reading before returns members scored {@code <= marker}, newest first;
     * reading after returns members scored {@code >= marker}, oldest first.
     */
    public List<ScoredMember> getItems(String objectId, String indexName, Double marker, boolean after, Integer limit) {
        if (marker == null) {
            throw new SandsnakeValidationException("A marker is required to read items");
        }
        if (after) {
            return getByScore(objectId, indexName, ScoreRange.atLeast(marker), false, limit, 0);
        }
        return getByScore(objectId, indexName, ScoreRange.atMost(marker), true, limit, 0);
    }

    public Set<String> getIndexNames(String objectId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(redisClient.sMembers(keys.collectionKey(objectId))));
    }

    /**
     * 多个索引成员的并集。各索引可能位于不同节点上，因此在客户端合并。
     * <p>
     * Union of the members of several indexes. Indexes may live on different nodes, so they are merged client-side.
     */
    public Set<String> getUnion(String objectId, List<String> indexNames) {
        Set<String> union = new LinkedHashSet<>();
        for (String name : normalizeIndexNames(indexNames)) {
            for (ScoredMember entry : redisClient.zRangeWithScores(keys.indexKey(objectId, name), 0, -1, false)) {
                union.add(entry.getValue());
            }
        }
        return Collections.unmodifiableSet(union);
    }

    // ===================================================================
    // ======================== 辅助 / Helpers ===========================
    // ===================================================================

    /**
     * 去重（保持顺序）并校验索引名称。
     * <p>
     * De-duplicates (keeping order) and validates index names.
     */
    public static List<String> normalizeIndexNames(List<String> indexNames) {
        if (indexNames == null || indexNames.isEmpty()) {
            throw new SandsnakeValidationException("At least one index name is required");
        }
        Set<String> names = new LinkedHashSet<>(indexNames.size());
        for (String name : indexNames) {
            if (StringUtils.isBlank(name)) {
                throw new SandsnakeValidationException("Index names must not be blank: " + indexNames);
            }
            names.add(name);
        }
        return new ArrayList<>(names);
    }

    public static List<String> members(List<ScoredMember> entries) {
        return entries.stream().map(ScoredMember::getValue).collect(Collectors.toList());
    }

    private String indexKey(String objectId, String indexName) {
        if (StringUtils.isBlank(indexName)) {
            throw new SandsnakeValidationException("Index name must not be blank");
        }
        return keys.indexKey(objectId, indexName);
    }

    private static void validatePaging(Integer limit, int offset) {
        if (limit != null && limit < 0) {
            throw new SandsnakeValidationException("limit must not be negative, got " + limit);
        }
        if (offset < 0) {
            throw new SandsnakeValidationException("offset must not be negative, got " + offset);
        }
    }

    private static void requireMember(String member) {
        if (member == null) {
            throw new SandsnakeValidationException("member must not be null");
        }
    }

    private static double requireScore(Double score) {
        if (score.isNaN()) {
            throw new SandsnakeValidationException("score must not be NaN");
        }
        return score;
    }

    private static void execute(BatchOperation batch, FanOutTracker tracker) {
        RuntimeException executeError = null;
        try {
            batch.execute();
        } catch (SandsnakeException e) {
            // 失败已记录在各条命令的 Future 中，由 tracker 统一抛出 / Failures are carried by the futures and rethrown by the tracker
            executeError = e;
        }
        tracker.complete(executeError);
    }

    /**
     * 在 {@link #removeIndex(String, List, IndexCommand)} 中为每个索引追加命令。
     * <p>
     * Queues an additional command per index in {@link #removeIndex(String, List, IndexCommand)}.
     */
    @FunctionalInterface
    public interface IndexCommand {

        CompletableFuture<?> enqueue(BatchOperation batch, String indexName, String indexKey);
    }
}
