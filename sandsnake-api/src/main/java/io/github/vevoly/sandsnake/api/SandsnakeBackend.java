package io.github.vevoly.sandsnake.api;

import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.api.utils.ScoreUtils;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * sandsnake 核心 API 接口：每个具体后端都必须实现的排序索引操作集合。
 * <p>
 * 一个对象 (objectId) 可以拥有多个索引 (indexName)，每个索引是按分数排序、成员唯一的集合。
 * 写操作接受一个有序的索引名称列表，同一个成员和分数会被扇出写入到该对象的每个索引。
 * 多个索引之间的写入不是原子的，部分失败时抛出
 * {@link io.github.vevoly.sandsnake.api.exception.SandsnakePartialFailureException}。
 * 实现是线程安全的，一个实例可以被整个进程共享。
 * <p>
 * The core API interface of sandsnake: the sorted index operations every concrete backend implements.
 * An object may own many indexes; each index is a set of unique members ordered by score.
 * Writes take an ordered list of index names and fan the same member and score out to every named index of the object.
 * Writes across indexes are not atomic; a partial failure raises
 * {@link io.github.vevoly.sandsnake.api.exception.SandsnakePartialFailureException}.
 * Implementations are thread-safe and may be shared process-wide.
 *
 * @author vevoly
 */
public interface SandsnakeBackend extends AutoCloseable {

    // =================================================================
    // ======================== 写入 / Writes ===========================
    // =================================================================

    /**
     * 将成员添加到对象的一个或多个索引中。
     * 成员已存在时只更新分数，不会产生重复。
     * <p>
     * Adds a member to one or more indexes of an object.
     * An existing member only gets its score updated, never duplicated.
     *
     * @param objectId   索引所属的对象，例如 "user:1"。/ The object owning the indexes, e.g. "user:1".
     * @param indexNames 目标索引名称，至少一个。/ Target index names, at least one.
     * @param member     成员。/ The member.
     * @param score      分数；为 null 时使用单调递增的时间戳分数。/ The score; a monotonically increasing timestamp score when null.
     */
    void add(String objectId, List<String> indexNames, String member, Double score);

    default void add(String objectId, List<String> indexNames, String member) {
        add(objectId, indexNames, member, (Double) null);
    }

    /**
     * 以发布时间作为分数添加成员。
     * <p>
     * Adds a member scored by its publish time.
     */
    default void add(String objectId, List<String> indexNames, String member, Instant publishedAt) {
        add(objectId, indexNames, member, publishedAt == null ? null : (double) ScoreUtils.toScore(publishedAt));
    }

    default void add(String objectId, String indexName, String member) {
        add(objectId, List.of(indexName), member, (Double) null);
    }

    default void add(String objectId, String indexName, String member, double score) {
        add(objectId, List.of(indexName), member, score);
    }

    /**
     * 从对象的一个或多个索引中删除成员。成员或索引不存在时什么也不做。
     * <p>
     * Removes a member from one or more indexes of an object. A no-op when the member or index does not exist.
     */
    void remove(String objectId, List<String> indexNames, String member);

    default void remove(String objectId, String indexName, String member) {
        remove(objectId, List.of(indexName), member);
    }

    /**
     * 彻底删除对象的一个或多个索引。
     * <p>
     * Completely deletes one or more indexes of an object.
     */
    void removeIndex(String objectId, List<String> indexNames);

    default void removeIndex(String objectId, String indexName) {
        removeIndex(objectId, List.of(indexName));
    }

    // =================================================================
    // ======================== 查询 / Reads ============================
    // =================================================================

    /**
     * 按排名读取索引成员。负数排名从末尾计算，越界时截断；空索引返回空列表。
     * <p>
     * Reads index members by rank. Negative ranks count from the end, out-of-range ranks are clamped;
     * an empty index yields an empty list.
     *
     * @param start    起始排名 / start rank
     * @param stop     结束排名（包含），-1 表示最后一个 / stop rank (inclusive), -1 for the last member
     * @param reversed 是否按分数从高到低 / highest score first when true
     */
    List<String> get(String objectId, String indexName, int start, int stop, boolean reversed);

    default List<String> get(String objectId, String indexName) {
        return get(objectId, indexName, 0, -1, false);
    }

    /**
     * 与 {@link #get(String, String, int, int, boolean)} 相同，但同时返回分数。
     * <p>
     * Same as {@link #get(String, String, int, int, boolean)} but including scores.
     */
    List<ScoredMember> getWithScores(String objectId, String indexName, int start, int stop, boolean reversed);

    /**
     * 按分数区间读取索引成员。
     * <p>
     * Reads index members within a score range.
     *
     * @param limit  最大返回条数，null 表示不限制，0 返回空列表 / maximum members, null for no limit, 0 for none
     * @param offset 跳过的条数 / members to skip
     */
    List<ScoredMember> getByScore(String objectId, String indexName, ScoreRange range, boolean reversed, Integer limit, int offset);

    default List<ScoredMember> getByScore(String objectId, String indexName, double minScore, double maxScore) {
        return getByScore(objectId, indexName, ScoreRange.closed(minScore, maxScore), false, null, 0);
    }

    /**
     * 索引中的成员数量，索引不存在时为 0。
     * <p>
     * Number of members in the index, 0 when it does not exist.
     */
    long count(String objectId, String indexName);

    /**
     * 基于 marker (时间戳分数) 的分页读取。
     * <p>
     * {@code after == false} 返回分数小于等于 marker 的成员，最新的在前；
     * {@code after == true} 返回分数大于等于 marker 的成员，最早的在前。
     * <p>
     * Marker (timestamp score) based pagination.
     * {@code after == false} returns members scored at or below the marker, newest first;
     * {@code after == true} returns members scored at or above the marker, oldest first.
     *
     * @param marker 必填 / required
     * @param limit  最大返回条数，null 表示不限制 / maximum members, null for no limit
     * @throws io.github.vevoly.sandsnake.api.exception.SandsnakeValidationException 如果 marker 为 null / if the marker is null
     */
    List<String> getItems(String objectId, String indexName, Double marker, boolean after, Integer limit);

    /**
     * 对象当前拥有的所有索引名称。
     * <p>
     * All index names the object currently owns.
     */
    Set<String> getIndexNames(String objectId);

    /**
     * 多个索引成员的并集。
     * <p>
     * Union of the members of several indexes.
     */
    Set<String> getUnion(String objectId, List<String> indexNames);

    default Set<String> getUnion(String objectId, String indexName) {
        return getUnion(objectId, List.of(indexName));
    }

    // =================================================================
    // ======================== 生命周期 / Lifecycle =====================
    // =================================================================

    /**
     * 底层存储客户端。
     * <p>
     * The underlying storage client.
     */
    RedisClient getRedisClient();

    /**
     * 释放后端持有的所有连接。
     * <p>
     * Releases every connection held by the backend.
     */
    @Override
    void close();
}
