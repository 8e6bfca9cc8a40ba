package io.github.vevoly.sandsnake.api.redis;

import io.github.vevoly.sandsnake.api.redis.batch.BatchOperation;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * sandsnake 对 Redis 操作的统一客户端接口。
 * <p>
 * 该接口定义了排序索引所需的所有 Redis 基本操作，旨在屏蔽底层具体 Redis 客户端（如 Redisson）以及
 * 单节点 / 多节点部署拓扑的差异。排序索引引擎只依赖此接口，而不是具体的实现。
 * 所有实现都必须是线程安全的，同一个实例会被多个调用线程共享。
 * <p>
 * This interface defines all the basic Redis operations required by sorted indexes,
 * aiming to abstract away the underlying Redis client (e.g., Redisson) as well as single-node vs. multi-node topologies.
 * The sorted index engine depends on this interface only. Implementations must be thread-safe,
 * one instance is shared by all calling threads.
 *
 * @author vevoly
 */
public interface RedisClient extends AutoCloseable {

    // ==================================================================
    // ============ 通用 Key 操作 / Common Key Operations =================
    // ===================================================================

    /**
     * 检查给定的 key 是否存在。
     * <p>
     * Checks if a given key exists.
     *
     * @param key 键 / the key
     * @return {@code true} 如果 key 存在 / {@code true} if the key exists
     */
    boolean exists(String key);

    /**
     * 删除一个或多个 key，不存在的 key 会被忽略。
     * <p>
     * Deletes one or more keys. Missing keys are ignored.
     *
     * @param keys 要删除的 key 数组 / array of keys to delete
     * @return 实际删除的 key 数量 / number of keys actually deleted
     */
    long delete(String... keys);

    // ===================================================================
    // ======================== ZSet 操作 / ZSet Operations ===============
    // ===================================================================

    /**
     * 添加成员或更新已存在成员的分数 (ZADD)。对同一成员是幂等的。
     * <p>
     * Adds a member or updates the score of an existing one (ZADD). Idempotent on member identity.
     *
     * @param key    键 / the key
     * @param member 成员 / the member
     * @param score  分数 / the score
     * @return {@code true} 如果是新成员 / {@code true} if the member was new
     */
    boolean zAdd(String key, String member, double score);

    /**
     * 删除成员 (ZREM)。成员不存在时不是错误。
     * <p>
     * Removes a member (ZREM). A missing member is not an error.
     *
     * @return {@code true} 如果成员存在并被删除 / {@code true} if the member existed and was removed
     */
    boolean zRem(String key, String member);

    /**
     * 按排名获取 ZSet 范围数据，包含分数 (ZRANGE / ZREVRANGE WITHSCORES)。
     * 负数排名从末尾开始计算，越界的排名会被截断，不会报错。
     * <p>
     * Gets ZSet members by rank, including scores (ZRANGE / ZREVRANGE WITHSCORES).
     * Negative ranks count from the end; out-of-range ranks are clamped, never an error.
     *
     * @param key      键 / the key
     * @param start    起始排名 / the start rank
     * @param stop     结束排名（包含） / the stop rank (inclusive)
     * @param reversed 是否按分数倒序 / whether to order by descending score
     * @return 有序的成员列表，key 不存在时返回空列表 / ordered members, empty when the key does not exist
     */
    List<ScoredMember> zRangeWithScores(String key, int start, int stop, boolean reversed);

    /**
     * 按分数区间获取 ZSet 数据 (ZRANGEBYSCORE / ZREVRANGEBYSCORE WITHSCORES LIMIT)。
     * <p>
     * Gets ZSet members within a score range (ZRANGEBYSCORE / ZREVRANGEBYSCORE WITHSCORES LIMIT).
     *
     * @param key      键 / the key
     * @param range    分数区间 / the score range
     * @param reversed 是否按分数倒序 / whether to order by descending score
     * @param offset   跳过的条数 / number of members to skip
     * @param limit    最大返回条数，null 表示不限制 / maximum number of members, null for no limit
     * @return 有序的成员列表 / ordered members
     */
    List<ScoredMember> zRangeByScore(String key, ScoreRange range, boolean reversed, int offset, Integer limit);

    /**
     * 获取 ZSet 的成员数量 (ZCARD)。
     * <p>
     * Cardinality of the ZSet (ZCARD).
     */
    long zCard(String key);

    // ===================================================================
    // ======================== Set 操作 / Set Operations =================
    // ===================================================================

    /**
     * 向集合 key 中添加一个或多个成员。
     * <p>
     * Adds one or more members to the set at the specified key.
     */
    void sAdd(String key, String... members);

    /**
     * 从集合 key 中删除一个或多个成员。
     * <p>
     * Removes one or more members from the set at the specified key.
     */
    void sRem(String key, String... members);

    /**
     * 获取集合 key 的所有成员。
     * <p>
     * Gets all members of the set at the specified key.
     */
    Set<String> sMembers(String key);

    long sCard(String key);

    // ===================================================================
    // ======================== Hash 操作 / Hash Operations ===============
    // ===================================================================

    /**
     * 获取存储在哈希表中指定字段的值。
     * <p>
     * Gets the value of a hash field.
     *
     * @return 字段的值，如果 key 或 field 不存在则返回 null / the value of the field, or null if the key or field does not exist
     */
    String hGet(String key, String field);

    /**
     * 将哈希表 key 中字段 field 的值设为 value。
     * <p>
     * Sets the value of a hash field.
     */
    void hSet(String key, String field, String value);

    /**
     * 删除哈希表中的一个或多个字段。
     * <p>
     * Deletes one or more hash fields.
     */
    void hDel(String key, String... fields);

    /**
     * 获取哈希表中所有的键值对。
     * <p>
     * Gets all fields and values of a hash.
     */
    Map<String, String> hGetAll(String key);

    // ===================================================================
    // =================== 批量操作会话 / Batch operation session ==========
    // ===================================================================

    /**
     * 创建一个新的批量操作会话。
     * <p>
     * Creates a new batch operation session.
     * @return 一个 {@link BatchOperation} 实例。 / A {@link BatchOperation} instance.
     */
    BatchOperation createBatchOperation();

    // ===================================================================
    // ======================== 生命周期 / Lifecycle ======================
    // ===================================================================

    /**
     * 释放此客户端持有的所有连接。
     * <p>
     * Releases every connection held by this client.
     */
    @Override
    void close();
}
