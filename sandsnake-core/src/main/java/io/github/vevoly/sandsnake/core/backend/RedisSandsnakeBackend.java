package io.github.vevoly.sandsnake.core.backend;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.core.engine.SortedIndexEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * 基于 Redis ZSet 的默认后端（类型 {@code redis}）。
 * <p>
 * The default backend on Redis sorted sets (type {@code redis}).
 *
 * @author vevoly
 */
@Slf4j
public class RedisSandsnakeBackend implements SandsnakeBackend {

    protected final SortedIndexEngine engine;

    public RedisSandsnakeBackend(SortedIndexEngine engine) {
        this.engine = engine;
    }

    @Override
    public void add(String objectId, List<String> indexNames, String member, Double score) {
        engine.add(objectId, indexNames, member, score);
    }

    @Override
    public void remove(String objectId, List<String> indexNames, String member) {
        engine.remove(objectId, indexNames, member);
    }

    @Override
    public void removeIndex(String objectId, List<String> indexNames) {
        engine.removeIndex(objectId, indexNames);
    }

    @Override
    public List<String> get(String objectId, String indexName, int start, int stop, boolean reversed) {
        return engine.get(objectId, indexName, start, stop, reversed);
    }

    @Override
    public List<ScoredMember> getWithScores(String objectId, String indexName, int start, int stop, boolean reversed) {
        return engine.getWithScores(objectId, indexName, start, stop, reversed);
    }

    @Override
    public List<ScoredMember> getByScore(String objectId, String indexName, ScoreRange range, boolean reversed, Integer limit, int offset) {
        return engine.getByScore(objectId, indexName, range, reversed, limit, offset);
    }

    @Override
    public long count(String objectId, String indexName) {
        return engine.count(objectId, indexName);
    }

    @Override
    public List<String> getItems(String objectId, String indexName, Double marker, boolean after, Integer limit) {
        List<ScoredMember> items = engine.getItems(objectId, indexName, marker, after, limit);
        postGetItems(objectId, indexName, after, items);
        return SortedIndexEngine.members(items);
    }

    /**
     * 读取 items 之后的钩子，子类可以据此记录读取位置。
     * <p>
     * Hook invoked after items were read; subclasses may record the read position.
     */
    protected void postGetItems(String objectId, String indexName, boolean after, List<ScoredMember> items) {
    }

    @Override
    public Set<String> getIndexNames(String objectId) {
        return engine.getIndexNames(objectId);
    }

    @Override
    public Set<String> getUnion(String objectId, List<String> indexNames) {
        return engine.getUnion(objectId, indexNames);
    }

    @Override
    public RedisClient getRedisClient() {
        return engine.getRedisClient();
    }

    @Override
    public void close() {
        log.info("[Sandsnake] Closing backend {}.", getClass().getSimpleName());
        engine.getRedisClient().close();
    }
}
