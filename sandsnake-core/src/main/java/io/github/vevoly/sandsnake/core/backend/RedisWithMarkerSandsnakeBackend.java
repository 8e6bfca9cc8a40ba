package io.github.vevoly.sandsnake.core.backend;

import io.github.vevoly.sandsnake.api.SandsnakeMarkerBackend;
import io.github.vevoly.sandsnake.api.exception.SandsnakeBackendException;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.api.utils.IndexKeys;
import io.github.vevoly.sandsnake.core.engine.SortedIndexEngine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 带读取 marker 的后端（类型 {@code redis-with-marker}）。
 * <p>
 * 对象的所有 marker 保存在一个哈希表 {@code {prefix}obj:{objectId}:markers} 中，
 * 字段名为 {@code index:{indexKeyLength}:{indexKey}:name:{markerName}}，值为 marker 的分数。
 * <p>
 * A backend with read markers (type {@code redis-with-marker}).
 * All markers of an object live in one hash {@code {prefix}obj:{objectId}:markers}, under the field
 * {@code index:{indexKeyLength}:{indexKey}:name:{markerName}}, holding the marker score.
 *
 * @author vevoly
 */
public class RedisWithMarkerSandsnakeBackend extends RedisSandsnakeBackend implements SandsnakeMarkerBackend {

    public RedisWithMarkerSandsnakeBackend(SortedIndexEngine engine) {
        super(engine);
    }

    @Override
    public List<String> getItems(String objectId, String indexName, Double marker, boolean after, Integer limit, String markerName) {
        List<ScoredMember> items = engine.getItems(objectId, indexName, marker, after, limit);
        moveMarker(objectId, indexName, after, items, markerName);
        return SortedIndexEngine.members(items);
    }

    @Override
    public List<String> getItemsAfterMarker(String objectId, String indexName, Integer limit, String markerName) {
        return getItems(objectId, indexName, getMarker(objectId, indexName, markerName), true, limit, markerName);
    }

    @Override
    protected void postGetItems(String objectId, String indexName, boolean after, List<ScoredMember> items) {
        moveMarker(objectId, indexName, after, items, null);
    }

    @Override
    public double getMarker(String objectId, String indexName, String markerName) {
        IndexKeys keys = engine.getKeys();
        String field = keys.markerField(keys.indexKey(objectId, indexName), markerName);
        String value = engine.getRedisClient().hGet(keys.markersKey(objectId), field);
        if (value == null) {
            return 0D;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new SandsnakeBackendException("Marker '" + field + "' of object '" + objectId + "' is not a number: " + value, e);
        }
    }

    @Override
    public void setMarker(String objectId, String indexName, String markerName, double marker) {
        IndexKeys keys = engine.getKeys();
        String field = keys.markerField(keys.indexKey(objectId, indexName), markerName);
        engine.getRedisClient().hSet(keys.markersKey(objectId), field, formatScore(marker));
    }

    /**
     * 删除索引时一并删除它的所有 marker。
     * <p>
     * Removing an index also deletes all its markers.
     */
    @Override
    public void removeIndex(String objectId, List<String> indexNames) {
        IndexKeys keys = engine.getKeys();
        String markersKey = keys.markersKey(objectId);
        Map<String, String> markers = engine.getRedisClient().hGetAll(markersKey);
        engine.removeIndex(objectId, indexNames, (batch, indexName, indexKey) -> {
            String fieldPrefix = keys.markerFieldPrefix(indexKey);
            String[] fields = markers.keySet().stream()
                    .filter(field -> field.startsWith(fieldPrefix))
                    .toArray(String[]::new);
            if (fields.length == 0) {
                return CompletableFuture.completedFuture(0L);
            }
            return batch.hashRemoveAsync(markersKey, fields);
        });
    }

    private void moveMarker(String objectId, String indexName, boolean after, List<ScoredMember> items, String markerName) {
        // 只有向后读取并读到数据时才移动 marker / Only a forward read that returned items moves the marker
        if (!after || items.isEmpty()) {
            return;
        }
        setMarker(objectId, indexName, markerName, items.get(items.size() - 1).getScore());
    }

    private static String formatScore(double score) {
        if (score == Math.rint(score) && !Double.isInfinite(score) && Math.abs(score) < 1e15) {
            return Long.toString((long) score);
        }
        return Double.toString(score);
    }
}
