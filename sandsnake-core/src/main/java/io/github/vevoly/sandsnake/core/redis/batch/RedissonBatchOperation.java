package io.github.vevoly.sandsnake.core.redis.batch;

import io.github.vevoly.sandsnake.api.exception.SandsnakeBackendException;
import io.github.vevoly.sandsnake.api.redis.batch.BatchOperation;
import io.github.vevoly.sandsnake.core.redis.RedissonExceptionTranslator;
import org.redisson.api.RBatch;
import org.redisson.api.RFuture;
import org.redisson.api.RMapAsync;
import org.redisson.api.RScoredSortedSetAsync;
import org.redisson.api.RSetAsync;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link BatchOperation} 接口基于 Redisson {@link RBatch} 的实现。
 * <p>
 * 此类将通用的批量操作定义转换为具体的 Redisson 异步命令，并在 {@code execute()} 被调用时统一提交。
 * 返回的 Future 以 sandsnake 异常失败；批次提交失败时，所有尚未完成的 Future 都以同一个异常失败。
 * <p>
 * An implementation of the {@link BatchOperation} interface based on Redisson's {@link RBatch}.
 * Translates generic batch operations into Redisson asynchronous commands and submits them at once on {@code execute()}.
 * Returned futures fail with sandsnake exceptions; when submitting fails, every pending future fails with the same error.
 *
 * @author vevoly
 */
public class RedissonBatchOperation implements BatchOperation {

    private final String nodeName;
    private final RBatch redissonBatch;
    private final List<CompletableFuture<?>> futures = new ArrayList<>();
    private boolean executed;

    public RedissonBatchOperation(String nodeName, RBatch redissonBatch) {
        this.nodeName = nodeName;
        this.redissonBatch = redissonBatch;
    }

    // ===================================================================
    // ======================== ZSet Operations ==========================
    // ===================================================================

    @Override
    public CompletableFuture<Boolean> zAddAsync(String key, String member, double score) {
        RScoredSortedSetAsync<String> zset = redissonBatch.getScoredSortedSet(key, StringCodec.INSTANCE);
        return track(zset.addAsync(score, member));
    }

    @Override
    public CompletableFuture<Boolean> zRemAsync(String key, String member) {
        RScoredSortedSetAsync<String> zset = redissonBatch.getScoredSortedSet(key, StringCodec.INSTANCE);
        return track(zset.removeAsync(member));
    }

    // ===================================================================
    // ======================== Set Operations ===========================
    // ===================================================================

    @Override
    public CompletableFuture<Boolean> setAddAsync(String key, String member) {
        RSetAsync<String> set = redissonBatch.getSet(key, StringCodec.INSTANCE);
        return track(set.addAsync(member));
    }

    @Override
    public CompletableFuture<Boolean> setRemoveAsync(String key, String member) {
        RSetAsync<String> set = redissonBatch.getSet(key, StringCodec.INSTANCE);
        return track(set.removeAsync(member));
    }

    // ===================================================================
    // ======================== Hash Operations ==========================
    // ===================================================================

    @Override
    public CompletableFuture<Long> hashRemoveAsync(String key, String... fields) {
        if (fields == null || fields.length == 0) {
            return CompletableFuture.completedFuture(0L);
        }
        RMapAsync<String, String> map = redissonBatch.getMap(key, StringCodec.INSTANCE);
        return track(map.fastRemoveAsync(fields));
    }

    // ===================================================================
    // ====================== Common Operations ==========================
    // ===================================================================

    @Override
    public CompletableFuture<Long> deleteAsync(String... keys) {
        if (keys == null || keys.length == 0) {
            return CompletableFuture.completedFuture(0L);
        }
        return track(redissonBatch.getKeys().deleteAsync(keys));
    }

    @Override
    public void execute() {
        if (executed) {
            throw new IllegalStateException("Batch for node '" + nodeName + "' was already executed");
        }
        executed = true;
        if (futures.isEmpty()) {
            return;
        }
        try {
            redissonBatch.execute();
        } catch (RedisException e) {
            RuntimeException translated = RedissonExceptionTranslator.translate(nodeName, e);
            futures.forEach(f -> f.completeExceptionally(translated));
            throw translated;
        }
        // 正常情况下 execute 返回时所有命令都已有结果 / Normally every command has a reply once execute returns
        futures.stream()
                .filter(f -> !f.isDone())
                .forEach(f -> f.completeExceptionally(
                        new SandsnakeBackendException("No reply for batched command", nodeName, null)));
    }

    /**
     * 把 Redisson 的 RFuture 转换为以 sandsnake 异常失败的 CompletableFuture，并记录下来。
     * <p>
     * Converts a Redisson RFuture into a CompletableFuture failing with sandsnake exceptions, and tracks it.
     */
    private <R> CompletableFuture<R> track(RFuture<R> rFuture) {
        CompletableFuture<R> future = rFuture.toCompletableFuture().handle((value, error) -> {
            if (error != null) {
                throw RedissonExceptionTranslator.translate(nodeName, error);
            }
            return value;
        });
        futures.add(future);
        return future;
    }
}
