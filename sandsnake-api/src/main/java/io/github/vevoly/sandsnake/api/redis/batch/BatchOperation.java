package io.github.vevoly.sandsnake.api.redis.batch;

import java.util.concurrent.CompletableFuture;

/**
 * 定义了与实现无关的 Redis 批量/管道操作的抽象接口。
 * <p>
 * 命令先在本地排队，调用 {@link #execute()} 时一次性提交。
 * {@link #execute()} 返回后，所有返回的 Future 都已完成（成功或异常）。
 * 一个批次只能执行一次，且不是线程安全的，应在单个调用内使用。
 * <p>
 * Defines an implementation-agnostic abstract interface for Redis batch/pipeline operations.
 * Commands are queued locally and submitted together by {@link #execute()}.
 * Once {@link #execute()} returns, every returned future is complete, normally or exceptionally.
 * A batch executes once and is not thread-safe; use it within a single call.
 *
 * @author vevoly
 */
public interface BatchOperation {

    // --- ZSet Operations ---
    CompletableFuture<Boolean> zAddAsync(String key, String member, double score);
    CompletableFuture<Boolean> zRemAsync(String key, String member);

    // --- Set Operations ---
    CompletableFuture<Boolean> setAddAsync(String key, String member);
    CompletableFuture<Boolean> setRemoveAsync(String key, String member);

    // --- Hash Operations ---
    CompletableFuture<Long> hashRemoveAsync(String key, String... fields);

    // --- Common Operations ---
    CompletableFuture<Long> deleteAsync(String... keys);

    /**
     * 执行所有已缓存的批量命令。
     * <p>
     * Executes all cached batch commands.
     *
     * @throws IllegalStateException 如果批次已经执行过 / if the batch was already executed
     */
    void execute();
}
