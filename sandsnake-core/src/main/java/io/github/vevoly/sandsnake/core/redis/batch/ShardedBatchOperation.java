package io.github.vevoly.sandsnake.core.redis.batch;

import io.github.vevoly.sandsnake.api.exception.SandsnakeBackendException;
import io.github.vevoly.sandsnake.api.redis.batch.BatchOperation;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;
import io.github.vevoly.sandsnake.core.redis.RedisNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 跨节点的批量操作。
 * <p>
 * 每条命令在入队时就完成路由，路由错误会立即抛出，此时还没有发送任何命令。
 * 每个节点保留一个节点批次，{@link #execute()} 依次执行所有节点批次：
 * 某个节点失败只会让该节点上的命令失败，其余节点照常执行。全部执行完后，如果有节点失败，抛出第一个错误，
 * 其余错误作为 suppressed 附加。
 * <p>
 * A batch spanning several nodes.
 * Every command is routed when it is queued, so routing errors surface before anything is sent.
 * One node batch is kept per node and {@link #execute()} runs all of them: a failing node fails only the commands
 * routed to it, the other nodes still run. Once all have run, the first node error is thrown with the rest suppressed.
 *
 * @author vevoly
 */
@Slf4j
public class ShardedBatchOperation implements BatchOperation {

    private final ConnectionRouter<RedisNode> router;
    private final Map<RedisNode, NodeBatch> nodeBatches = new LinkedHashMap<>();
    private boolean executed;

    public ShardedBatchOperation(ConnectionRouter<RedisNode> router) {
        this.router = router;
    }

    @Override
    public CompletableFuture<Boolean> zAddAsync(String key, String member, double score) {
        return queue(key, batch -> batch.zAddAsync(key, member, score));
    }

    @Override
    public CompletableFuture<Boolean> zRemAsync(String key, String member) {
        return queue(key, batch -> batch.zRemAsync(key, member));
    }

    @Override
    public CompletableFuture<Boolean> setAddAsync(String key, String member) {
        return queue(key, batch -> batch.setAddAsync(key, member));
    }

    @Override
    public CompletableFuture<Boolean> setRemoveAsync(String key, String member) {
        return queue(key, batch -> batch.setRemoveAsync(key, member));
    }

    @Override
    public CompletableFuture<Long> hashRemoveAsync(String key, String... fields) {
        return queue(key, batch -> batch.hashRemoveAsync(key, fields));
    }

    @Override
    public CompletableFuture<Long> deleteAsync(String... keys) {
        if (keys == null || keys.length == 0) {
            return CompletableFuture.completedFuture(0L);
        }
        // 每个 key 单独路由，结果求和 / Each key is routed on its own, results are summed
        List<CompletableFuture<Long>> parts = new ArrayList<>(keys.length);
        for (String key : keys) {
            parts.add(queue(key, batch -> batch.deleteAsync(key)));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return CompletableFuture.allOf(parts.toArray(new CompletableFuture[0]))
                .thenApply(v -> parts.stream().mapToLong(CompletableFuture::join).sum());
    }

    @Override
    public void execute() {
        if (executed) {
            throw new IllegalStateException("Sharded batch was already executed");
        }
        executed = true;
        RuntimeException first = null;
        for (Map.Entry<RedisNode, NodeBatch> entry : nodeBatches.entrySet()) {
            RuntimeException error = entry.getValue().execute(entry.getKey());
            if (error == null) {
                continue;
            }
            log.warn("[Sandsnake] Batch on node '{}' failed: {}", entry.getKey().getName(), error.getMessage());
            if (first == null) {
                first = error;
            } else if (first != error) {
                first.addSuppressed(error);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private <R> CompletableFuture<R> queue(String key, Function<BatchOperation, CompletableFuture<R>> command) {
        if (executed) {
            throw new IllegalStateException("Sharded batch was already executed");
        }
        RedisNode node = router.route(key);
        NodeBatch nodeBatch = nodeBatches.computeIfAbsent(node, n -> new NodeBatch(n.getClient().createBatchOperation()));
        return nodeBatch.track(command.apply(nodeBatch.batch));
    }

    /**
     * 一个节点上的批次，以及发给调用方的 Future。
     * <p>
     * The batch of one node together with the futures handed to callers.
     */
    private static final class NodeBatch {

        private final BatchOperation batch;
        private final List<CompletableFuture<?>> wrappers = new ArrayList<>();

        private NodeBatch(BatchOperation batch) {
            this.batch = batch;
        }

        <R> CompletableFuture<R> track(CompletableFuture<R> source) {
            CompletableFuture<R> wrapper = new CompletableFuture<>();
            source.whenComplete((value, error) -> {
                if (error != null) {
                    wrapper.completeExceptionally(error);
                } else {
                    wrapper.complete(value);
                }
            });
            wrappers.add(wrapper);
            return wrapper;
        }

        /**
         * 执行节点批次，返回失败原因，成功时返回 null。执行后所有 Future 都已完成。
         * <p>
         * Executes the node batch and returns the failure, or null on success. Every future is complete afterwards.
         */
        RuntimeException execute(RedisNode node) {
            RuntimeException error = null;
            try {
                batch.execute();
            } catch (RuntimeException e) {
                error = e;
            }
            RuntimeException pendingError = error != null ? error
                    : new SandsnakeBackendException("No reply for batched command", node.getName(), null);
            wrappers.stream().filter(f -> !f.isDone()).forEach(f -> f.completeExceptionally(pendingError));
            return error;
        }
    }
}
