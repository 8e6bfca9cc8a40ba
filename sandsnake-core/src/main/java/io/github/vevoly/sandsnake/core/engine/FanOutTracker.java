package io.github.vevoly.sandsnake.core.engine;

import io.github.vevoly.sandsnake.api.exception.SandsnakeBackendException;
import io.github.vevoly.sandsnake.api.exception.SandsnakePartialFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 记录一次扇出写入中每个索引名称对应的批量命令，并在批次执行后汇总结果。
 * <p>
 * 一个索引只有在它自己的命令都成功时才算成功；对象级 Key（索引集合、marker 哈希表）上的命令单独记录。
 * 部分索引失败或只有对象级 Key 失败时抛出 {@link SandsnakePartialFailureException}；
 * 全部索引失败时重新抛出第一个原因，其余原因作为 suppressed 附加。
 * <p>
 * Tracks the batched commands of every index name of one fan-out write and summarizes them after execution.
 * An index succeeds when its own commands succeed; commands on the object-level keys (index collection,
 * markers hash) are tracked apart from them.
 * Some indexes failing, or only the object-level keys failing, raises {@link SandsnakePartialFailureException};
 * all indexes failing rethrows the first cause with the other causes suppressed.
 *
 * @author vevoly
 */
@Slf4j
class FanOutTracker {

    private final String operation;
    private final String objectId;
    private final Map<String, List<CompletableFuture<?>>> futuresByIndex = new LinkedHashMap<>();
    private final List<CompletableFuture<?>> objectUpdates = new ArrayList<>();

    FanOutTracker(String operation, String objectId) {
        this.operation = operation;
        this.objectId = objectId;
    }

    void track(String indexName, CompletableFuture<?> future) {
        futuresByIndex.computeIfAbsent(indexName, k -> new ArrayList<>()).add(future);
    }

    void trackObjectUpdate(CompletableFuture<?> future) {
        objectUpdates.add(future);
    }

    /**
     * 汇总结果。
     * <p>
     * Summarizes the outcome.
     *
     * @param executeError 批次执行时抛出的异常，可能为 null / the error thrown by the batch execution, may be null
     */
    void complete(RuntimeException executeError) {
        List<String> succeeded = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        futuresByIndex.forEach((indexName, futures) -> {
            Throwable failure = firstFailure(futures, executeError);
            if (failure == null) {
                succeeded.add(indexName);
            } else {
                failures.put(indexName, failure);
            }
        });
        Throwable objectFailure = firstFailure(objectUpdates, executeError);

        if (failures.isEmpty() && objectFailure == null) {
            if (executeError != null) {
                throw executeError;
            }
            return;
        }
        if (succeeded.isEmpty()) {
            throw allFailed(failures, objectFailure);
        }
        log.warn("[Sandsnake] '{}' on object '{}' partially failed: succeeded={}, failed={}, objectKeysUpdated={}",
                operation, objectId, succeeded, failures.keySet(), objectFailure == null);
        throw new SandsnakePartialFailureException(operation, objectId, succeeded, failures, objectFailure);
    }

    private RuntimeException allFailed(Map<String, Throwable> failures, Throwable objectFailure) {
        Set<Throwable> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(failures.values());
        if (objectFailure != null) {
            distinct.add(objectFailure);
        }
        Throwable first = failures.values().iterator().next();
        RuntimeException primary = first instanceof RuntimeException
                ? (RuntimeException) first
                : new SandsnakeBackendException("'" + operation + "' failed for object '" + objectId + "'", first);
        for (Throwable other : distinct) {
            if (other != first) {
                primary.addSuppressed(other);
            }
        }
        return primary;
    }

    private Throwable firstFailure(List<CompletableFuture<?>> futures, RuntimeException executeError) {
        for (CompletableFuture<?> future : futures) {
            if (!future.isDone()) {
                return executeError != null ? executeError
                        : new SandsnakeBackendException("No reply for '" + operation + "' on object '" + objectId + "'");
            }
            if (future.isCompletedExceptionally()) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    return unwrap(e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return e;
                } catch (RuntimeException e) {
                    return unwrap(e);
                }
            }
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
