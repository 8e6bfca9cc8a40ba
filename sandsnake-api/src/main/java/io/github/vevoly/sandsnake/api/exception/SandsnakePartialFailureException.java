package io.github.vevoly.sandsnake.api.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 多索引扇出写入（add / remove / removeIndex）部分成功时抛出。
 * <p>
 * 多个索引之间的写入不是原子的：已成功的索引不会被回滚，
 * 调用方可以根据 {@link #getSucceeded()} 和 {@link #getFailures()} 自行补偿。
 * <p>
 * Thrown when a fan-out write (add / remove / removeIndex) across several index names partially succeeds.
 * Writes across indexes are not atomic: succeeded indexes are not rolled back, callers may compensate
 * using {@link #getSucceeded()} and {@link #getFailures()}.
 * <p>
 * 对象级 Key（索引集合、marker 哈希表）的更新失败单独记录在 {@link #getObjectUpdateFailure()} 中，
 * 不会让写入成功的索引被算作失败。
 * <p>
 * A failed update of the object-level keys (index collection, markers hash) is reported on its own
 * by {@link #getObjectUpdateFailure()} and never counts a written index as failed.
 *
 * @author vevoly
 */
public class SandsnakePartialFailureException extends SandsnakeException {

    private final String operation;
    private final String objectId;
    private final List<String> succeeded;
    private final Map<String, Throwable> failures;
    private final Throwable objectUpdateFailure;

    public SandsnakePartialFailureException(String operation, String objectId, List<String> succeeded, Map<String, Throwable> failures) {
        this(operation, objectId, succeeded, failures, null);
    }

    public SandsnakePartialFailureException(String operation, String objectId, List<String> succeeded,
                                            Map<String, Throwable> failures, Throwable objectUpdateFailure) {
        super(buildMessage(operation, objectId, succeeded, failures, objectUpdateFailure));
        this.operation = operation;
        this.objectId = objectId;
        this.succeeded = List.copyOf(succeeded);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.objectUpdateFailure = objectUpdateFailure;
        failures.values().forEach(this::addSuppressed);
        if (objectUpdateFailure != null && !failures.containsValue(objectUpdateFailure)) {
            addSuppressed(objectUpdateFailure);
        }
    }

    /**
     * 失败的操作名称，例如 "add"。
     * <p>
     * Name of the failed operation, e.g. "add".
     */
    public String getOperation() {
        return operation;
    }

    public String getObjectId() {
        return objectId;
    }

    /**
     * 写入成功的索引名称，保持调用时的顺序。
     * <p>
     * Index names that were written successfully, in call order.
     */
    public List<String> getSucceeded() {
        return succeeded;
    }

    /**
     * 写入失败的索引名称及其原因，保持调用时的顺序。
     * <p>
     * Index names that failed, with their causes, in call order.
     */
    public Map<String, Throwable> getFailures() {
        return failures;
    }

    public List<String> getFailedIndexNames() {
        return List.copyOf(failures.keySet());
    }

    /**
     * 对象级 Key 更新失败的原因，没有失败时为 null。
     * <p>
     * The cause of a failed object-level key update, null when it succeeded.
     */
    public Throwable getObjectUpdateFailure() {
        return objectUpdateFailure;
    }

    private static String buildMessage(String operation, String objectId, List<String> succeeded,
                                       Map<String, Throwable> failures, Throwable objectUpdateFailure) {
        String message = String.format("Partial failure of '%s' for object '%s': succeeded=%s, failed=%s",
                operation, objectId, succeeded, failures.keySet());
        if (objectUpdateFailure != null) {
            message += ", object keys not updated: " + objectUpdateFailure.getMessage();
        }
        return message;
    }
}
