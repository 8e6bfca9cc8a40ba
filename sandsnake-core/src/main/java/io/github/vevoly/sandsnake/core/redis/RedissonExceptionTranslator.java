package io.github.vevoly.sandsnake.core.redis;

import io.github.vevoly.sandsnake.api.exception.SandsnakeBackendException;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConnectionException;
import io.github.vevoly.sandsnake.api.exception.SandsnakeException;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 将 Redisson 异常转换为 sandsnake 异常。
 * <p>
 * Translates Redisson exceptions into sandsnake exceptions.
 *
 * @author vevoly
 */
public final class RedissonExceptionTranslator {

    private RedissonExceptionTranslator() {}

    /**
     * 连接与超时错误转换为 {@link SandsnakeConnectionException}，其他 Redis 错误转换为 {@link SandsnakeBackendException}。
     * <p>
     * Connection and timeout errors become {@link SandsnakeConnectionException}, other Redis errors
     * become {@link SandsnakeBackendException}.
     */
    public static RuntimeException translate(String nodeName, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof SandsnakeException) {
            return (SandsnakeException) cause;
        }
        if (cause instanceof RedisConnectionException || cause instanceof RedisTimeoutException) {
            return new SandsnakeConnectionException("Node '" + nodeName + "' is unreachable: " + cause.getMessage(), nodeName, cause);
        }
        if (cause instanceof RedisException) {
            return new SandsnakeBackendException("Node '" + nodeName + "' returned an error: " + cause.getMessage(), nodeName, cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new SandsnakeBackendException("Node '" + nodeName + "' failed: " + cause.getMessage(), nodeName, cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
