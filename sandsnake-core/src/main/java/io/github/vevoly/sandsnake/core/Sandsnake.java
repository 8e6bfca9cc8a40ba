package io.github.vevoly.sandsnake.core;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.core.factory.SandsnakeBackendFactory;
import io.github.vevoly.sandsnake.core.properties.SandsnakeRootProperties;
import io.github.vevoly.sandsnake.core.redis.RedissonConnectionFactory;

import java.util.Map;

/**
 * 不使用 Spring 时创建后端的入口。
 * <pre>{@code
 * SandsnakeBackend backend = Sandsnake.createBackend(Map.of(
 *         "backend", "redis",
 *         "settings", Map.of("hosts", List.of(Map.of("db", 0), Map.of("db", 1)))));
 * }</pre>
 * <p>
 * Entry point for creating a backend without Spring.
 *
 * @author vevoly
 */
public final class Sandsnake {

    private Sandsnake() {}

    public static SandsnakeBackend createBackend(Map<String, Object> config) {
        return newFactory().create(config);
    }

    public static SandsnakeBackend createBackend(SandsnakeRootProperties properties) {
        return newFactory().create(properties);
    }

    private static SandsnakeBackendFactory newFactory() {
        return new SandsnakeBackendFactory(new RedissonConnectionFactory(), SandsnakeBackendFactory.defaultProviders());
    }
}
