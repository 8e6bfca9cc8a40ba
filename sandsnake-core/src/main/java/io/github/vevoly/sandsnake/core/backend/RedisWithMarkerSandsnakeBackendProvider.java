package io.github.vevoly.sandsnake.core.backend;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.constants.DefaultBackendTypes;
import io.github.vevoly.sandsnake.api.redis.RedisClient;

/**
 * {@code redis-with-marker} 后端的提供者。
 * <p>
 * Provider of the {@code redis-with-marker} backend.
 *
 * @author vevoly
 */
public class RedisWithMarkerSandsnakeBackendProvider extends RedisSandsnakeBackendProvider {

    @Override
    public String getBackendType() {
        return DefaultBackendTypes.REDIS_WITH_MARKER;
    }

    @Override
    public Class<? extends SandsnakeBackend> getBackendClass() {
        return RedisWithMarkerSandsnakeBackend.class;
    }

    @Override
    public SandsnakeBackend create(ResolvedSandsnakeConfig config, RedisClient redisClient) {
        return new RedisWithMarkerSandsnakeBackend(newEngine(config, redisClient));
    }
}
