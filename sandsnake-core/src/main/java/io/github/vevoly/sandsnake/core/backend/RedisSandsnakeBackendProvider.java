package io.github.vevoly.sandsnake.core.backend;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.constants.DefaultBackendTypes;
import io.github.vevoly.sandsnake.api.provider.SandsnakeBackendProvider;
import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.api.utils.IndexKeys;
import io.github.vevoly.sandsnake.core.engine.MonotonicScoreGenerator;
import io.github.vevoly.sandsnake.core.engine.SortedIndexEngine;

/**
 * {@code redis} 后端的提供者。
 * <p>
 * Provider of the {@code redis} backend.
 *
 * @author vevoly
 */
public class RedisSandsnakeBackendProvider implements SandsnakeBackendProvider {

    @Override
    public String getBackendType() {
        return DefaultBackendTypes.REDIS;
    }

    @Override
    public Class<? extends SandsnakeBackend> getBackendClass() {
        return RedisSandsnakeBackend.class;
    }

    @Override
    public SandsnakeBackend create(ResolvedSandsnakeConfig config, RedisClient redisClient) {
        return new RedisSandsnakeBackend(newEngine(config, redisClient));
    }

    protected SortedIndexEngine newEngine(ResolvedSandsnakeConfig config, RedisClient redisClient) {
        return new SortedIndexEngine(redisClient, new IndexKeys(config.getPrefix()), new MonotonicScoreGenerator());
    }
}
