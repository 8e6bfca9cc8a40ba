package io.github.vevoly.sandsnake.api.provider;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.constants.DefaultBackendTypes;
import io.github.vevoly.sandsnake.api.redis.RedisClient;

/**
 * 定义如何在已连接的存储客户端之上创建某一类后端。
 * 框架的使用者可以通过实现此接口并注册来增加新的后端类型。
 * <p>
 * Defines how one kind of backend is built on top of a connected storage client.
 * Users of the framework can add backend types by implementing and registering this interface.
 *
 * @author vevoly
 */
public interface SandsnakeBackendProvider {

    /**
     * 返回后端类型的唯一名称，匹配时忽略大小写。
     * 框架内置的类型由 {@link DefaultBackendTypes} 定义。
     * <p>
     * Returns the unique backend type name, matched case-insensitively.
     * Built-in types are defined in {@link DefaultBackendTypes}.
     */
    String getBackendType();

    /**
     * 后端实现类。配置中也可以使用它的全限定名来选择此后端。
     * <p>
     * The backend implementation class. Its fully qualified name also selects this backend in configuration.
     */
    Class<? extends SandsnakeBackend> getBackendClass();

    /**
     * 创建后端。返回的后端拥有 {@code redisClient}，并在关闭时关闭它。
     * <p>
     * Creates the backend. The returned backend owns {@code redisClient} and closes it on close.
     *
     * @param config      已解析的配置 / the resolved configuration
     * @param redisClient 已连接的（分片）存储客户端 / the connected (sharded) storage client
     */
    SandsnakeBackend create(ResolvedSandsnakeConfig config, RedisClient redisClient);
}
