package io.github.vevoly.sandsnake.core.factory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.config.ResolvedHostConfig;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConfigurationException;
import io.github.vevoly.sandsnake.api.provider.SandsnakeBackendProvider;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;
import io.github.vevoly.sandsnake.core.backend.RedisSandsnakeBackendProvider;
import io.github.vevoly.sandsnake.core.backend.RedisWithMarkerSandsnakeBackendProvider;
import io.github.vevoly.sandsnake.core.config.SandsnakeConfigResolver;
import io.github.vevoly.sandsnake.core.properties.SandsnakeRootProperties;
import io.github.vevoly.sandsnake.core.redis.RedisNode;
import io.github.vevoly.sandsnake.core.redis.RedisNodeConnector;
import io.github.vevoly.sandsnake.core.redis.ShardedRedisClient;
import io.github.vevoly.sandsnake.core.routing.ConnectionRouters;
import io.github.vevoly.sandsnake.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 后端工厂：把配置变成一个可用的 {@link SandsnakeBackend}。
 * <p>
 * 创建流程：
 * 1. 解析并校验配置（任何错误都在连接之前抛出）。
 * 2. 根据 {@code backend} 选择已注册的 {@link SandsnakeBackendProvider}。
 * 3. 为每个节点建立连接；任何一个节点失败时，关闭已建立的连接后再抛出。
 * 4. 构建路由器和分片客户端，交给提供者创建后端；失败时同样关闭所有连接。
 * <p>
 * The backend factory: turns configuration into a ready {@link SandsnakeBackend}.
 * 1. Resolve and validate the configuration (every error is raised before connecting).
 * 2. Pick the registered {@link SandsnakeBackendProvider} named by {@code backend}.
 * 3. Connect every node; when one fails, the nodes already connected are closed before the error propagates.
 * 4. Build the router and the sharded client and let the provider create the backend; a failure closes every node.
 *
 * @author vevoly
 */
@Slf4j
public class SandsnakeBackendFactory {

    public static final String LOG_PREFIX = "[SandsnakeFactory] ";

    private static final ObjectMapper CONFIG_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final I18nLogger i18nLog = new I18nLogger(log, LOG_PREFIX);

    private final RedisNodeConnector connector;
    private final SandsnakeConfigResolver resolver = new SandsnakeConfigResolver();

    /**
     * 提供者注册表，key 为小写的类型名称以及后端类的全限定名。
     * <p>
     * The provider registry, keyed by lower-case type name and by the backend class name.
     */
    private final Map<String, SandsnakeBackendProvider> providerMap = new ConcurrentHashMap<>();

    /**
     * @param connector 节点连接器 / the node connector
     * @param providers 后端提供者，为空时注册内置的 {@code redis} 和 {@code redis-with-marker}
     *                  / backend providers; the built-in {@code redis} and {@code redis-with-marker} when empty
     */
    public SandsnakeBackendFactory(RedisNodeConnector connector, List<SandsnakeBackendProvider> providers) {
        this.connector = connector;
        List<SandsnakeBackendProvider> effective = CollectionUtils.isEmpty(providers) ? defaultProviders() : providers;
        for (SandsnakeBackendProvider provider : effective) {
            register(provider);
        }
    }

    public static List<SandsnakeBackendProvider> defaultProviders() {
        return List.of(new RedisSandsnakeBackendProvider(), new RedisWithMarkerSandsnakeBackendProvider());
    }

    /**
     * 注册一个后端提供者。同名的提供者会被替换。
     * <p>
     * Registers a backend provider. A provider of the same name is replaced.
     */
    public final void register(SandsnakeBackendProvider provider) {
        providerMap.put(provider.getBackendType().toLowerCase(Locale.ROOT), provider);
        providerMap.put(provider.getBackendClass().getName(), provider);
        i18nLog.debug("factory.provider_registered", provider.getBackendType(), provider.getBackendClass().getName());
    }

    /**
     * 以字典形式的配置创建后端。字典结构与 {@link SandsnakeRootProperties} 相同，未知的 key 视为配置错误。
     * <p>
     * Creates a backend from a dictionary configuration shaped like {@link SandsnakeRootProperties}.
     * Unknown keys are a configuration error.
     */
    public SandsnakeBackend create(Map<String, Object> config) {
        return create(bind(config));
    }

    public SandsnakeBackend create(SandsnakeRootProperties properties) {
        // 1. 解析配置 / Resolve configuration
        ResolvedSandsnakeConfig config = resolver.resolve(properties);

        // 2. 选择提供者，路由类型也在连接前校验 / Pick the provider, the router type is checked before connecting too
        SandsnakeBackendProvider provider = findProvider(config.getBackend());
        if (!ConnectionRouters.isSupported(config.getRouter())) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Unknown router type '" + config.getRouter() + "'.");
        }

        // 3. 连接所有节点 / Connect every node
        List<RedisNode> nodes = connectAll(config.getHosts());

        // 4. 路由器 + 分片客户端 + 后端 / Router, sharded client and backend
        SandsnakeBackend backend;
        try {
            ConnectionRouter<RedisNode> router = ConnectionRouters.create(
                    config.getRouter(), nodes, RedisNode::getName, config.getVirtualNodes());
            backend = provider.create(config, new ShardedRedisClient(router));
        } catch (RuntimeException e) {
            closeOpened(nodes, e);
            throw e;
        }
        i18nLog.info("factory.backend_created", provider.getBackendType(), nodes.size(), config.getRouter(), config.getPrefix());
        return backend;
    }

    private SandsnakeBackendProvider findProvider(String backend) {
        SandsnakeBackendProvider provider = providerMap.get(backend);
        if (provider == null) {
            provider = providerMap.get(backend.toLowerCase(Locale.ROOT));
        }
        if (provider == null) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Unknown backend '" + backend
                    + "'. Registered backends: " + registeredTypes());
        }
        return provider;
    }

    private List<String> registeredTypes() {
        List<String> types = new ArrayList<>();
        providerMap.values().stream().distinct().forEach(p -> types.add(p.getBackendType()));
        Collections.sort(types);
        return types;
    }

    private List<RedisNode> connectAll(List<ResolvedHostConfig> hosts) {
        List<RedisNode> nodes = new ArrayList<>(hosts.size());
        for (ResolvedHostConfig host : hosts) {
            try {
                nodes.add(new RedisNode(host.getName(), connector.connect(host)));
            } catch (RuntimeException e) {
                i18nLog.error("factory.connect_failed", e, host.getName(), nodes.size());
                closeOpened(nodes, e);
                throw e;
            }
        }
        return nodes;
    }

    /**
     * 关闭已建立的连接，关闭时的异常作为 suppressed 附加到原始异常上。
     * <p>
     * Closes connections already opened; close errors are attached to the original error as suppressed.
     */
    private static void closeOpened(List<RedisNode> nodes, RuntimeException original) {
        for (RedisNode node : nodes) {
            try {
                node.getClient().close();
            } catch (RuntimeException closeError) {
                original.addSuppressed(closeError);
            }
        }
    }

    static SandsnakeRootProperties bind(Map<String, Object> config) {
        if (config == null) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Configuration must not be null.");
        }
        try {
            return CONFIG_MAPPER.convertValue(config, SandsnakeRootProperties.class);
        } catch (IllegalArgumentException e) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Invalid configuration: " + e.getMessage(), e);
        }
    }
}
