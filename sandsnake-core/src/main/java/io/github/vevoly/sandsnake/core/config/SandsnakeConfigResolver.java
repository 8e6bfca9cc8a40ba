package io.github.vevoly.sandsnake.core.config;

import io.github.vevoly.sandsnake.api.config.ResolvedHostConfig;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.constants.SandsnakeConstants;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConfigurationException;
import io.github.vevoly.sandsnake.core.properties.SandsnakeHostProperties;
import io.github.vevoly.sandsnake.core.properties.SandsnakeRootProperties;
import io.github.vevoly.sandsnake.core.properties.SandsnakeSettingsProperties;
import io.github.vevoly.sandsnake.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * sandsnake 配置解析器。
 * <p>
 * 负责将 {@link SandsnakeRootProperties} 中每个节点的配置与 {@code defaults} 以及框架默认值进行合并，
 * 校验后构建不可变的 {@link ResolvedSandsnakeConfig}。所有配置错误都在这里以
 * {@link SandsnakeConfigurationException} 抛出，此时还没有建立任何连接。
 * <p>
 * The sandsnake configuration resolver.
 * Merges every node entry of {@link SandsnakeRootProperties} with {@code defaults} and framework defaults,
 * validates the result and builds an immutable {@link ResolvedSandsnakeConfig}. Every configuration error is raised
 * here as a {@link SandsnakeConfigurationException}, before any connection exists.
 *
 * @author vevoly
 */
@Slf4j
public class SandsnakeConfigResolver {

    public static final String LOG_PREFIX = "[SandsnakeResolver] ";

    private final I18nLogger i18nLog = new I18nLogger(log, LOG_PREFIX);

    /**
     * 解析并校验配置。
     * <p>
     * Resolves and validates the configuration.
     *
     * @param rootProperties 原始配置 / the raw properties
     * @return 归一化后的配置 / the normalized configuration
     * @throws SandsnakeConfigurationException 配置缺失或非法时 / when settings are missing or invalid
     */
    public ResolvedSandsnakeConfig resolve(SandsnakeRootProperties rootProperties) {
        if (rootProperties == null) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Configuration must not be null.");
        }
        i18nLog.debug("resolver.start_parse");

        // 1. 后端与路由 / Backend and router
        String backend = StringUtils.trimToNull(rootProperties.getBackend());
        if (backend == null) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Property 'backend' is required.");
        }
        String router = Optional.ofNullable(StringUtils.trimToNull(rootProperties.getRouter()))
                .orElse(SandsnakeConstants.DEFAULT_ROUTER_TYPE);
        int virtualNodes = Optional.ofNullable(rootProperties.getVirtualNodes())
                .orElse(SandsnakeConstants.DEFAULT_VIRTUAL_NODES);
        if (virtualNodes <= 0) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "Property 'virtual-nodes' must be positive, got " + virtualNodes + ".");
        }
        // 空前缀是合法的 / An empty prefix is legal
        String prefix = Optional.ofNullable(rootProperties.getPrefix()).orElse(SandsnakeConstants.DEFAULT_PREFIX);

        // 2. 节点 / Hosts
        SandsnakeSettingsProperties settings = rootProperties.getSettings();
        if (settings == null || CollectionUtils.isEmpty(settings.getHosts())) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + "No redis hosts specified in 'settings.hosts'.");
        }
        SandsnakeHostProperties defaults = Optional.ofNullable(settings.getDefaults()).orElseGet(SandsnakeHostProperties::new);

        List<ResolvedHostConfig> hosts = new ArrayList<>(settings.getHosts().size());
        Set<String> names = new HashSet<>();
        for (int i = 0; i < settings.getHosts().size(); i++) {
            SandsnakeHostProperties host = settings.getHosts().get(i);
            if (host == null) {
                throw new SandsnakeConfigurationException(LOG_PREFIX + "Host entry #" + i + " is empty.");
            }
            ResolvedHostConfig resolved = resolveHost(i, host, defaults);
            if (!names.add(resolved.getName())) {
                throw new SandsnakeConfigurationException(LOG_PREFIX + "Duplicate host name '" + resolved.getName() + "'.");
            }
            hosts.add(resolved);
            i18nLog.debug("resolver.host_resolved", resolved.getName(), describe(resolved));
        }

        ResolvedSandsnakeConfig config = ResolvedSandsnakeConfig.builder()
                .backend(backend)
                .prefix(prefix)
                .router(router)
                .virtualNodes(virtualNodes)
                .hosts(List.copyOf(hosts))
                .build();
        i18nLog.info("resolver.finished", backend, hosts.size(), router);
        return config;
    }

    /**
     * 合并单个节点的配置：节点自身 -> defaults -> 框架常量。
     * <p>
     * Merges one node entry: node -> defaults -> framework constants.
     */
    private ResolvedHostConfig resolveHost(int index, SandsnakeHostProperties props, SandsnakeHostProperties defaults) {
        String name = Optional.ofNullable(StringUtils.trimToNull(props.getName()))
                .orElse("host-" + index);
        String host = Optional.ofNullable(StringUtils.trimToNull(props.getHost()))
                .or(() -> Optional.ofNullable(StringUtils.trimToNull(defaults.getHost())))
                .orElse(SandsnakeConstants.DEFAULT_HOST);
        int port = Optional.ofNullable(props.getPort())
                .or(() -> Optional.ofNullable(defaults.getPort()))
                .orElse(SandsnakeConstants.DEFAULT_PORT);
        int db = Optional.ofNullable(props.getDb())
                .or(() -> Optional.ofNullable(defaults.getDb()))
                .orElse(SandsnakeConstants.DEFAULT_DB);
        String password = Optional.ofNullable(props.getPassword())
                .or(() -> Optional.ofNullable(defaults.getPassword()))
                .orElse(null);
        Duration timeout = Optional.ofNullable(props.getTimeout())
                .or(() -> Optional.ofNullable(defaults.getTimeout()))
                .orElse(Duration.ofMillis(SandsnakeConstants.DEFAULT_TIMEOUT_MILLIS));
        Duration connectTimeout = Optional.ofNullable(props.getConnectTimeout())
                .or(() -> Optional.ofNullable(defaults.getConnectTimeout()))
                .orElse(Duration.ofMillis(SandsnakeConstants.DEFAULT_CONNECT_TIMEOUT_MILLIS));
        boolean ssl = Optional.ofNullable(props.getSsl())
                .or(() -> Optional.ofNullable(defaults.getSsl()))
                .orElse(false);
        List<String> clusterNodes = Optional.ofNullable(props.getClusterNodes())
                .or(() -> Optional.ofNullable(defaults.getClusterNodes()))
                .map(List::copyOf)
                .orElse(List.of());
        int poolSize = Optional.ofNullable(props.getConnectionPoolSize())
                .or(() -> Optional.ofNullable(defaults.getConnectionPoolSize()))
                .orElse(SandsnakeConstants.DEFAULT_CONNECTION_POOL_SIZE);
        int minIdle = Optional.ofNullable(props.getConnectionMinimumIdleSize())
                .or(() -> Optional.ofNullable(defaults.getConnectionMinimumIdleSize()))
                .orElse(Math.min(SandsnakeConstants.DEFAULT_CONNECTION_MINIMUM_IDLE_SIZE, poolSize));

        String where = "Host '" + name + "': ";
        if (port < 1 || port > 65535) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + where + "port must be within 1-65535, got " + port + ".");
        }
        if (db < 0) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + where + "db must not be negative, got " + db + ".");
        }
        requirePositive(where + "timeout", timeout);
        requirePositive(where + "connect-timeout", connectTimeout);
        if (poolSize <= 0 || minIdle < 0 || minIdle > poolSize) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + where
                    + "connection pool sizes are invalid (pool=" + poolSize + ", minIdle=" + minIdle + ").");
        }
        // Redis Cluster 只有 0 号库 / Redis Cluster only has database 0
        if (!clusterNodes.isEmpty() && db != 0) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + where + "cluster mode only supports db 0, got " + db + ".");
        }
        if (clusterNodes.stream().anyMatch(StringUtils::isBlank)) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + where + "cluster-nodes must not contain blank entries.");
        }

        return ResolvedHostConfig.builder()
                .name(name)
                .host(host)
                .port(port)
                .db(db)
                .password(password)
                .timeout(timeout)
                .connectTimeout(connectTimeout)
                .ssl(ssl)
                .clusterNodes(clusterNodes)
                .connectionPoolSize(poolSize)
                .connectionMinimumIdleSize(minIdle)
                .build();
    }

    private static void requirePositive(String what, Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            throw new SandsnakeConfigurationException(LOG_PREFIX + what + " must be positive, got " + duration + ".");
        }
    }

    private static String describe(ResolvedHostConfig host) {
        return host.isClusterMode() ? "cluster" + host.getClusterNodes() : host.getAddress() + "/" + host.getDb();
    }
}
