package io.github.vevoly.sandsnake.core.redis;

import io.github.vevoly.sandsnake.api.config.ResolvedHostConfig;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConnectionException;
import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.ClusterServersConfig;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

/**
 * 默认的 {@link RedisNodeConnector}：为每个节点配置创建一个独立的 Redisson 客户端。
 * <p>
 * 强制使用 {@link StringCodec}；配置了 {@code clusterNodes} 的节点使用 Redisson 的集群模式，其余使用单机模式。
 * <p>
 * The default {@link RedisNodeConnector}: one dedicated Redisson client per node descriptor.
 * {@link StringCodec} is enforced; descriptors with {@code clusterNodes} use Redisson's cluster mode,
 * all others single-server mode.
 *
 * @author vevoly
 */
@Slf4j
public class RedissonConnectionFactory implements RedisNodeConnector {

    private final I18nLogger i18nLog = new I18nLogger(log, "[SandsnakeConnector] ");

    @Override
    public RedisClient connect(ResolvedHostConfig host) {
        Config config = buildConfig(host);
        try {
            RedissonClient redisson = Redisson.create(config);
            i18nLog.info("connector.connected", host.getName(),
                    host.isClusterMode() ? host.getClusterNodes() : host.getAddress(), host.getDb());
            return new RedissonRedisClient(host.getName(), redisson);
        } catch (RedisException e) {
            throw RedissonExceptionTranslator.translate(host.getName(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new SandsnakeConnectionException("Cannot connect to node '" + host.getName() + "': " + e.getMessage(),
                    host.getName(), e);
        }
    }

    /**
     * 根据节点配置构建 Redisson {@link Config}。
     * <p>
     * Builds the Redisson {@link Config} of a node descriptor.
     */
    Config buildConfig(ResolvedHostConfig host) {
        Config config = new Config();
        // 强制使用 StringCodec / Enforce StringCodec
        config.setCodec(StringCodec.INSTANCE);

        int timeout = (int) host.getTimeout().toMillis();
        int connectTimeout = (int) host.getConnectTimeout().toMillis();

        if (host.isClusterMode()) {
            ClusterServersConfig cluster = config.useClusterServers()
                    .setTimeout(timeout)
                    .setConnectTimeout(connectTimeout)
                    .setMasterConnectionPoolSize(host.getConnectionPoolSize())
                    .setMasterConnectionMinimumIdleSize(host.getConnectionMinimumIdleSize())
                    .setClientName("sandsnake-" + host.getName());
            host.getClusterNodes().forEach(node -> cluster.addNodeAddress(host.toAddress(node)));
            if (host.getPassword() != null) {
                cluster.setPassword(host.getPassword());
            }
        } else {
            SingleServerConfig single = config.useSingleServer()
                    .setAddress(host.getAddress())
                    .setDatabase(host.getDb())
                    .setTimeout(timeout)
                    .setConnectTimeout(connectTimeout)
                    .setConnectionPoolSize(host.getConnectionPoolSize())
                    .setConnectionMinimumIdleSize(host.getConnectionMinimumIdleSize())
                    .setClientName("sandsnake-" + host.getName());
            if (host.getPassword() != null) {
                single.setPassword(host.getPassword());
            }
        }
        return config;
    }
}
