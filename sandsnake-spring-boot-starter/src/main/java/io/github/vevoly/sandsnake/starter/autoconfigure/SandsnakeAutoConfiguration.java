package io.github.vevoly.sandsnake.starter.autoconfigure;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.provider.SandsnakeBackendProvider;
import io.github.vevoly.sandsnake.core.backend.RedisSandsnakeBackendProvider;
import io.github.vevoly.sandsnake.core.backend.RedisWithMarkerSandsnakeBackendProvider;
import io.github.vevoly.sandsnake.core.factory.SandsnakeBackendFactory;
import io.github.vevoly.sandsnake.core.properties.SandsnakeRootProperties;
import io.github.vevoly.sandsnake.core.redis.RedisNodeConnector;
import io.github.vevoly.sandsnake.core.redis.RedissonConnectionFactory;
import io.github.vevoly.sandsnake.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.stream.Collectors;

/**
 * sandsnake 的自动配置类。
 * <p>
 * 负责初始化和组装框架的所有核心组件，包括：
 * 1. 激活 {@code sandsnake.*} 配置属性。
 * 2. 注册节点连接器 (基于 Redisson)。
 * 3. 注册内置的后端提供者，并收集用户自定义的提供者。
 * 4. 创建 {@link SandsnakeBackend}，并在容器关闭时关闭它。
 * 所有 Bean 在用户自行定义时都会让步。
 * <p>
 * Auto-configuration class for sandsnake.
 * 1. Activates the {@code sandsnake.*} configuration properties.
 * 2. Registers the node connector (based on Redisson).
 * 3. Registers the built-in backend providers and collects user-defined ones.
 * 4. Creates the {@link SandsnakeBackend} and closes it when the context shuts down.
 * Every bean backs off when the user defines their own.
 *
 * @author vevoly
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(RedissonClient.class)
@EnableConfigurationProperties(SandsnakeRootProperties.class)
@ConditionalOnProperty(prefix = "sandsnake", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SandsnakeAutoConfiguration {

    private final I18nLogger i18nLog = new I18nLogger(log, "[SandsnakeAutoConfig] ");

    /**
     * 1. 节点连接器，每个节点一个 Redisson 客户端。
     */
    @Bean
    @ConditionalOnMissingBean
    public RedisNodeConnector sandsnakeNodeConnector() {
        return new RedissonConnectionFactory();
    }

    /**
     * 2. 内置后端提供者。
     */
    @Bean
    @ConditionalOnMissingBean(RedisSandsnakeBackendProvider.class)
    public RedisSandsnakeBackendProvider redisSandsnakeBackendProvider() {
        return new RedisSandsnakeBackendProvider();
    }

    @Bean
    @ConditionalOnMissingBean(RedisWithMarkerSandsnakeBackendProvider.class)
    public RedisWithMarkerSandsnakeBackendProvider redisWithMarkerSandsnakeBackendProvider() {
        return new RedisWithMarkerSandsnakeBackendProvider();
    }

    /**
     * 3. 后端工厂，收集容器中所有的 {@link SandsnakeBackendProvider}。
     */
    @Bean
    @ConditionalOnMissingBean
    public SandsnakeBackendFactory sandsnakeBackendFactory(RedisNodeConnector connector,
                                                           ObjectProvider<SandsnakeBackendProvider> providers) {
        List<SandsnakeBackendProvider> providerList = providers.orderedStream().collect(Collectors.toList());
        return new SandsnakeBackendFactory(connector, providerList);
    }

    /**
     * 4. 后端实例，容器关闭时释放所有连接。
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SandsnakeBackend sandsnakeBackend(SandsnakeBackendFactory factory, SandsnakeRootProperties properties) {
        SandsnakeBackend backend = factory.create(properties);
        i18nLog.info("autoconfig.backend_ready", properties.getBackend());
        return backend;
    }
}
