package io.github.vevoly.sandsnake.core.factory;

import io.github.vevoly.sandsnake.api.SandsnakeBackend;
import io.github.vevoly.sandsnake.api.SandsnakeMarkerBackend;
import io.github.vevoly.sandsnake.api.config.ResolvedHostConfig;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConfigurationException;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConnectionException;
import io.github.vevoly.sandsnake.api.redis.RedisClient;
import io.github.vevoly.sandsnake.core.backend.RedisSandsnakeBackend;
import io.github.vevoly.sandsnake.core.backend.RedisSandsnakeBackendProvider;
import io.github.vevoly.sandsnake.core.backend.RedisWithMarkerSandsnakeBackend;
import io.github.vevoly.sandsnake.core.properties.SandsnakeRootProperties;
import io.github.vevoly.sandsnake.core.redis.RedisNodeConnector;
import io.github.vevoly.sandsnake.core.redis.ShardedRedisClient;
import io.github.vevoly.sandsnake.core.support.InMemoryRedisClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SandsnakeBackendFactoryTest {

    @Mock
    private RedisNodeConnector connector;

    @Test
    void twoHostsOnDifferentDatabases() {
        List<InMemoryRedisClient> opened = new ArrayList<>();
        when(connector.connect(any())).thenAnswer(invocation -> {
            ResolvedHostConfig host = invocation.getArgument(0);
            InMemoryRedisClient client = new InMemoryRedisClient(host.getName());
            opened.add(client);
            return client;
        });
        SandsnakeBackendFactory factory = new SandsnakeBackendFactory(connector, null);

        SandsnakeBackend backend = factory.create(config("redis", List.of(Map.of("db", 0), Map.of("db", 1))));

        assertThat(backend).isInstanceOf(RedisSandsnakeBackend.class);
        assertThat(backend.getRedisClient()).isInstanceOf(ShardedRedisClient.class);
        assertThat(((ShardedRedisClient) backend.getRedisClient()).getRouter().getNodes()).hasSize(2);
        ArgumentCaptor<ResolvedHostConfig> hosts = ArgumentCaptor.forClass(ResolvedHostConfig.class);
        verify(connector, times(2)).connect(hosts.capture());
        assertThat(hosts.getAllValues()).extracting(ResolvedHostConfig::getDb).containsExactly(0, 1);

        backend.add("o", List.of("a", "b", "c"), "m", 1D);
        assertThat(backend.get("o", "b")).containsExactly("m");
        backend.close();
        assertThat(opened).allMatch(InMemoryRedisClient::isClosed);
    }

    @Test
    void backendIsSelectedByTypeCaseInsensitivelyOrByClassName() {
        when(connector.connect(any())).thenAnswer(invocation -> new InMemoryRedisClient());
        SandsnakeBackendFactory factory = new SandsnakeBackendFactory(connector, SandsnakeBackendFactory.defaultProviders());

        assertThat(factory.create(config("Redis-With-Marker", List.of(Map.of())))).isInstanceOf(SandsnakeMarkerBackend.class);
        assertThat(factory.create(config(RedisWithMarkerSandsnakeBackend.class.getName(), List.of(Map.of()))))
                .isInstanceOf(RedisWithMarkerSandsnakeBackend.class);
    }

    @Test
    void unknownBackendFailsBeforeConnecting() {
        SandsnakeBackendFactory factory = new SandsnakeBackendFactory(connector, null);

        assertThatThrownBy(() -> factory.create(config("cassandra", List.of(Map.of()))))
                .isInstanceOf(SandsnakeConfigurationException.class)
                .hasMessageContaining("cassandra");
        verify(connector, never()).connect(any());
    }

    @Test
    void emptyHostsFailsBeforeConnecting() {
        SandsnakeBackendFactory factory = new SandsnakeBackendFactory(connector, null);

        assertThatThrownBy(() -> factory.create(config("redis", List.of())))
                .isInstanceOf(SandsnakeConfigurationException.class);
        verify(connector, never()).connect(any());
    }

    @Test
    void unknownConfigKeysAreRejected() {
        Map<String, Object> config = config("redis", List.of(Map.of()));
        config.put("replication_factor", 3);

        assertThatThrownBy(() -> new SandsnakeBackendFactory(connector, null).create(config))
                .isInstanceOf(SandsnakeConfigurationException.class);
    }

    @Test
    void snakeCaseKeysAndDurationsAreBound() {
        Map<String, Object> host = new LinkedHashMap<>();
        host.put("port", 6380);
        host.put("socket_timeout", 2);
        host.put("connect_timeout", "PT5S");
        Map<String, Object> config = config("redis", List.of(host));
        config.put("virtual_nodes", 40);

        SandsnakeRootProperties props = SandsnakeBackendFactory.bind(config);

        assertThat(props.getVirtualNodes()).isEqualTo(40);
        assertThat(props.getSettings().getHosts().get(0).getPort()).isEqualTo(6380);
        assertThat(props.getSettings().getHosts().get(0).getTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.getSettings().getHosts().get(0).getConnectTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void connectFailureClosesNodesAlreadyOpened() {
        InMemoryRedisClient first = new InMemoryRedisClient("host-0");
        when(connector.connect(any()))
                .thenReturn(first)
                .thenThrow(new SandsnakeConnectionException("refused", "host-1"));
        SandsnakeBackendFactory factory = new SandsnakeBackendFactory(connector, null);

        assertThatThrownBy(() -> factory.create(config("redis", List.of(Map.of("db", 0), Map.of("db", 1)))))
                .isInstanceOf(SandsnakeConnectionException.class);
        assertThat(first.isClosed()).isTrue();
    }

    @Test
    void providerFailureClosesEveryConnectedNode() {
        List<InMemoryRedisClient> opened = new ArrayList<>();
        when(connector.connect(any())).thenAnswer(invocation -> {
            InMemoryRedisClient client = new InMemoryRedisClient(invocation.<ResolvedHostConfig>getArgument(0).getName());
            opened.add(client);
            return client;
        });
        RedisSandsnakeBackendProvider failing = new RedisSandsnakeBackendProvider() {
            @Override
            public SandsnakeBackend create(ResolvedSandsnakeConfig config, RedisClient redisClient) {
                throw new IllegalStateException("provider broken");
            }
        };
        SandsnakeBackendFactory factory = new SandsnakeBackendFactory(connector, List.of(failing));

        assertThatThrownBy(() -> factory.create(config("redis", List.of(Map.of("db", 0), Map.of("db", 1)))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("provider broken");
        assertThat(opened).hasSize(2).allMatch(InMemoryRedisClient::isClosed);
    }

    private static Map<String, Object> config(String backend, List<Map<String, Object>> hosts) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("hosts", hosts);
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("backend", backend);
        config.put("settings", settings);
        return config;
    }
}
