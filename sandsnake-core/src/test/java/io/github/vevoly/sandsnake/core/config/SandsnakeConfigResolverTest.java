package io.github.vevoly.sandsnake.core.config;

import io.github.vevoly.sandsnake.api.config.ResolvedHostConfig;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConfigurationException;
import io.github.vevoly.sandsnake.core.properties.SandsnakeHostProperties;
import io.github.vevoly.sandsnake.core.properties.SandsnakeRootProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SandsnakeConfigResolverTest {

    private final SandsnakeConfigResolver resolver = new SandsnakeConfigResolver();

    @Test
    void hostsInheritDefaultsThenConstants() {
        SandsnakeRootProperties props = new SandsnakeRootProperties();
        props.getSettings().getDefaults().setHost("redis.internal");
        props.getSettings().getDefaults().setTimeout(Duration.ofSeconds(1));
        props.getSettings().getHosts().add(host(0));
        SandsnakeHostProperties second = host(1);
        second.setPort(6380);
        second.setName("replica");
        props.getSettings().getHosts().add(second);

        ResolvedSandsnakeConfig config = resolver.resolve(props);

        assertThat(config.getBackend()).isEqualTo("redis");
        assertThat(config.getPrefix()).isEqualTo("ssnake:");
        assertThat(config.getRouter()).isEqualTo("consistent_hash");
        assertThat(config.getVirtualNodes()).isEqualTo(160);
        assertThat(config.getHosts()).extracting(ResolvedHostConfig::getName).containsExactly("host-0", "replica");

        ResolvedHostConfig first = config.getHosts().get(0);
        assertThat(first.getAddress()).isEqualTo("redis://redis.internal:6379");
        assertThat(first.getDb()).isZero();
        assertThat(first.getTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(first.getConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(first.isClusterMode()).isFalse();

        ResolvedHostConfig replica = config.getHosts().get(1);
        assertThat(replica.getPort()).isEqualTo(6380);
        assertThat(replica.getDb()).isEqualTo(1);
    }

    @Test
    void emptyPrefixIsKept() {
        SandsnakeRootProperties props = new SandsnakeRootProperties();
        props.setPrefix("");
        props.getSettings().getHosts().add(host(0));

        assertThat(resolver.resolve(props).getPrefix()).isEmpty();
    }

    @Test
    void missingHostsIsAConfigurationError() {
        assertThatThrownBy(() -> resolver.resolve(new SandsnakeRootProperties()))
                .isInstanceOf(SandsnakeConfigurationException.class)
                .hasMessageContaining("No redis hosts");
    }

    @Test
    void invalidHostSettingsAreRejected() {
        assertRejected(h -> h.setPort(0), "port");
        assertRejected(h -> h.setDb(-1), "db");
        assertRejected(h -> h.setTimeout(Duration.ZERO), "timeout");
        assertRejected(h -> {
            h.setDb(2);
            h.setClusterNodes(List.of("10.0.0.1:7000"));
        }, "cluster");
    }

    @Test
    void duplicateNamesAndBlankBackendAreRejected() {
        SandsnakeRootProperties props = new SandsnakeRootProperties();
        SandsnakeHostProperties a = host(0);
        a.setName("same");
        SandsnakeHostProperties b = host(1);
        b.setName("same");
        props.getSettings().getHosts().addAll(List.of(a, b));
        assertThatThrownBy(() -> resolver.resolve(props)).isInstanceOf(SandsnakeConfigurationException.class);

        SandsnakeRootProperties blank = new SandsnakeRootProperties();
        blank.setBackend(" ");
        blank.getSettings().getHosts().add(host(0));
        assertThatThrownBy(() -> resolver.resolve(blank)).isInstanceOf(SandsnakeConfigurationException.class);
    }

    @Test
    void clusterHostUsesSecureSeedAddresses() {
        SandsnakeRootProperties props = new SandsnakeRootProperties();
        SandsnakeHostProperties cluster = new SandsnakeHostProperties();
        cluster.setSsl(true);
        cluster.setClusterNodes(List.of("10.0.0.1:7000", "10.0.0.2:7000"));
        props.getSettings().getHosts().add(cluster);

        ResolvedHostConfig host = resolver.resolve(props).getHosts().get(0);

        assertThat(host.isClusterMode()).isTrue();
        assertThat(host.toAddress("10.0.0.1:7000")).isEqualTo("rediss://10.0.0.1:7000");
    }

    private void assertRejected(java.util.function.Consumer<SandsnakeHostProperties> change, String message) {
        SandsnakeRootProperties props = new SandsnakeRootProperties();
        SandsnakeHostProperties host = host(0);
        change.accept(host);
        props.getSettings().getHosts().add(host);

        assertThatThrownBy(() -> resolver.resolve(props))
                .isInstanceOf(SandsnakeConfigurationException.class)
                .hasMessageContaining(message);
    }

    private static SandsnakeHostProperties host(int db) {
        SandsnakeHostProperties host = new SandsnakeHostProperties();
        host.setDb(db);
        return host;
    }
}
