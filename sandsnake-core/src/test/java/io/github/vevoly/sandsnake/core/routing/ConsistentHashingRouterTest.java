package io.github.vevoly.sandsnake.core.routing;

import io.github.vevoly.sandsnake.api.exception.SandsnakeConfigurationException;
import io.github.vevoly.sandsnake.api.exception.SandsnakeRoutingException;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsistentHashingRouterTest {

    private static final Function<String, String> ID = Function.identity();

    @Test
    void sameKeyAlwaysRoutesToSameNode() {
        ConsistentHashingRouter<String> router = new ConsistentHashingRouter<>(List.of("a", "b", "c"), ID, 160);
        ConsistentHashingRouter<String> rebuilt = new ConsistentHashingRouter<>(List.of("a", "b", "c"), ID, 160);

        for (int i = 0; i < 1000; i++) {
            String key = "ssnake:obj:user:" + i + ":index:feed";
            assertThat(router.route(key)).isEqualTo(router.route(key)).isEqualTo(rebuilt.route(key));
        }
    }

    @Test
    void ringHoldsVirtualNodesPerHost() {
        ConsistentHashingRouter<String> router = new ConsistentHashingRouter<>(List.of("a", "b"), ID, 160);

        assertThat(router.ringSize()).isEqualTo(320);
        assertThat(router.getNodes()).containsExactly("a", "b");
    }

    @Test
    void spreadsKeysAcrossNodes() {
        ConsistentHashingRouter<String> router = new ConsistentHashingRouter<>(List.of("a", "b", "c", "d"), ID, 160);
        Map<String, Integer> counts = new HashMap<>();

        for (int i = 0; i < 10_000; i++) {
            counts.merge(router.route("key-" + i), 1, Integer::sum);
        }

        assertThat(counts).hasSize(4);
        assertThat(counts.values()).allSatisfy(count -> assertThat(count).isBetween(1500, 3500));
    }

    @Test
    void addingNodeRemapsOnlyAFraction() {
        ConsistentHashingRouter<String> before = new ConsistentHashingRouter<>(List.of("a", "b", "c"), ID, 160);
        ConsistentHashingRouter<String> after = new ConsistentHashingRouter<>(List.of("a", "b", "c", "d"), ID, 160);
        int moved = 0;
        int total = 10_000;

        for (int i = 0; i < total; i++) {
            String key = "key-" + i;
            String target = after.route(key);
            if (!target.equals(before.route(key))) {
                moved++;
                assertThat(target).isEqualTo("d");
            }
        }

        assertThat(moved).isBetween(total / 8, total / 2);
    }

    @Test
    void singleNodeTakesEverything() {
        ConnectionRouter<String> router = new ConsistentHashingRouter<>(List.of("only"), ID, 160);

        assertThat(router.route("")).isEqualTo("only");
        assertThat(router.route("anything")).isEqualTo("only");
    }

    @Test
    void rejectsEmptyNodesAndNullKeys() {
        assertThatThrownBy(() -> new ConsistentHashingRouter<>(List.<String>of(), ID, 160))
                .isInstanceOf(SandsnakeRoutingException.class);
        ConsistentHashingRouter<String> router = new ConsistentHashingRouter<>(List.of("a"), ID, 160);
        assertThatThrownBy(() -> router.route(null)).isInstanceOf(SandsnakeRoutingException.class);
    }

    @Test
    void routersAreCreatedByTypeName() {
        assertThat(ConnectionRouters.create("consistent_hash", List.of("a"), ID, 160)).isInstanceOf(ConsistentHashingRouter.class);
        assertThat(ConnectionRouters.create("MODULO", List.of("a"), ID, 160)).isInstanceOf(ModuloRouter.class);
        assertThat(ConnectionRouters.create(null, List.of("a"), ID, 160)).isInstanceOf(ConsistentHashingRouter.class);
        assertThat(ConnectionRouters.isSupported("rendezvous")).isFalse();
        assertThatThrownBy(() -> ConnectionRouters.create("rendezvous", List.of("a"), ID, 160))
                .isInstanceOf(SandsnakeConfigurationException.class)
                .hasMessageContaining("rendezvous");
    }
}
