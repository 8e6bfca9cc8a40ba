package io.github.vevoly.sandsnake.core.backend;

import io.github.vevoly.sandsnake.api.SandsnakeMarkerBackend;
import io.github.vevoly.sandsnake.api.config.ResolvedSandsnakeConfig;
import io.github.vevoly.sandsnake.api.utils.IndexKeys;
import io.github.vevoly.sandsnake.core.support.InMemoryRedisClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RedisWithMarkerSandsnakeBackendTest {

    private static final double T0 = 13254192000000D;

    private InMemoryRedisClient redis;
    private SandsnakeMarkerBackend backend;
    private final IndexKeys keys = new IndexKeys(null);

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedisClient();
        backend = (SandsnakeMarkerBackend) new RedisWithMarkerSandsnakeBackendProvider()
                .create(ResolvedSandsnakeConfig.builder().build(), redis);
        backend.add("o", "s", "a", T0);
        backend.add("o", "s", "b", T0 + 1);
        backend.add("o", "s", "c", T0 + 2);
    }

    @Test
    void markerIsZeroWhenAbsent() {
        assertThat(backend.getDefaultMarker("o", "s")).isZero();
        assertThat(backend.getMarker("o", "s", "other")).isZero();
    }

    @Test
    void readingAfterMovesMarkerToLastReturnedScore() {
        assertThat(backend.getItems("o", "s", T0, true, 2)).containsExactly("a", "b");
        assertThat(backend.getDefaultMarker("o", "s")).isEqualTo(T0 + 1);

        String field = keys.markerField(keys.indexKey("o", "s"), null);
        assertThat(redis.hGet(keys.markersKey("o"), field)).isEqualTo("13254192000001");
    }

    @Test
    void readingBeforeNeverMovesMarker() {
        backend.setMarker("o", "s", null, T0);

        assertThat(backend.getItems("o", "s", T0 + 2, false, null)).containsExactly("c", "b", "a");
        assertThat(backend.getDefaultMarker("o", "s")).isEqualTo(T0);
    }

    @Test
    void namedMarkersAreIndependent() {
        backend.getItems("o", "s", T0, true, 1, "mobile");

        assertThat(backend.getMarker("o", "s", "mobile")).isEqualTo(T0);
        assertThat(backend.getDefaultMarker("o", "s")).isZero();
    }

    @Test
    void readAfterStoredMarker() {
        backend.setMarker("o", "s", "web", T0 + 1);

        assertThat(backend.getItemsAfterMarker("o", "s", null, "web")).containsExactly("b", "c");
        assertThat(backend.getMarker("o", "s", "web")).isEqualTo(T0 + 2);
    }

    @Test
    void emptyReadKeepsMarker() {
        backend.setMarker("o", "s", null, T0 + 2);

        assertThat(backend.getItems("o", "s", T0 + 10, true, null)).isEmpty();
        assertThat(backend.getDefaultMarker("o", "s")).isEqualTo(T0 + 2);
    }

    @Test
    void removeIndexDeletesItsMarkersOnly() {
        backend.add("o", "t", "x", T0);
        backend.setMarker("o", "s", null, T0);
        backend.setMarker("o", "s", "web", T0);
        backend.setMarker("o", "t", null, T0);

        backend.removeIndex("o", List.of("s"));

        assertThat(backend.getDefaultMarker("o", "s")).isZero();
        assertThat(backend.getMarker("o", "s", "web")).isZero();
        assertThat(backend.getDefaultMarker("o", "t")).isEqualTo(T0);
        assertThat(backend.getIndexNames("o")).containsExactly("t");
    }

    @Test
    void removeIndexKeepsMarkersOfIndexWhoseNameExtendsIt() {
        backend.add("o", "s:name:x", "y", T0);
        backend.setMarker("o", "s:name:x", null, 42);
        backend.setMarker("o", "s", null, T0);

        backend.removeIndex("o", List.of("s"));

        assertThat(backend.getDefaultMarker("o", "s")).isZero();
        assertThat(backend.getDefaultMarker("o", "s:name:x")).isEqualTo(42D);
    }
}
