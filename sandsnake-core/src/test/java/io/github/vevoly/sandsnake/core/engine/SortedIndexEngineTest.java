package io.github.vevoly.sandsnake.core.engine;

import io.github.vevoly.sandsnake.api.exception.SandsnakeConnectionException;
import io.github.vevoly.sandsnake.api.exception.SandsnakePartialFailureException;
import io.github.vevoly.sandsnake.api.exception.SandsnakeValidationException;
import io.github.vevoly.sandsnake.api.structure.ScoreRange;
import io.github.vevoly.sandsnake.api.structure.ScoredMember;
import io.github.vevoly.sandsnake.api.utils.IndexKeys;
import io.github.vevoly.sandsnake.core.support.InMemoryRedisClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortedIndexEngineTest {

    private static final String OBJ = "user:1";

    private InMemoryRedisClient redis;
    private IndexKeys keys;
    private SortedIndexEngine engine;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedisClient();
        keys = new IndexKeys(null);
        AtomicLong clock = new AtomicLong(100);
        engine = new SortedIndexEngine(redis, keys, clock::incrementAndGet);
    }

    @Test
    void addFansOutToEveryIndexAndRecordsCollection() {
        engine.add(OBJ, List.of("feed", "mentions"), "post:1", 10D);

        assertThat(engine.get(OBJ, "feed", 0, -1, false)).containsExactly("post:1");
        assertThat(engine.get(OBJ, "mentions", 0, -1, false)).containsExactly("post:1");
        assertThat(engine.getIndexNames(OBJ)).containsExactlyInAnyOrder("feed", "mentions");
        assertThat(redis.sMembers("ssnake:user:1:indexes")).containsExactlyInAnyOrder("feed", "mentions");
    }

    @Test
    void reAddingUpdatesScoreWithoutDuplicates() {
        engine.add(OBJ, List.of("feed"), "a", 1D);
        engine.add(OBJ, List.of("feed"), "b", 2D);
        engine.add(OBJ, List.of("feed"), "a", 3D);

        assertThat(engine.count(OBJ, "feed")).isEqualTo(2);
        assertThat(engine.getWithScores(OBJ, "feed", 0, -1, false))
                .containsExactly(new ScoredMember("b", 2D), new ScoredMember("a", 3D));
    }

    @Test
    void defaultScoreComesFromGenerator() {
        engine.add(OBJ, List.of("feed"), "a", null);
        engine.add(OBJ, List.of("feed"), "b", null);

        assertThat(engine.getWithScores(OBJ, "feed", 0, -1, false))
                .extracting(ScoredMember::getScore)
                .containsExactly(101D, 102D);
    }

    @Test
    void duplicateIndexNamesAreCollapsed() {
        assertThat(SortedIndexEngine.normalizeIndexNames(Arrays.asList("b", "a", "b"))).containsExactly("b", "a");
    }

    @Test
    void rejectsInvalidIndexNames() {
        assertThatThrownBy(() -> engine.add(OBJ, List.of(), "a", 1D)).isInstanceOf(SandsnakeValidationException.class);
        assertThatThrownBy(() -> engine.add(OBJ, Arrays.asList("feed", " "), "a", 1D)).isInstanceOf(SandsnakeValidationException.class);
        assertThatThrownBy(() -> engine.add(OBJ, null, "a", 1D)).isInstanceOf(SandsnakeValidationException.class);
        assertThat(redis.keys()).isEmpty();
    }

    @Test
    void removeIsNoOpForMissingMemberOrIndex() {
        engine.add(OBJ, List.of("feed"), "a", 1D);

        engine.remove(OBJ, List.of("feed", "never-created"), "missing");
        engine.remove(OBJ, List.of("feed"), "a");

        assertThat(engine.get(OBJ, "feed", 0, -1, false)).isEmpty();
        assertThat(engine.getIndexNames(OBJ)).containsExactly("feed");
    }

    @Test
    void removeIndexDeletesIndexAndCollectionEntry() {
        engine.add(OBJ, List.of("feed", "mentions"), "a", 1D);

        engine.removeIndex(OBJ, List.of("feed"));

        assertThat(engine.count(OBJ, "feed")).isZero();
        assertThat(redis.exists(keys.indexKey(OBJ, "feed"))).isFalse();
        assertThat(engine.getIndexNames(OBJ)).containsExactly("mentions");
    }

    @Test
    void rankRangesFollowRedisSemantics() {
        for (int i = 1; i <= 5; i++) {
            engine.add(OBJ, List.of("feed"), "m" + i, (double) i);
        }

        assertThat(engine.get(OBJ, "feed", 0, 1, false)).containsExactly("m1", "m2");
        assertThat(engine.get(OBJ, "feed", 0, 1, true)).containsExactly("m5", "m4");
        assertThat(engine.get(OBJ, "feed", -2, -1, false)).containsExactly("m4", "m5");
        assertThat(engine.get(OBJ, "feed", 3, 100, false)).containsExactly("m4", "m5");
        assertThat(engine.get(OBJ, "feed", 10, 20, false)).isEmpty();
        assertThat(engine.get(OBJ, "missing", 0, -1, false)).isEmpty();
    }

    @Test
    void scoreRangesWithLimitAndOffset() {
        for (int i = 1; i <= 5; i++) {
            engine.add(OBJ, List.of("feed"), "m" + i, (double) i);
        }

        assertThat(engine.getByScore(OBJ, "feed", ScoreRange.closed(2, 4), false, null, 0))
                .extracting(ScoredMember::getValue).containsExactly("m2", "m3", "m4");
        assertThat(engine.getByScore(OBJ, "feed", ScoreRange.closed(2, 4), true, 2, 0))
                .extracting(ScoredMember::getValue).containsExactly("m4", "m3");
        assertThat(engine.getByScore(OBJ, "feed", ScoreRange.all(), false, 2, 1))
                .extracting(ScoredMember::getValue).containsExactly("m2", "m3");
        assertThat(engine.getByScore(OBJ, "feed", ScoreRange.of(2, false, 4, false), false, null, 0))
                .extracting(ScoredMember::getValue).containsExactly("m3");
    }

    @Test
    void zeroLimitReturnsEmptyWithoutRoundTrip() {
        engine.add(OBJ, List.of("feed"), "a", 1D);
        int before = redis.getCommandCount();

        assertThat(engine.getByScore(OBJ, "feed", ScoreRange.all(), false, 0, 0)).isEmpty();
        assertThat(engine.getByScore(OBJ, "feed", ScoreRange.closed(5, 1), false, null, 0)).isEmpty();
        assertThat(redis.getCommandCount()).isEqualTo(before);
    }

    @Test
    void rejectsNegativeLimitAndOffset() {
        assertThatThrownBy(() -> engine.getByScore(OBJ, "feed", ScoreRange.all(), false, -1, 0))
                .isInstanceOf(SandsnakeValidationException.class);
        assertThatThrownBy(() -> engine.getByScore(OBJ, "feed", ScoreRange.all(), false, null, -1))
                .isInstanceOf(SandsnakeValidationException.class);
    }

    @Test
    void unionMergesMembersOfAllIndexes() {
        engine.add(OBJ, List.of("a"), "x", 1D);
        engine.add(OBJ, List.of("a", "b"), "y", 2D);
        engine.add(OBJ, List.of("b"), "z", 3D);

        assertThat(engine.getUnion(OBJ, List.of("a", "b", "missing"))).containsExactlyInAnyOrder("x", "y", "z");
    }

    @Test
    void partialFailureReportsSucceededAndFailedIndexes() {
        redis.failKey(keys.indexKey(OBJ, "broken"));

        assertThatThrownBy(() -> engine.add(OBJ, List.of("ok", "broken"), "a", 1D))
                .isInstanceOfSatisfying(SandsnakePartialFailureException.class, e -> {
                    assertThat(e.getOperation()).isEqualTo("add");
                    assertThat(e.getSucceeded()).containsExactly("ok");
                    assertThat(e.getFailedIndexNames()).containsExactly("broken");
                    assertThat(e.getFailures().get("broken")).isInstanceOf(SandsnakeConnectionException.class);
                });
        assertThat(engine.get(OBJ, "ok", 0, -1, false)).containsExactly("a");
    }

    @Test
    void failedCollectionUpdateDoesNotCountWrittenIndexesAsFailed() {
        redis.failKey(keys.collectionKey(OBJ));

        assertThatThrownBy(() -> engine.add(OBJ, List.of("a", "b"), "m", 1D))
                .isInstanceOfSatisfying(SandsnakePartialFailureException.class, e -> {
                    assertThat(e.getSucceeded()).containsExactly("a", "b");
                    assertThat(e.getFailedIndexNames()).isEmpty();
                    assertThat(e.getObjectUpdateFailure()).isInstanceOf(SandsnakeConnectionException.class);
                });
        assertThat(engine.get(OBJ, "a", 0, -1, false)).containsExactly("m");
        assertThat(engine.get(OBJ, "b", 0, -1, false)).containsExactly("m");
    }

    @Test
    void failedCollectionUpdateIsReportedAlongsideFailedIndex() {
        engine.add(OBJ, List.of("ok", "broken"), "m", 1D);
        redis.failKey(keys.collectionKey(OBJ));
        redis.failKey(keys.indexKey(OBJ, "broken"));

        assertThatThrownBy(() -> engine.removeIndex(OBJ, List.of("ok", "broken")))
                .isInstanceOfSatisfying(SandsnakePartialFailureException.class, e -> {
                    assertThat(e.getSucceeded()).containsExactly("ok");
                    assertThat(e.getFailedIndexNames()).containsExactly("broken");
                    assertThat(e.getObjectUpdateFailure()).isNotNull();
                });
        assertThat(engine.count(OBJ, "ok")).isZero();
    }

    @Test
    void totalFailureRethrowsFirstCause() {
        redis.setDown(true);

        assertThatThrownBy(() -> engine.add(OBJ, List.of("a", "b"), "m", 1D))
                .isInstanceOf(SandsnakeConnectionException.class)
                .isNotInstanceOf(SandsnakePartialFailureException.class);
    }

    @Test
    void markerPagination() {
        engine.add(OBJ, List.of("feed"), "before_2", 13254191990000D);
        engine.add(OBJ, List.of("feed"), "before_1", 13254191995000D);
        engine.add(OBJ, List.of("feed"), "after_0", 13254192000000D);
        engine.add(OBJ, List.of("feed"), "after_1", 13254192005000D);
        engine.add(OBJ, List.of("feed"), "after_2", 13254192010000D);

        assertThat(SortedIndexEngine.members(engine.getItems(OBJ, "feed", 13254192000000D, false, null)))
                .containsExactly("after_0", "before_1", "before_2");
        assertThat(SortedIndexEngine.members(engine.getItems(OBJ, "feed", 13254192000000D, true, null)))
                .containsExactly("after_0", "after_1", "after_2");
        assertThat(SortedIndexEngine.members(engine.getItems(OBJ, "feed", 13254192000000D, true, 2)))
                .containsExactly("after_0", "after_1");
        assertThatThrownBy(() -> engine.getItems(OBJ, "feed", null, true, null))
                .isInstanceOf(SandsnakeValidationException.class);
    }
}
