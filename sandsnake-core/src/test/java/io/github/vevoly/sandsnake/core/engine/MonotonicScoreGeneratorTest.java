package io.github.vevoly.sandsnake.core.engine;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class MonotonicScoreGeneratorTest {

    @Test
    void scoreFollowsClock() {
        Clock clock = Clock.fixed(Instant.parse("2012-01-01T12:00:00Z"), ZoneOffset.UTC);

        assertThat(new MonotonicScoreGenerator(clock).nextScore()).isEqualTo(13254192000000D);
    }

    @Test
    void sameInstantStillIncreases() {
        Clock clock = Clock.fixed(Instant.parse("2012-01-01T12:00:00Z"), ZoneOffset.UTC);
        MonotonicScoreGenerator generator = new MonotonicScoreGenerator(clock);

        double first = generator.nextScore();
        double second = generator.nextScore();
        double third = generator.nextScore();

        assertThat(second).isEqualTo(first + 1);
        assertThat(third).isEqualTo(first + 2);
    }

    @Test
    void systemClockScoresStrictlyIncrease() {
        MonotonicScoreGenerator generator = new MonotonicScoreGenerator();
        double previous = generator.nextScore();
        for (int i = 0; i < 10_000; i++) {
            double next = generator.nextScore();
            assertThat(next).isGreaterThan(previous);
            previous = next;
        }
    }

    @Test
    void concurrentCallersNeverShareAScore() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2012-01-01T12:00:00Z"), ZoneOffset.UTC);
        MonotonicScoreGenerator generator = new MonotonicScoreGenerator(clock);
        int threads = 8;
        int perThread = 5_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Double>>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                results.add(executor.submit(() -> {
                    start.await();
                    List<Double> scores = new ArrayList<>(perThread);
                    for (int i = 0; i < perThread; i++) {
                        scores.add(generator.nextScore());
                    }
                    return scores;
                }));
            }
            start.countDown();

            Set<Double> all = new HashSet<>();
            for (Future<List<Double>> result : results) {
                List<Double> scores = result.get();
                assertThat(scores).isSorted().doesNotHaveDuplicates();
                all.addAll(scores);
            }
            assertThat(all).hasSize(threads * perThread);
            assertThat(generator.nextScore()).isEqualTo(13254192000000D + threads * perThread);
        } finally {
            executor.shutdownNow();
        }
    }
}
