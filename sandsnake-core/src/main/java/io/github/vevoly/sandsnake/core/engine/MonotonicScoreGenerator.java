package io.github.vevoly.sandsnake.core.engine;

import io.github.vevoly.sandsnake.api.utils.ScoreUtils;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单调递增的时间戳分数生成器。
 * <p>
 * 分数取当前时间（100 微秒精度，见 {@link ScoreUtils}），同一个生成器内严格递增：
 * 同一刻或时钟回拨时，在上一个分数的基础上加一。
 * <p>
 * Monotonic timestamp score generator.
 * Scores are the current time at 100 microsecond resolution (see {@link ScoreUtils}) and strictly increase
 * within one generator: on a tie or a clock step back the previous score is bumped by one.
 *
 * @author vevoly
 */
public class MonotonicScoreGenerator implements ScoreGenerator {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    public MonotonicScoreGenerator() {
        this(Clock.systemUTC());
    }

    public MonotonicScoreGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public double nextScore() {
        long now = ScoreUtils.toScore(clock.instant());
        return last.updateAndGet(previous -> previous == Long.MIN_VALUE ? now : Math.max(now, previous + 1));
    }
}
