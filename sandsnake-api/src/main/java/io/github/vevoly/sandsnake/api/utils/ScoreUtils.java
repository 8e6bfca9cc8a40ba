package io.github.vevoly.sandsnake.api.utils;

import io.github.vevoly.sandsnake.api.constants.SandsnakeConstants;

import java.time.Instant;

/**
 * 时间戳分数的换算工具。
 * <p>
 * 分数由秒级 Unix 时间戳后接 4 位亚秒数字组成，即 {@code epochSecond * 10000 + nanos / 100000}，精度 100 微秒。
 * 当前时间的分数约为 1.7e13，远小于 2^53，因此可以用 double 精确表示。
 * <p>
 * Conversions for timestamp scores.
 * A score is the Unix timestamp in seconds followed by four sub-second digits,
 * i.e. {@code epochSecond * 10000 + nanos / 100000}, 100 microsecond resolution.
 * Present-day scores are around 1.7e13, far below 2^53, so doubles hold them exactly.
 *
 * @author vevoly
 */
public final class ScoreUtils {

    private static final long NANOS_PER_TICK = 1_000_000_000L / SandsnakeConstants.SCORE_TICKS_PER_SECOND;

    private ScoreUtils() {}

    public static long toScore(Instant instant) {
        return instant.getEpochSecond() * SandsnakeConstants.SCORE_TICKS_PER_SECOND + instant.getNano() / NANOS_PER_TICK;
    }

    public static Instant toInstant(double score) {
        long ticks = (long) score;
        long seconds = Math.floorDiv(ticks, SandsnakeConstants.SCORE_TICKS_PER_SECOND);
        long subTicks = Math.floorMod(ticks, SandsnakeConstants.SCORE_TICKS_PER_SECOND);
        return Instant.ofEpochSecond(seconds, subTicks * NANOS_PER_TICK);
    }
}
