package io.github.vevoly.sandsnake.api.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreUtilsTest {

    @Test
    void scoreIsEpochSecondsFollowedByFourSubSecondDigits() {
        assertThat(ScoreUtils.toScore(Instant.parse("2012-01-01T12:00:00Z"))).isEqualTo(13254192000000L);
        assertThat(ScoreUtils.toScore(Instant.parse("2012-01-01T12:00:00.123456789Z"))).isEqualTo(13254192001234L);
    }

    @Test
    void toInstantDropsPrecisionBelowOneHundredMicros() {
        Instant instant = Instant.parse("2012-01-01T12:00:00.123456789Z");

        assertThat(ScoreUtils.toInstant(ScoreUtils.toScore(instant))).isEqualTo(Instant.parse("2012-01-01T12:00:00.1234Z"));
    }

    @Test
    void presentDayScoresAreExactAsDoubles() {
        long score = ScoreUtils.toScore(Instant.parse("2030-06-30T23:59:59.9999Z"));

        assertThat((long) (double) score).isEqualTo(score);
    }
}
