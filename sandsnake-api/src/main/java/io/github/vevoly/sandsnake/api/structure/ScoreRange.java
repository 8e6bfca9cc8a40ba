package io.github.vevoly.sandsnake.api.structure;

import io.github.vevoly.sandsnake.api.exception.SandsnakeValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 按分数查询时使用的分数区间。边界可以是无穷大，且可以分别指定是否包含。
 * <p>
 * A score interval used by score range queries. Bounds may be infinite and are individually inclusive or exclusive.
 *
 * @author vevoly
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ScoreRange {

    private static final ScoreRange ALL = closed(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    private final double min;
    private final boolean minInclusive;
    private final double max;
    private final boolean maxInclusive;

    private ScoreRange(double min, boolean minInclusive, double max, boolean maxInclusive) {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new SandsnakeValidationException("Score bounds must not be NaN");
        }
        this.min = min;
        this.minInclusive = minInclusive;
        this.max = max;
        this.maxInclusive = maxInclusive;
    }

    /**
     * [min, max]
     */
    public static ScoreRange closed(double min, double max) {
        return new ScoreRange(min, true, max, true);
    }

    public static ScoreRange of(double min, boolean minInclusive, double max, boolean maxInclusive) {
        return new ScoreRange(min, minInclusive, max, maxInclusive);
    }

    /**
     * [min, +inf)
     */
    public static ScoreRange atLeast(double min) {
        return closed(min, Double.POSITIVE_INFINITY);
    }

    /**
     * (-inf, max]
     */
    public static ScoreRange atMost(double max) {
        return closed(Double.NEGATIVE_INFINITY, max);
    }

    public static ScoreRange all() {
        return ALL;
    }

    /**
     * 判断给定分数是否落在区间内。
     * <p>
     * Whether the given score lies within this range.
     */
    public boolean contains(double score) {
        boolean aboveMin = minInclusive ? score >= min : score > min;
        boolean belowMax = maxInclusive ? score <= max : score < max;
        return aboveMin && belowMax;
    }

    /**
     * 区间是否不可能包含任何分数。
     * <p>
     * Whether no score can possibly fall within this range.
     */
    public boolean isEmpty() {
        if (min > max) {
            return true;
        }
        return min == max && !(minInclusive && maxInclusive);
    }
}
