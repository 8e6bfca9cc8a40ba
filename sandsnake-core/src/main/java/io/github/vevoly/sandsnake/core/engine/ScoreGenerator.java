package io.github.vevoly.sandsnake.core.engine;

/**
 * 调用方未指定分数时，为新成员生成默认分数。
 * <p>
 * Produces the default score of a member added without an explicit score.
 *
 * @author vevoly
 */
@FunctionalInterface
public interface ScoreGenerator {

    double nextScore();
}
