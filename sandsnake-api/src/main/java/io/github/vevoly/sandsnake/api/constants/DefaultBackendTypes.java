package io.github.vevoly.sandsnake.api.constants;

/**
 * 定义了框架内置的后端类型标识符。
 * <p>
 * 用户可以在配置的 {@code sandsnake.backend} 属性中使用这些值。
 * 自定义后端可以通过注册 {@code SandsnakeBackendProvider} 使用任何其他名称。
 * <p>
 * Defines the built-in backend type identifiers.
 * Users can use these values in the {@code sandsnake.backend} property.
 * Custom backends can register a {@code SandsnakeBackendProvider} under any other name.
 *
 * @author vevoly
 */
public final class DefaultBackendTypes {

    private DefaultBackendTypes() {}

    /**
     * 基于 Redis 有序集合的排序索引。
     * <p>
     * Sorted indexes on Redis sorted sets.
     */
    public static final String REDIS = "redis";

    /**
     * 在 {@link #REDIS} 基础上增加按索引保存的读取 marker。
     * <p>
     * {@link #REDIS} plus per-index read markers.
     */
    public static final String REDIS_WITH_MARKER = "redis-with-marker";
}
