package io.github.vevoly.sandsnake.api.constants;

/**
 * 定义了框架内置的路由算法标识符 ({@code sandsnake.router})。
 * <p>
 * Defines the built-in routing algorithm identifiers ({@code sandsnake.router}).
 *
 * @author vevoly
 */
public final class DefaultRouterTypes {

    private DefaultRouterTypes() {}

    /**
     * ketama 风格的一致性哈希。增删节点时只有少量 key 需要迁移。
     * <p>
     * Ketama-style consistent hashing. Adding or removing a host only moves a fraction of the keys.
     */
    public static final String CONSISTENT_HASH = "consistent_hash";

    /**
     * CRC32(key) 对节点数取模。节点数变化时几乎所有 key 都会迁移。
     * <p>
     * CRC32(key) modulo the host count. Changing the host count moves almost every key.
     */
    public static final String MODULO = "modulo";
}
