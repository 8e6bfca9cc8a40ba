package io.github.vevoly.sandsnake.core.routing;

import io.github.vevoly.sandsnake.api.constants.DefaultRouterTypes;
import io.github.vevoly.sandsnake.api.exception.SandsnakeConfigurationException;
import io.github.vevoly.sandsnake.api.routing.ConnectionRouter;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * 按路由类型名称创建 {@link ConnectionRouter}。
 * <p>
 * Creates a {@link ConnectionRouter} by router type name.
 *
 * @author vevoly
 */
public final class ConnectionRouters {

    private ConnectionRouters() {}

    /**
     * 是否是已知的路由类型。
     * <p>
     * Whether the router type is known.
     */
    public static boolean isSupported(String type) {
        String normalized = type == null ? DefaultRouterTypes.CONSISTENT_HASH : type.trim().toLowerCase(Locale.ROOT);
        return DefaultRouterTypes.CONSISTENT_HASH.equals(normalized) || DefaultRouterTypes.MODULO.equals(normalized);
    }

    public static <T> ConnectionRouter<T> create(String type, List<T> nodes, Function<T, String> nodeId, int virtualNodes) {
        String normalized = type == null ? DefaultRouterTypes.CONSISTENT_HASH : type.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case DefaultRouterTypes.CONSISTENT_HASH:
                return new ConsistentHashingRouter<>(nodes, nodeId, virtualNodes);
            case DefaultRouterTypes.MODULO:
                return new ModuloRouter<>(nodes);
            default:
                throw new SandsnakeConfigurationException("Unknown router type '" + type + "', expected one of ["
                        + DefaultRouterTypes.CONSISTENT_HASH + ", " + DefaultRouterTypes.MODULO + "]");
        }
    }
}
