package io.github.vevoly.sandsnake.core.properties;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.github.vevoly.sandsnake.api.constants.SandsnakeConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 映射配置文件中 {@code sandsnake} 根配置块的属性。
 * <p>
 * 不使用 Spring 时，也可以通过 {@code Sandsnake.createBackend(Map)} 以字典形式传入相同的结构。
 * <p>
 * Maps the properties of the {@code sandsnake} root configuration block.
 * Without Spring, the same structure can be passed as a dictionary to {@code Sandsnake.createBackend(Map)}.
 *
 * @author vevoly
 */
@Data
@ConfigurationProperties(prefix = "sandsnake")
public class SandsnakeRootProperties {

    /**
     * 是否启用自动配置。
     * <p>
     * Whether the auto-configuration is enabled.
     */
    private boolean enabled = true;

    /**
     * 后端类型名称 (redis, redis-with-marker) 或已注册后端类的全限定名。
     * <p>
     * Backend type name (redis, redis-with-marker) or the fully qualified name of a registered backend class.
     */
    private String backend = SandsnakeConstants.DEFAULT_BACKEND_TYPE;

    /**
     * 所有物理 Key 的前缀。
     * <p>
     * Prefix of every physical key.
     */
    private String prefix = SandsnakeConstants.DEFAULT_PREFIX;

    /**
     * 路由算法 (consistent_hash, modulo)。
     * <p>
     * Routing algorithm (consistent_hash, modulo).
     */
    private String router = SandsnakeConstants.DEFAULT_ROUTER_TYPE;

    /**
     * 一致性哈希环上每个节点的虚拟节点数。
     * <p>
     * Virtual nodes per host on the consistent hash ring.
     */
    @JsonAlias({"virtual_nodes", "virtual-nodes"})
    private Integer virtualNodes;

    /**
     * 节点配置。
     * <p>
     * Node settings.
     */
    private SandsnakeSettingsProperties settings = new SandsnakeSettingsProperties();
}
