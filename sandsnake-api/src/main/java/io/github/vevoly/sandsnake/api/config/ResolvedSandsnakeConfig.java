package io.github.vevoly.sandsnake.api.config;

import io.github.vevoly.sandsnake.api.constants.SandsnakeConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 归一化后的后端配置对象。
 * <p>
 * 后端构造完成后配置不可变，修改配置需要重新创建后端。
 * <p>
 * The normalized backend configuration.
 * It is immutable once the backend is built; reconfiguring requires creating a new backend.
 *
 * @author vevoly
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public final class ResolvedSandsnakeConfig {

    /**
     * 后端类型名称，或已注册后端类的全限定名。
     * <p>
     * Backend type name, or the fully qualified name of a registered backend class.
     */
    @Builder.Default
    private final String backend = SandsnakeConstants.DEFAULT_BACKEND_TYPE;

    /**
     * 所有物理 Key 的前缀。
     * <p>
     * Prefix of every physical key.
     */
    @Builder.Default
    private final String prefix = SandsnakeConstants.DEFAULT_PREFIX;

    @Builder.Default
    private final String router = SandsnakeConstants.DEFAULT_ROUTER_TYPE;

    @Builder.Default
    private final int virtualNodes = SandsnakeConstants.DEFAULT_VIRTUAL_NODES;

    /**
     * 按配置顺序排列的节点，至少一个。
     * <p>
     * Nodes in configuration order, at least one.
     */
    private final List<ResolvedHostConfig> hosts;
}
