package io.github.vevoly.sandsnake.core.properties;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 映射 {@code sandsnake.settings} 配置块：共享默认值与节点列表。
 * <p>
 * Maps the {@code sandsnake.settings} block: shared defaults and the node list.
 *
 * @author vevoly
 */
@Data
public class SandsnakeSettingsProperties {

    /**
     * 所有节点共享的默认配置。节点中未显式指定的属性将使用这里的值。
     * <p>
     * Defaults shared by every node. Properties a node does not set are taken from here.
     */
    private SandsnakeHostProperties defaults = new SandsnakeHostProperties();

    /**
     * 节点列表，顺序决定节点名称 (host-0, host-1, ...) 及取模路由的结果。
     * <p>
     * The node list. Its order determines node names (host-0, host-1, ...) and modulo routing.
     */
    private List<SandsnakeHostProperties> hosts = new ArrayList<>();
}
