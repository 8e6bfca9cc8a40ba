package io.github.vevoly.sandsnake.api.utils;

import io.github.vevoly.sandsnake.api.constants.SandsnakeConstants;
import io.github.vevoly.sandsnake.api.exception.SandsnakeValidationException;
import lombok.Getter;

/**
 * 物理 Key 的生成规则。
 * <p>
 * 同一个 (object, index) 组合总是得到同一个物理 Key，因此在节点配置不变时也总是路由到同一个节点。
 * 三类 Key 的格式互不冲突：
 * <ul>
 *     <li>索引: {@code {prefix}obj:{objectId}:index:{indexName}}</li>
 *     <li>对象的索引集合: {@code {prefix}{objectId}:indexes}</li>
 *     <li>对象的 marker 哈希表: {@code {prefix}obj:{objectId}:markers}</li>
 * </ul>
 * <p>
 * Derivation rules for physical keys.
 * The same (object, index) pair always yields the same physical key, so it always routes to the same node
 * for a fixed node configuration. The three key families never collide.
 *
 * @author vevoly
 */
@Getter
public final class IndexKeys {

    private final String prefix;

    public IndexKeys(String prefix) {
        this.prefix = prefix == null ? SandsnakeConstants.DEFAULT_PREFIX : prefix;
    }

    /**
     * 某个对象的某个索引所在的 ZSet Key。
     * <p>
     * The ZSet key holding one index of an object.
     */
    public String indexKey(String objectId, String indexName) {
        return prefix + "obj:" + requireText(objectId, "objectId") + ":index:" + requireText(indexName, "indexName");
    }

    /**
     * 记录对象拥有哪些索引的 Set Key。
     * <p>
     * The Set key recording which indexes an object has.
     */
    public String collectionKey(String objectId) {
        return prefix + requireText(objectId, "objectId") + ":indexes";
    }

    /**
     * 保存对象所有 marker 的 Hash Key。
     * <p>
     * The Hash key holding all markers of an object.
     */
    public String markersKey(String objectId) {
        return prefix + "obj:" + requireText(objectId, "objectId") + ":markers";
    }

    /**
     * marker 在哈希表中的字段名。
     * <p>
     * The hash field of a marker.
     *
     * @param indexKey   索引的物理 Key / the physical key of the index
     * @param markerName marker 名称，null 时使用默认名称 / marker name, the default name when null
     */
    public String markerField(String indexKey, String markerName) {
        String name = markerName == null ? SandsnakeConstants.DEFAULT_MARKER_NAME : markerName;
        return markerFieldPrefix(indexKey) + name;
    }

    /**
     * 某个索引所有 marker 字段的公共前缀。索引 Key 带长度前缀，
     * 因此一个索引的前缀不会匹配到名称以它开头的其他索引的字段。
     * <p>
     * The common prefix of every marker field of one index. The index key is length-prefixed,
     * so the prefix of one index never matches the fields of another index whose name starts with it.
     */
    public String markerFieldPrefix(String indexKey) {
        return "index:" + indexKey.length() + ":" + indexKey + ":name:";
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new SandsnakeValidationException(name + " must not be blank");
        }
        return value;
    }
}
