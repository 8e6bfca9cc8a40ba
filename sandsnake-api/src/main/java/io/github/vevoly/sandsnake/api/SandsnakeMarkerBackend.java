package io.github.vevoly.sandsnake.api;

import java.util.List;

/**
 * 带读取 marker 的后端。
 * <p>
 * 每个索引可以保存多个命名 marker（默认名称 {@code _ssdefault}），记录调用方已经读到的位置（时间戳分数）。
 * 向后读取 ({@code after == true}) 会把 marker 移动到最后一个返回成员的分数；向前读取不会改变 marker。
 * <p>
 * A backend with read markers.
 * Each index can keep several named markers (default name {@code _ssdefault}) recording how far a reader got (a timestamp score).
 * Reading forward ({@code after == true}) moves the marker to the score of the last returned member;
 * reading backward never moves it.
 *
 * @author vevoly
 */
public interface SandsnakeMarkerBackend extends SandsnakeBackend {

    /**
     * 与 {@link #getItems(String, String, Double, boolean, Integer)} 相同，但更新指定名称的 marker。
     * <p>
     * Same as {@link #getItems(String, String, Double, boolean, Integer)}, updating the named marker.
     */
    List<String> getItems(String objectId, String indexName, Double marker, boolean after, Integer limit, String markerName);

    /**
     * 从已保存的 marker 开始向后读取，并移动 marker。
     * <p>
     * Reads forward from the stored marker and moves it.
     */
    List<String> getItemsAfterMarker(String objectId, String indexName, Integer limit, String markerName);

    /**
     * 已保存的 marker，不存在时返回 0。
     * <p>
     * The stored marker, 0 when none exists.
     */
    double getMarker(String objectId, String indexName, String markerName);

    default double getDefaultMarker(String objectId, String indexName) {
        return getMarker(objectId, indexName, null);
    }

    void setMarker(String objectId, String indexName, String markerName, double marker);
}
