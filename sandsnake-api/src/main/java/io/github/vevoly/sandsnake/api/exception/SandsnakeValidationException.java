package io.github.vevoly.sandsnake.api.exception;

/**
 * 调用参数非法，例如空的索引名称列表、缺失的 marker。
 * <p>
 * Invalid call arguments, e.g. an empty index name list or a missing marker.
 *
 * @author vevoly
 */
public class SandsnakeValidationException extends SandsnakeException {

    public SandsnakeValidationException(String message) {
        super(message);
    }
}
