package io.github.vevoly.sandsnake.core.utils;

import org.slf4j.Logger;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * 支持国际化 (i18n) 日志输出的辅助类。
 * <p>
 * 日志代码只使用语言无关的消息 key，消息模板按当前 Locale 从 {@code i18n/sandsnake_messages*.properties} 加载，
 * 参数使用 {@link MessageFormat} 的 {@code {0}} 占位符。每条消息都会带上组件前缀，例如 {@code [SandsnakeFactory] }。
 * <p>
 * A helper for internationalized (i18n) log output.
 * Logging code uses language-neutral message keys; templates are loaded for the current locale from
 * {@code i18n/sandsnake_messages*.properties} and take {@link MessageFormat} {@code {0}} placeholders.
 * Every message carries a component prefix such as {@code [SandsnakeFactory] }.
 *
 * @author vevoly
 */
public class I18nLogger {

    private static final String BUNDLE_BASE_NAME = "i18n.sandsnake_messages";

    private final Logger slf4jLogger;
    private final String prefix;
    private final ResourceBundle resourceBundle;

    public I18nLogger(Logger slf4jLogger, String prefix) {
        this(slf4jLogger, prefix, Locale.getDefault());
    }

    public I18nLogger(Logger slf4jLogger, String prefix, Locale locale) {
        this.slf4jLogger = slf4jLogger;
        this.prefix = prefix == null ? "" : prefix;
        ResourceBundle bundle = null;
        try {
            bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale, I18nLogger.class.getClassLoader());
        } catch (MissingResourceException e) {
            // 找不到资源文件时降级为输出原始 key / Without the bundle, raw keys are logged
            slf4jLogger.warn("Could not find i18n resource bundle '{}', logging raw message keys.", BUNDLE_BASE_NAME);
        }
        this.resourceBundle = bundle;
    }

    public void debug(String key, Object... args) {
        if (slf4jLogger.isDebugEnabled()) {
            slf4jLogger.debug(format(key, args));
        }
    }

    public void info(String key, Object... args) {
        if (slf4jLogger.isInfoEnabled()) {
            slf4jLogger.info(format(key, args));
        }
    }

    public void error(String key, Throwable t, Object... args) {
        if (slf4jLogger.isErrorEnabled()) {
            slf4jLogger.error(format(key, args), t);
        }
    }

    /**
     * 根据给定的 key 和参数格式化最终的日志消息（包含前缀）。
     * <p>
     * Formats the final log message, prefix included.
     */
    String format(String key, Object... args) {
        if (resourceBundle == null) {
            return prefix + key + (args.length == 0 ? "" : " " + Arrays.toString(args));
        }
        try {
            return prefix + MessageFormat.format(resourceBundle.getString(key), args);
        } catch (MissingResourceException e) {
            return prefix + "!!! LOG KEY NOT FOUND: " + key + " !!! " + Arrays.toString(args);
        } catch (IllegalArgumentException e) {
            return prefix + "!!! LOG FORMATTING ERROR for key: " + key + " !!! " + Arrays.toString(args);
        }
    }
}
