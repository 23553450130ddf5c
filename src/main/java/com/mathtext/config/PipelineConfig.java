package com.mathtext.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * 流水线运行时配置
 *
 * 支持从CLI参数或 properties 文件注入，覆盖Constants默认值
 */
public class PipelineConfig {
    public static final String KEY_PLACEHOLDER_MARKER = "mtp.placeholder.marker";
    public static final String KEY_LENIENT_DOLLAR = "mtp.segment.lenient-dollar";
    public static final String KEY_MERGE_ADJACENT = "mtp.segment.merge-adjacent";
    public static final String KEY_FOLD_NEWLINES = "mtp.segment.fold-newlines";
    public static final String KEY_PLAIN_MAX_LENGTH = "mtp.plain.max-length";

    private String placeholderMarker = Constants.DEFAULT_PLACEHOLDER_MARKER;
    private boolean lenientDollar = false;
    private boolean mergeAdjacentMath = true;
    private boolean foldNewlinesInMath = true;
    private int plainTextMaxLength = Constants.UNLIMITED_LENGTH;

    public String getPlaceholderMarker() {
        return placeholderMarker;
    }

    public void setPlaceholderMarker(String placeholderMarker) {
        this.placeholderMarker = placeholderMarker;
    }

    public boolean isLenientDollar() {
        return lenientDollar;
    }

    public void setLenientDollar(boolean lenientDollar) {
        this.lenientDollar = lenientDollar;
    }

    public boolean isMergeAdjacentMath() {
        return mergeAdjacentMath;
    }

    public void setMergeAdjacentMath(boolean mergeAdjacentMath) {
        this.mergeAdjacentMath = mergeAdjacentMath;
    }

    public boolean isFoldNewlinesInMath() {
        return foldNewlinesInMath;
    }

    public void setFoldNewlinesInMath(boolean foldNewlinesInMath) {
        this.foldNewlinesInMath = foldNewlinesInMath;
    }

    public int getPlainTextMaxLength() {
        return plainTextMaxLength;
    }

    public void setPlainTextMaxLength(int plainTextMaxLength) {
        this.plainTextMaxLength = plainTextMaxLength;
    }

    /**
     * 使用默认配置创建实例
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    /**
     * 从 properties 读取配置，未出现的键保留默认值，非法值抛出 PipelineConfigException。
     */
    public static PipelineConfig fromProperties(Properties properties) {
        PipelineConfig config = defaults();
        if (properties == null) {
            return config;
        }

        String marker = properties.getProperty(KEY_PLACEHOLDER_MARKER);
        if (marker != null) {
            config.setPlaceholderMarker(marker);
        }
        config.setLenientDollar(readBoolean(properties, KEY_LENIENT_DOLLAR, config.isLenientDollar()));
        config.setMergeAdjacentMath(readBoolean(properties, KEY_MERGE_ADJACENT, config.isMergeAdjacentMath()));
        config.setFoldNewlinesInMath(readBoolean(properties, KEY_FOLD_NEWLINES, config.isFoldNewlinesInMath()));
        config.setPlainTextMaxLength(readLength(properties, KEY_PLAIN_MAX_LENGTH, config.getPlainTextMaxLength()));
        return config;
    }

    /**
     * 读取 UTF-8 编码的 properties 文件。
     */
    public static PipelineConfig load(Path path) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    private static boolean readBoolean(Properties properties, String key, boolean defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new PipelineConfigException("expected true or false", key, raw);
    }

    private static int readLength(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(raw.trim());
        } catch (NumberFormatException exception) {
            throw new PipelineConfigException("expected a non-negative integer", key, raw);
        }
        if (parsed < 0) {
            throw new PipelineConfigException("expected a non-negative integer", key, raw);
        }
        return parsed;
    }
}
