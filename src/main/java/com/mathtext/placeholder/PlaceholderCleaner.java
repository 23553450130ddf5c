package com.mathtext.placeholder;

import com.mathtext.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 清理上游缓存替换失败后泄漏到正文中的占位符。
 */
public class PlaceholderCleaner {
    private static final Logger logger = LoggerFactory.getLogger(PlaceholderCleaner.class);
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(Constants.PLACEHOLDER_REGEX);

    private final String marker;

    public PlaceholderCleaner() {
        this(Constants.DEFAULT_PLACEHOLDER_MARKER);
    }

    public PlaceholderCleaner(String marker) {
        this.marker = marker == null ? Constants.DEFAULT_PLACEHOLDER_MARKER : marker;
    }

    public String getMarker() {
        return marker;
    }

    /**
     * 将所有占位符替换为标记，null 返回空串，其余文本保持不变。
     */
    public String clean(String text) {
        if (text == null) {
            return "";
        }
        if (!text.contains(Constants.PLACEHOLDER_INFIX)) {
            return text;
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        StringBuilder builder = new StringBuilder(text.length());
        int replaced = 0;
        while (matcher.find()) {
            matcher.appendReplacement(builder, Matcher.quoteReplacement(marker));
            replaced++;
        }
        matcher.appendTail(builder);

        if (replaced > 0) {
            logger.debug("已替换{}个泄漏占位符", replaced);
        }
        return builder.toString();
    }

    /**
     * 统计文本中的占位符数量。
     */
    public int countLeaks(String text) {
        if (text == null || !text.contains(Constants.PLACEHOLDER_INFIX)) {
            return 0;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public boolean hasLeaks(String text) {
        return countLeaks(text) > 0;
    }
}
