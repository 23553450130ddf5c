package com.mathtext.config;

public class PipelineConfigException extends RuntimeException {
    private final String key;
    private final String value;

    public PipelineConfigException(String message, String key, String value) {
        super(buildMessage(message, key, value));
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    private static String buildMessage(String message, String key, String value) {
        return "Invalid config value for " + key + ": '" + value + "' (" + message + ")";
    }
}
