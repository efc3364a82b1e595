package io.pagekeys.model;

import java.nio.charset.StandardCharsets;

public enum FrontmatterFormat {
    YAML("---"),
    TOML("+++"),
    JSON("{"),
    UNKNOWN("");

    public static final int MIN_CONTENT_LENGTH = 3;

    private final String marker;

    FrontmatterFormat(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    public static FrontmatterFormat detect(byte[] content) {
        if (content == null || content.length < MIN_CONTENT_LENGTH) {
            return UNKNOWN;
        }
        String prefix = new String(content, 0, MIN_CONTENT_LENGTH, StandardCharsets.UTF_8);
        for (FrontmatterFormat format : values()) {
            if (format != UNKNOWN && prefix.startsWith(format.marker)) {
                return format;
            }
        }
        return UNKNOWN;
    }
}
