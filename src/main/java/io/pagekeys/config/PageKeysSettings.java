package io.pagekeys.config;

import io.pagekeys.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code pagekeys-settings.json} under the root directory.
 *
 * <p>Every field of the file is optional; missing or out-of-range values fall
 * back to {@link #defaults()}.
 */
public record PageKeysSettings(
        int queueCapacity,
        boolean mungeIdentifierFields,
        boolean convertYamlFrontmatter,
        boolean sweepOnStartup
) {
    public static PageKeysSettings defaults() {
        return new PageKeysSettings(PageKeysConfig.DEFAULT_QUEUE_CAPACITY, false, false, false);
    }

    public static PageKeysSettings load(Path file) {
        if (!Files.isRegularFile(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load settings: " + file, e);
        }
    }

    static PageKeysSettings fromFile(SettingsFile file, PageKeysSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new PageKeysSettings(
                sanitizeInt(file.queueCapacity(), defaults.queueCapacity(), 1),
                sanitizeBoolean(file.mungeIdentifierFields(), defaults.mungeIdentifierFields()),
                sanitizeBoolean(file.convertYamlFrontmatter(), defaults.convertYamlFrontmatter()),
                sanitizeBoolean(file.sweepOnStartup(), defaults.sweepOnStartup())
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    record SettingsFile(
            Integer queueCapacity,
            Boolean mungeIdentifierFields,
            Boolean convertYamlFrontmatter,
            Boolean sweepOnStartup
    ) {
    }
}
