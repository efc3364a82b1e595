package io.pagekeys.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class PageKeysConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "pagekeys-settings.json";
    public static final String DELETED_DIR = "__deleted__";
    public static final int DEFAULT_QUEUE_CAPACITY = 10;

    private final Path rootDir;

    public PageKeysConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static PageKeysConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new PageKeysConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path pagesDir() {
        return rootDir.resolve("pages");
    }

    public Path deletedRoot() {
        return pagesDir().resolve(DELETED_DIR);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
