package io.pagekeys.runtime;

import io.pagekeys.config.PageKeysConfig;
import io.pagekeys.config.PageKeysSettings;
import io.pagekeys.identifier.IdentifierException;
import io.pagekeys.identifier.IdentifierNormalizer;
import io.pagekeys.jobs.JobQueueCoordinator;
import io.pagekeys.model.PageMeta;
import io.pagekeys.model.StoredPage;
import io.pagekeys.observability.AuditLogger;
import io.pagekeys.rolling.ContentMigrationPipeline;
import io.pagekeys.rolling.MigrationException;
import io.pagekeys.storage.FilePageStore;
import io.pagekeys.storage.PageKeys;
import io.pagekeys.sweep.ShadowingScanJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class PageService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PageService.class);

    private final PageKeysConfig config;
    private final FilePageStore store;
    private final AuditLogger auditLogger;
    private volatile PageKeysSettings settings;
    private volatile ContentMigrationPipeline pipeline;
    private volatile JobQueueCoordinator coordinator;

    public PageService(PageKeysConfig config) {
        this.config = config;
        this.store = new FilePageStore(config);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.settings = PageKeysSettings.defaults();
        this.pipeline = ContentMigrationPipeline.defaults();
    }

    public void init() {
        store.init();
        settings = PageKeysSettings.load(config.settingsFile());
        pipeline = ContentMigrationPipeline.fromSettings(settings);
        coordinator = new JobQueueCoordinator(settings.queueCapacity());
        log.info("Page service ready: pages={} queueCapacity={} migrations={}",
                config.pagesDir(), settings.queueCapacity(), pipeline.migrations().size());
        if (settings.sweepOnStartup()) {
            startShadowingSweep();
        }
    }

    /**
     * Reads a page, preferring its canonical slot, and brings its content up to date.
     * Migrated content is written back to the slot it came from. When migrating or
     * writing back fails, the stored bytes are served unchanged. Nothing is written back when
     * the slot no longer holds the bytes that were read.
     */
    public Optional<byte[]> readPage(String identifier) {
        Optional<StoredPage> found;
        try {
            found = store.readPreferringCanonical(identifier);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read page: " + identifier, e);
        }
        if (found.isEmpty()) {
            return Optional.empty();
        }
        StoredPage page = found.get();
        byte[] migrated;
        try {
            migrated = pipeline.applyMigrations(page.content());
        } catch (MigrationException e) {
            log.warn("Rolling migration failed, serving stored content: identifier={} key={}",
                    identifier, page.key(), e);
            return Optional.of(e.originalContent());
        }
        if (Arrays.equals(page.content(), migrated)) {
            return Optional.of(migrated);
        }
        boolean written;
        try {
            written = store.withPageLocks(List.of(page.key()), () -> writeBackIfUnchanged(page, migrated));
        } catch (IOException e) {
            log.warn("Rolling migration write-back failed, serving stored content: identifier={} key={}",
                    identifier, page.key(), e);
            return Optional.of(page.content());
        }
        if (!written) {
            log.debug("Page changed while migrating, write-back skipped: identifier={} key={}",
                    identifier, page.key());
            return Optional.of(migrated);
        }
        log.debug("Rolling migration applied: identifier={} key={}", page.identifier(), page.key());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("key", page.key());
        details.put("bytes_before", page.content().length);
        details.put("bytes_after", migrated.length);
        auditLogger.log(AuditLogger.AuditEvent.of(
                AuditLogger.ACTION_ROLLING_MIGRATION, page.identifier(), "ok", details));
        return Optional.of(migrated);
    }

    private boolean writeBackIfUnchanged(StoredPage page, byte[] migrated) throws IOException {
        Optional<byte[]> current = store.readRaw(page.key());
        if (current.isEmpty() || !Arrays.equals(current.get(), page.content())) {
            return false;
        }
        store.writeRaw(page.key(), migrated);
        return true;
    }

    /**
     * Stores {@code content} under the canonical key of {@code identifier}, migrated first.
     *
     * @return the canonical identifier the page was stored under
     */
    public String writePage(String identifier, byte[] content) throws IdentifierException, MigrationException {
        String canonical = IdentifierNormalizer.normalize(identifier);
        byte[] migrated = pipeline.applyMigrations(content);
        String key = PageKeys.storageKey(canonical);
        try {
            store.withPageLocks(List.of(key), () -> {
                store.writeRaw(key, migrated);
                store.writeMeta(key, new PageMeta(canonical, System.currentTimeMillis()));
                return key;
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write page: " + canonical, e);
        }
        return canonical;
    }

    /**
     * Soft-deletes the page {@code identifier} resolves to.
     *
     * @return archived file locations, empty when there was no such page
     */
    public List<Path> deletePage(String identifier) {
        try {
            Optional<StoredPage> found = store.readPreferringCanonical(identifier);
            if (found.isEmpty()) {
                return List.of();
            }
            String key = found.get().key();
            return store.withPageLocks(List.of(key),
                    () -> store.readRaw(key).isPresent() ? store.softDelete(key) : List.<Path>of());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete page: " + identifier, e);
        }
    }

    /**
     * Queues a scan of the whole store. Resolutions run on their own queues; use
     * {@link JobQueueCoordinator#awaitIdle(java.time.Duration)} to wait for them.
     */
    public void startShadowingSweep() {
        log.info("Starting shadowing sweep: pages={}", config.pagesDir());
        coordinator().enqueueJob(new ShadowingScanJob(store, coordinator(), auditLogger));
    }

    public JobQueueCoordinator coordinator() {
        JobQueueCoordinator current = coordinator;
        if (current == null) {
            throw new IllegalStateException("Page service is not initialized");
        }
        return current;
    }

    public FilePageStore store() {
        return store;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public PageKeysSettings settings() {
        return settings;
    }

    public ContentMigrationPipeline pipeline() {
        return pipeline;
    }

    public PageKeysConfig config() {
        return config;
    }

    @Override
    public void close() {
        JobQueueCoordinator current = coordinator;
        if (current != null) {
            current.close();
        }
    }
}
