package io.pagekeys.sweep;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagekeys.identifier.IdentifierNormalizer;
import io.pagekeys.jobs.Job;
import io.pagekeys.jobs.JobQueueCoordinator;
import io.pagekeys.jobs.JobRejectedException;
import io.pagekeys.model.PageMeta;
import io.pagekeys.observability.AuditLogger;
import io.pagekeys.rolling.TomlFrontmatter;
import io.pagekeys.storage.PageKeys;
import io.pagekeys.storage.PageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Walks every stored key and enqueues a {@link ShadowingMigrationJob} for each page whose
 * declared identifier does not live under its canonical key.
 *
 * <p>The declared identifier is taken from the metadata sidecar, then from the TOML
 * {@code identifier} field, then from the key itself.
 */
public final class ShadowingScanJob implements Job {
    public static final String NAME = "shadowing-scan";

    private static final Logger log = LoggerFactory.getLogger(ShadowingScanJob.class);
    private static final List<String> IDENTIFIER_FIELD = List.of("identifier");

    private final PageStore store;
    private final JobQueueCoordinator coordinator;
    private final AuditLogger auditLogger;

    public ShadowingScanJob(PageStore store, JobQueueCoordinator coordinator, AuditLogger auditLogger) {
        this.store = Objects.requireNonNull(store, "store");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.auditLogger = auditLogger;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void execute() throws IOException {
        List<String> keys = store.listKeys();
        List<SweepTarget> targets = findTargets(keys);
        List<JobRejectedException> rejected = new ArrayList<>();
        for (SweepTarget target : targets) {
            try {
                coordinator.enqueueJob(new ShadowingMigrationJob(store, target, auditLogger));
            } catch (JobRejectedException e) {
                log.warn("Shadowing migration rejected: legacy={} canonical={}",
                        target.legacyIdentifier(), target.canonicalIdentifier());
                rejected.add(e);
            }
        }
        log.info("Shadowing scan finished: keys={} targets={} rejected={}", keys.size(), targets.size(), rejected.size());
        if (auditLogger != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("keys", keys.size());
            details.put("targets", targets.size());
            details.put("rejected", rejected.size());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    AuditLogger.ACTION_SWEEP_SCAN, NAME, rejected.isEmpty() ? "ok" : "partial", details));
        }
        if (!rejected.isEmpty()) {
            IllegalStateException failure = new IllegalStateException(
                    rejected.size() + " of " + targets.size() + " shadowing migrations could not be enqueued",
                    rejected.get(0));
            for (int i = 1; i < rejected.size(); i++) {
                failure.addSuppressed(rejected.get(i));
            }
            throw failure;
        }
    }

    /** The migrations this scan would enqueue for the given keys, in key order. */
    public List<SweepTarget> findTargets(List<String> keys) throws IOException {
        List<SweepTarget> targets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String key : keys) {
            Optional<String> declared = declaredIdentifier(key);
            if (declared.isEmpty() || !seen.add(declared.get())) {
                continue;
            }
            String legacy = declared.get();
            Optional<String> canonical = IdentifierNormalizer.tryNormalize(legacy);
            if (canonical.isEmpty()) {
                log.debug("Skipping page with unusable identifier: key={} identifier={}", key, legacy);
                continue;
            }
            if (canonical.get().equals(legacy)) {
                continue;
            }
            String canonicalKey = PageKeys.storageKey(canonical.get());
            if (canonicalKey.equals(PageKeys.storageKey(legacy)) || canonicalKey.equals(key)) {
                continue;
            }
            log.debug("Shadowed page found: key={} legacy={} canonical={}", key, legacy, canonical.get());
            targets.add(new SweepTarget(legacy, key, canonical.get()));
        }
        return targets;
    }

    private Optional<String> declaredIdentifier(String key) throws IOException {
        Optional<String> fromMeta = readMetaQuietly(key).map(PageMeta::identifier).filter(id -> !id.isEmpty());
        if (fromMeta.isPresent()) {
            return fromMeta;
        }
        Optional<byte[]> content = store.readRaw(key);
        if (content.isPresent()) {
            Optional<TomlFrontmatter.Parts> parts = TomlFrontmatter.split(content.get());
            if (parts.isPresent()) {
                try {
                    JsonNode root = TomlFrontmatter.parse(parts.get().frontmatter());
                    Optional<String> fromFrontmatter = TomlFrontmatter.textAt(root, IDENTIFIER_FIELD)
                            .filter(id -> !id.isEmpty());
                    if (fromFrontmatter.isPresent()) {
                        return fromFrontmatter;
                    }
                } catch (IOException e) {
                    log.debug("Unparseable frontmatter, falling back to key: key={}", key, e);
                }
            }
        }
        return PageKeys.decode(key).filter(id -> !id.isEmpty());
    }

    private Optional<PageMeta> readMetaQuietly(String key) {
        try {
            return store.readMeta(key);
        } catch (IOException e) {
            log.warn("Unreadable page metadata, ignoring sidecar: key={}", key, e);
            return Optional.empty();
        }
    }
}
