package io.pagekeys.sweep;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagekeys.jobs.Job;
import io.pagekeys.model.PageMeta;
import io.pagekeys.observability.AuditLogger;
import io.pagekeys.rolling.TomlFrontmatter;
import io.pagekeys.storage.PageKeys;
import io.pagekeys.storage.PageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves one page from its legacy key to its canonical key.
 *
 * <p>When both keys hold content the longer copy is kept (ties keep the canonical
 * copy). Every copy that stops being live is soft-deleted before the canonical slot is
 * written, so a crash between steps never loses content; at worst the page has to be
 * restored from the deleted area. Both slots stay locked from the first read to the last
 * write.
 */
public final class ShadowingMigrationJob implements Job {
    public static final String NAME_PREFIX = "shadowing-migrate:";

    private static final Logger log = LoggerFactory.getLogger(ShadowingMigrationJob.class);
    private static final List<String> IDENTIFIER_FIELD = List.of("identifier");

    private final PageStore store;
    private final SweepTarget target;
    private final AuditLogger auditLogger;
    private final String canonicalKey;

    public ShadowingMigrationJob(PageStore store, SweepTarget target, AuditLogger auditLogger) {
        this.store = Objects.requireNonNull(store, "store");
        this.target = Objects.requireNonNull(target, "target");
        this.auditLogger = auditLogger;
        this.canonicalKey = PageKeys.storageKey(target.canonicalIdentifier());
        if (canonicalKey.equals(target.legacyKey())) {
            throw new IllegalArgumentException("legacy and canonical identifiers share key " + canonicalKey);
        }
    }

    public SweepTarget target() {
        return target;
    }

    @Override
    public String name() {
        return NAME_PREFIX + target.canonicalIdentifier();
    }

    @Override
    public void execute() throws IOException {
        Outcome outcome = store.withPageLocks(List.of(target.legacyKey(), canonicalKey), this::resolve);

        String winner = outcome.legacyWins() ? "legacy" : "canonical";
        log.info("Resolved shadowed page: legacy={} canonical={} winner={} archived={}",
                target.legacyIdentifier(), target.canonicalIdentifier(), winner, outcome.archived().size());
        if (auditLogger != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("legacy_identifier", target.legacyIdentifier());
            details.put("legacy_key", target.legacyKey());
            details.put("canonical_key", canonicalKey);
            details.put("winner", winner);
            details.put("conflict", outcome.conflict());
            details.put("archived", outcome.archived().stream().map(Path::toString).toList());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    AuditLogger.ACTION_SHADOWING_MIGRATION, target.canonicalIdentifier(), "ok", details));
        }
    }

    // Runs under the page locks of both slots, so a live write to either waits until the
    // canonical slot holds the winner.
    private Outcome resolve() throws IOException {
        byte[] legacy = store.readRaw(target.legacyKey())
                .filter(content -> content.length > 0)
                .orElseThrow(() -> new IllegalStateException(
                        "legacy page '" + target.legacyIdentifier() + "' is missing or empty"));
        ReconciliationCandidate candidate = new ReconciliationCandidate(
                target.legacyIdentifier(),
                target.canonicalIdentifier(),
                legacy,
                store.readRaw(canonicalKey)
        );
        boolean legacyWins = candidate.legacyWins();

        List<Path> archived = new ArrayList<>(store.softDelete(target.legacyKey()));
        if (legacyWins && candidate.canonicalContent().isPresent()) {
            archived.addAll(store.softDelete(canonicalKey));
        }

        byte[] content = withCanonicalIdentifier(candidate.winningContent(), target.canonicalIdentifier());
        store.writeRaw(canonicalKey, content);
        store.writeMeta(canonicalKey, new PageMeta(target.canonicalIdentifier(), System.currentTimeMillis()));
        return new Outcome(legacyWins, candidate.canonicalContent().isPresent(), archived);
    }

    private record Outcome(boolean legacyWins, boolean conflict, List<Path> archived) {
    }

    static byte[] withCanonicalIdentifier(byte[] content, String canonical) {
        Optional<TomlFrontmatter.Parts> parts = TomlFrontmatter.split(content);
        if (parts.isEmpty()) {
            return content;
        }
        JsonNode root;
        try {
            root = TomlFrontmatter.parse(parts.get().frontmatter());
        } catch (IOException e) {
            log.debug("Frontmatter is not valid TOML, identifier field left as is: {}", canonical, e);
            return content;
        }
        Optional<String> declared = TomlFrontmatter.textAt(root, IDENTIFIER_FIELD);
        if (declared.isEmpty() || declared.get().equals(canonical)) {
            return content;
        }
        return TomlFrontmatter.replaceStringValue(parts.get().frontmatter(), IDENTIFIER_FIELD, canonical)
                .map(frontmatter -> TomlFrontmatter.join(frontmatter, parts.get().body()))
                .orElse(content);
    }
}
