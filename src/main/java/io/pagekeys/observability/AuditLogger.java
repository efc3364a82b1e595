package io.pagekeys.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagekeys.util.Hashes;
import io.pagekeys.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of key reconciliations and sweeps.
 *
 * <p>Every row carries the hash of the row before it, so truncation or in-place edits
 * break the chain and show up in {@link #verifyChain()}.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    public static final String ACTION_ROLLING_MIGRATION = "page.migrate.rolling";
    public static final String ACTION_SHADOWING_MIGRATION = "page.migrate.shadowing";
    public static final String ACTION_SWEEP_SCAN = "sweep.scan";

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details() == null ? Map.of() : event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashes.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every row hash and checks each {@code prev_hash} link.
     *
     * @return {@code true} when the file is intact
     */
    public synchronized boolean verifyChain() {
        try {
            String expectedPrevious = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrevious.equals(row.get("prev_hash"))
                        || !Hashes.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                    return false;
                }
                expectedPrevious = String.valueOf(hash);
            }
            return true;
        } catch (IOException e) {
            log.warn("Audit log could not be read for verification: {}", auditFile, e);
            return false;
        }
    }

    public synchronized List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8).stream()
                    .filter(line -> !line.isBlank())
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log tail unreadable, starting a new chain: {}", auditFile, e);
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
