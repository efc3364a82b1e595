package io.pagekeys.cli;

import io.pagekeys.config.PageKeysConfig;
import io.pagekeys.identifier.IdentifierException;
import io.pagekeys.identifier.IdentifierNormalizer;
import io.pagekeys.model.JobProgress;
import io.pagekeys.rolling.MigrationException;
import io.pagekeys.runtime.PageService;
import io.pagekeys.storage.PageKeys;
import io.pagekeys.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "pagekeys",
        mixinStandardHelpOptions = true,
        description = "Page key normalization and migration CLI",
        subcommands = {
                PageKeysCommand.InitCommand.class,
                PageKeysCommand.NormalizeCommand.class,
                PageKeysCommand.ReadCommand.class,
                PageKeysCommand.WriteCommand.class,
                PageKeysCommand.DeleteCommand.class,
                PageKeysCommand.SweepCommand.class,
                PageKeysCommand.KeysCommand.class,
                PageKeysCommand.AuditVerifyCommand.class
        }
)
public final class PageKeysCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = PageKeysConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | normalize | read | write | delete | sweep | keys | audit-verify");
    }

    PageService service() {
        PageService service = new PageService(PageKeysConfig.fromRoot(root));
        service.init();
        return service;
    }

    @Command(name = "init", description = "Create the page and audit directories")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Override
        public Integer call() {
            try (PageService service = parent.service()) {
                System.out.println("Initialized page store at: " + service.config().pagesDir());
            }
            return 0;
        }
    }

    @Command(name = "normalize", description = "Print the canonical form of each identifier")
    static final class NormalizeCommand implements Callable<Integer> {
        @Parameters(arity = "1..*", description = "Raw identifiers")
        List<String> identifiers;

        @Override
        public Integer call() {
            List<Map<String, Object>> results = new ArrayList<>(identifiers.size());
            boolean anyRejected = false;
            for (String raw : identifiers) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("input", raw);
                try {
                    String canonical = IdentifierNormalizer.normalize(raw);
                    row.put("canonical", canonical);
                    row.put("storage_key", PageKeys.storageKey(canonical));
                } catch (IdentifierException e) {
                    anyRejected = true;
                    row.put("error", e.kind().name());
                    row.put("message", e.getMessage());
                }
                results.add(row);
            }
            System.out.println(Jsons.toJson(results));
            return anyRejected ? 1 : 0;
        }
    }

    @Command(name = "read", description = "Print a page, applying pending content migrations")
    static final class ReadCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Parameters(index = "0", description = "Page identifier")
        String identifier;

        @Override
        public Integer call() {
            try (PageService service = parent.service()) {
                Optional<byte[]> content = service.readPage(identifier);
                if (content.isEmpty()) {
                    System.out.println("{\"error\":\"page not found\"}");
                    return 1;
                }
                System.out.print(new String(content.get(), StandardCharsets.UTF_8));
                return 0;
            }
        }
    }

    @Command(name = "write", description = "Store a page under its canonical identifier")
    static final class WriteCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Parameters(index = "0", description = "Page identifier")
        String identifier;

        @Option(names = {"--file"}, required = true, description = "File holding the page content")
        Path file;

        @Override
        public Integer call() {
            byte[] content;
            try {
                content = Files.readAllBytes(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read page file: " + file, e);
            }
            try (PageService service = parent.service()) {
                String canonical = service.writePage(identifier, content);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("identifier", canonical);
                out.put("storage_key", PageKeys.storageKey(canonical));
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (IdentifierException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.kind().name(), "message", e.getMessage())));
                return 1;
            } catch (MigrationException e) {
                System.out.println(Jsons.toJson(Map.of("error", "MIGRATION_FAILED", "message", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "delete", description = "Move a page into the deleted area")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Parameters(index = "0", description = "Page identifier")
        String identifier;

        @Override
        public Integer call() {
            try (PageService service = parent.service()) {
                List<Path> archived = service.deletePage(identifier);
                if (archived.isEmpty()) {
                    System.out.println("{\"error\":\"page not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(Map.of("archived", archived.stream().map(Path::toString).toList())));
                return 0;
            }
        }
    }

    @Command(name = "sweep", description = "Move pages stored under legacy keys to their canonical keys")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Option(names = {"--timeout-ms"}, defaultValue = "60000", description = "How long to wait for queued migrations")
        long timeoutMs;

        @Override
        public Integer call() throws InterruptedException {
            try (PageService service = parent.service()) {
                service.startShadowingSweep();
                boolean drained = service.coordinator().awaitIdle(Duration.ofMillis(Math.max(1L, timeoutMs)));
                JobProgress progress = service.coordinator().getJobProgress();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("drained", drained);
                out.put("progress", progress);
                System.out.println(Jsons.toJson(out));
                return drained ? 0 : 2;
            }
        }
    }

    @Command(name = "keys", description = "List storage keys and the identifiers they decode to")
    static final class KeysCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Override
        public Integer call() throws IOException {
            try (PageService service = parent.service()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                for (String key : service.store().listKeys()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    String decoded = PageKeys.decode(key).orElse("");
                    row.put("key", key);
                    row.put("identifier", decoded);
                    row.put("canonical", IdentifierNormalizer.isCanonical(decoded));
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PageKeysCommand parent;

        @Override
        public Integer call() {
            try (PageService service = parent.service()) {
                boolean intact = service.auditLogger().verifyChain();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("intact", intact);
                out.put("head", service.auditLogger().currentHash());
                System.out.println(Jsons.toJson(out));
                return intact ? 0 : 1;
            }
        }
    }
}
