package io.pagekeys.rolling;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagekeys.model.FrontmatterFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Folds dotted keys into table sections.
 *
 * <p>{@code inventory.container = "X"} next to an existing {@code [inventory]} table
 * defines the same table twice, which strict TOML parsers reject. This migration moves
 * every such assignment under a {@code [inventory]} header, merged ahead of the lines
 * the table already had. Keys that already appear in the table keep their existing
 * value. Tables are written in sorted order after the lines that belong to no table.
 *
 * <p>Frontmatter with array tables, multi-line strings, values that span lines, or table
 * headers it cannot read is left alone. The rebuilt frontmatter must parse to the same
 * tree as the original whenever the original parses.
 */
public final class DottedKeyTableMigration implements ContentMigration {
    private static final Pattern TABLE_HEADER = Pattern.compile("^\\[\\s*([A-Za-z0-9_\\-.]+)\\s*]\\s*(#.*)?$");
    private static final Pattern DOTTED_ASSIGNMENT = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)+)\\s*=\\s*(.+)$");
    private static final Pattern BARE_ASSIGNMENT = Pattern.compile("^([A-Za-z0-9_-]+)\\s*=");

    @Override
    public Set<FrontmatterFormat> supportedFormats() {
        return Set.of(FrontmatterFormat.TOML);
    }

    @Override
    public boolean appliesTo(byte[] content) {
        return TomlFrontmatter.split(content)
                .flatMap(parts -> layout(parts.frontmatter()))
                .map(Layout::hasGroupableKeys)
                .orElse(false);
    }

    @Override
    public byte[] apply(byte[] content) throws MigrationException {
        Optional<TomlFrontmatter.Parts> parts = TomlFrontmatter.split(content);
        if (parts.isEmpty()) {
            return content;
        }
        Optional<Layout> layout = layout(parts.get().frontmatter());
        if (layout.isEmpty() || !layout.get().hasGroupableKeys()) {
            return content;
        }
        String rebuilt = String.join("\n", layout.get().render());
        checkSameTree(parts.get().frontmatter(), rebuilt, content);
        return (TomlFrontmatter.DELIMITER + "\n" + rebuilt + "\n" + TomlFrontmatter.DELIMITER + "\n"
                + parts.get().body()).getBytes(StandardCharsets.UTF_8);
    }

    private static void checkSameTree(String original, String rebuilt, byte[] content) throws MigrationException {
        JsonNode after;
        try {
            after = TomlFrontmatter.parse(rebuilt);
        } catch (IOException e) {
            throw new MigrationException("dotted key grouping produced invalid TOML", content, e);
        }
        JsonNode before;
        try {
            before = TomlFrontmatter.parse(original);
        } catch (IOException e) {
            // Duplicate definitions are what this migration repairs.
            return;
        }
        if (!before.equals(after)) {
            throw new MigrationException("dotted key grouping changed frontmatter values", content);
        }
    }

    private static Optional<Layout> layout(String frontmatter) {
        if (frontmatter.contains("\"\"\"") || frontmatter.contains("'''")) {
            return Optional.empty();
        }
        String[] lines = frontmatter.split("\n");
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.startsWith("[[") || !closesOnSameLine(trimmed)) {
                return Optional.empty();
            }
            if (trimmed.startsWith("[") && !TABLE_HEADER.matcher(trimmed).matches()) {
                return Optional.empty();
            }
        }

        Set<String> scalarKeys = new HashSet<>();
        String table = "";
        for (String line : lines) {
            String trimmed = line.trim();
            Matcher header = TABLE_HEADER.matcher(trimmed);
            if (header.matches()) {
                table = header.group(1);
                continue;
            }
            Matcher bare = BARE_ASSIGNMENT.matcher(trimmed);
            if (bare.find()) {
                scalarKeys.add(table.isEmpty() ? bare.group(1) : table + "." + bare.group(1));
            }
        }

        Layout layout = new Layout();
        table = "";
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher header = TABLE_HEADER.matcher(trimmed);
            if (header.matches()) {
                table = header.group(1);
                layout.tableLines.computeIfAbsent(table, key -> new ArrayList<>());
                layout.headers.putIfAbsent(table, trimmed);
                continue;
            }
            Matcher dotted = DOTTED_ASSIGNMENT.matcher(trimmed);
            if (dotted.matches()) {
                String fullKey = table.isEmpty() ? dotted.group(1) : table + "." + dotted.group(1);
                int split = fullKey.lastIndexOf('.');
                String prefix = fullKey.substring(0, split);
                if (!scalarKeys.contains(prefix) && !prefixIsScalar(prefix, scalarKeys)) {
                    layout.dotted.computeIfAbsent(prefix, key -> new ArrayList<>())
                            .add(new Assignment(fullKey.substring(split + 1), dotted.group(2).trim()));
                    continue;
                }
            }
            layout.lineFor(table).add(trimmed);
        }
        return Optional.of(layout);
    }

    /** False when a bracket, brace or string opened on {@code line} is still open at its end. */
    static boolean closesOnSameLine(String line) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\' && quote == '"') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '#') {
                break;
            }
            switch (ch) {
                case '"', '\'' -> quote = ch;
                case '[', '{' -> depth++;
                case ']', '}' -> depth--;
                default -> {
                }
            }
        }
        return depth == 0 && quote == 0;
    }

    private static boolean prefixIsScalar(String prefix, Set<String> scalarKeys) {
        int dot = prefix.indexOf('.');
        while (dot >= 0) {
            if (scalarKeys.contains(prefix.substring(0, dot))) {
                return true;
            }
            dot = prefix.indexOf('.', dot + 1);
        }
        return false;
    }

    private record Assignment(String key, String value) {
    }

    private static final class Layout {
        private final List<String> ungrouped = new ArrayList<>();
        private final Map<String, List<String>> tableLines = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, List<Assignment>> dotted = new LinkedHashMap<>();

        private List<String> lineFor(String table) {
            return table.isEmpty() ? ungrouped : tableLines.computeIfAbsent(table, key -> new ArrayList<>());
        }

        private boolean hasGroupableKeys() {
            return !dotted.isEmpty();
        }

        private List<String> render() {
            List<String> out = new ArrayList<>(ungrouped);
            Set<String> tables = new TreeSet<>(tableLines.keySet());
            tables.addAll(dotted.keySet());
            for (String table : tables) {
                List<String> existing = tableLines.getOrDefault(table, List.of());
                Set<String> existingKeys = new HashSet<>();
                for (String line : existing) {
                    Matcher bare = BARE_ASSIGNMENT.matcher(line);
                    if (bare.find()) {
                        existingKeys.add(bare.group(1));
                    }
                }
                out.add(headers.getOrDefault(table, "[" + table + "]"));
                for (Assignment assignment : dotted.getOrDefault(table, List.of())) {
                    if (!existingKeys.contains(assignment.key())) {
                        out.add(assignment.key() + " = " + assignment.value());
                    }
                }
                out.addAll(existing);
            }
            return out;
        }
    }
}
