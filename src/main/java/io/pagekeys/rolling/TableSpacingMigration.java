package io.pagekeys.rolling;

import io.pagekeys.model.FrontmatterFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Inserts a blank line before each table header that directly follows a non-blank line.
 * A header on the first non-blank line of the frontmatter is left where it is.
 */
public final class TableSpacingMigration implements ContentMigration {
    @Override
    public Set<FrontmatterFormat> supportedFormats() {
        return Set.of(FrontmatterFormat.TOML);
    }

    @Override
    public boolean appliesTo(byte[] content) {
        Optional<TomlFrontmatter.Parts> parts = TomlFrontmatter.split(content);
        if (parts.isEmpty()) {
            return false;
        }
        String[] lines = parts.get().frontmatter().split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (needsBlankLine(lines, i)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public byte[] apply(byte[] content) {
        Optional<TomlFrontmatter.Parts> parts = TomlFrontmatter.split(content);
        if (parts.isEmpty()) {
            return content;
        }
        String[] lines = parts.get().frontmatter().split("\n", -1);
        List<String> out = new ArrayList<>(lines.length + 4);
        for (int i = 0; i < lines.length; i++) {
            if (needsBlankLine(lines, i)) {
                out.add("");
            }
            out.add(lines[i]);
        }
        return TomlFrontmatter.join(String.join("\n", out), parts.get().body());
    }

    private static boolean needsBlankLine(String[] lines, int index) {
        return index > 0 && TomlFrontmatter.isTableHeader(lines[index]) && !lines[index - 1].trim().isEmpty();
    }
}
