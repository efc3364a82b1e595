package io.pagekeys.rolling;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagekeys.identifier.IdentifierException;
import io.pagekeys.identifier.IdentifierNormalizer;
import io.pagekeys.model.FrontmatterFormat;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites one string field of TOML frontmatter to its normalized identifier form.
 *
 * <p>Only the value is touched; comments, ordering and whitespace of the rest of the
 * frontmatter survive byte for byte. Values that already normalize to themselves, and
 * values that cannot be normalized at all, are left alone.
 */
public final class StringFieldMungingMigration implements ContentMigration {
    private final List<String> path;

    public StringFieldMungingMigration(List<String> path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("field path must not be empty");
        }
        this.path = List.copyOf(path);
    }

    /** Normalizes the top-level {@code identifier} field. */
    public static StringFieldMungingMigration identifierField() {
        return new StringFieldMungingMigration(List.of("identifier"));
    }

    /** Normalizes {@code container} inside the {@code inventory} table. */
    public static StringFieldMungingMigration inventoryContainer() {
        return new StringFieldMungingMigration(List.of("inventory", "container"));
    }

    public List<String> path() {
        return path;
    }

    @Override
    public String name() {
        return "munge:" + String.join(".", path);
    }

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
        Optional<String> value;
        try {
            value = TomlFrontmatter.textAt(TomlFrontmatter.parse(parts.get().frontmatter()), path);
        } catch (IOException e) {
            return false;
        }
        return value.flatMap(raw -> IdentifierNormalizer.tryNormalize(raw).filter(munged -> !munged.equals(raw)))
                .isPresent();
    }

    @Override
    public byte[] apply(byte[] content) throws MigrationException {
        Optional<TomlFrontmatter.Parts> parts = TomlFrontmatter.split(content);
        if (parts.isEmpty()) {
            return content;
        }
        String frontmatter = parts.get().frontmatter();
        JsonNode root;
        try {
            root = TomlFrontmatter.parse(frontmatter);
        } catch (IOException e) {
            throw new MigrationException("frontmatter is not valid TOML", content, e);
        }
        Optional<String> raw = TomlFrontmatter.textAt(root, path);
        if (raw.isEmpty()) {
            return content;
        }
        String munged;
        try {
            munged = IdentifierNormalizer.normalize(raw.get());
        } catch (IdentifierException e) {
            throw new MigrationException("cannot normalize " + name() + " value '" + raw.get() + "'", content, e);
        }
        if (munged.equals(raw.get())) {
            return content;
        }
        String rewritten = TomlFrontmatter.replaceStringValue(frontmatter, path, munged)
                .orElseThrow(() -> new MigrationException(
                        "field " + String.join(".", path) + " is not a rewritable single-line string", content));
        return TomlFrontmatter.join(rewritten, parts.get().body());
    }
}
