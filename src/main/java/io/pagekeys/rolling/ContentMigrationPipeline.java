package io.pagekeys.rolling;

import io.pagekeys.config.PageKeysSettings;
import io.pagekeys.model.FrontmatterFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs an ordered list of {@link ContentMigration}s over page content.
 *
 * <p>Each migration sees the output of the one before it. The frontmatter format is
 * detected again after every migration that changed the content, so a conversion to
 * another format hands off to the migrations of that format. When any migration fails
 * the whole run is abandoned and the {@link MigrationException} carries the content as
 * it was before the first migration.
 */
public final class ContentMigrationPipeline {
    private final List<ContentMigration> migrations;

    public ContentMigrationPipeline(List<? extends ContentMigration> migrations) {
        this.migrations = List.copyOf(Objects.requireNonNull(migrations, "migrations"));
    }

    /** Dotted-key merge, then table spacing. */
    public static ContentMigrationPipeline defaults() {
        return new ContentMigrationPipeline(List.of(new DottedKeyTableMigration(), new TableSpacingMigration()));
    }

    public static ContentMigrationPipeline fromSettings(PageKeysSettings settings) {
        List<ContentMigration> list = new ArrayList<>();
        if (settings.convertYamlFrontmatter()) {
            list.add(new YamlToTomlMigration());
        }
        list.add(new DottedKeyTableMigration());
        if (settings.mungeIdentifierFields()) {
            list.add(StringFieldMungingMigration.identifierField());
            list.add(StringFieldMungingMigration.inventoryContainer());
        }
        list.add(new TableSpacingMigration());
        return new ContentMigrationPipeline(list);
    }

    public List<ContentMigration> migrations() {
        return migrations;
    }

    public byte[] applyMigrations(byte[] content) throws MigrationException {
        Objects.requireNonNull(content, "content");
        FrontmatterFormat format = FrontmatterFormat.detect(content);
        if (format == FrontmatterFormat.UNKNOWN) {
            return content;
        }
        byte[] current = content;
        for (ContentMigration migration : migrations) {
            if (!migration.supportedFormats().contains(format) || !migration.appliesTo(current)) {
                continue;
            }
            try {
                current = migration.apply(current);
            } catch (MigrationException e) {
                throw new MigrationException("migration " + migration.name() + " failed: " + e.getMessage(), content, e);
            } catch (RuntimeException e) {
                throw new MigrationException("migration " + migration.name() + " failed unexpectedly", content, e);
            }
            format = FrontmatterFormat.detect(current);
        }
        return current;
    }
}
