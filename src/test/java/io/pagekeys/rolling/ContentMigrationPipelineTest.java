package io.pagekeys.rolling;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagekeys.config.PageKeysSettings;
import io.pagekeys.model.FrontmatterFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class ContentMigrationPipelineTest {

    @Test
    void mergesDottedInventoryKeyIntoExistingTable() throws Exception {
        String input = "+++\n"
                + "identifier = \"box\"\n"
                + "inventory.container = \"X\"\n"
                + "\n"
                + "[inventory]\n"
                + "items = []\n"
                + "+++\n"
                + "body";

        String output = text(ContentMigrationPipeline.defaults().applyMigrations(bytes(input)));

        Assertions.assertEquals("+++\n"
                + "identifier = \"box\"\n"
                + "\n"
                + "[inventory]\n"
                + "container = \"X\"\n"
                + "items = []\n"
                + "+++\n"
                + "body", output);
        JsonNode root = TomlFrontmatter.parse(TomlFrontmatter.split(bytes(output)).orElseThrow().frontmatter());
        Assertions.assertEquals("X", root.path("inventory").path("container").asText());
        Assertions.assertTrue(root.path("inventory").path("items").isArray());
    }

    @Test
    void isIdempotent() throws Exception {
        ContentMigrationPipeline pipeline = ContentMigrationPipeline.defaults();
        List<String> inputs = List.of(
                "+++\ntitle = \"t\"\nmeta.author = \"a\"\n[extra]\nk = 1\n+++\nbody\n",
                "+++\n[a]\nx = 1\n[b]\ny = 2\n+++\n",
                "+++\nplain = true\n+++\nno tables",
                "---\ntitle: yaml\n---\nbody",
                "# not frontmatter at all"
        );
        for (String input : inputs) {
            byte[] once = pipeline.applyMigrations(bytes(input));
            byte[] twice = pipeline.applyMigrations(once);
            Assertions.assertEquals(text(once), text(twice), "not idempotent for: " + input);
        }
    }

    @Test
    void returnsUnknownAndShortContentUntouched() throws Exception {
        ContentMigrationPipeline pipeline = new ContentMigrationPipeline(List.of(new FailingMigration(Set.of(FrontmatterFormat.UNKNOWN))));
        byte[] plain = bytes("just a body");
        byte[] tiny = bytes("++");
        Assertions.assertSame(plain, pipeline.applyMigrations(plain));
        Assertions.assertSame(tiny, pipeline.applyMigrations(tiny));
    }

    @Test
    void skipsMigrationsForOtherFormats() throws Exception {
        byte[] yaml = bytes("---\ntitle: x\nmeta.k: v\n---\nbody");
        Assertions.assertArrayEquals(yaml, ContentMigrationPipeline.defaults().applyMigrations(yaml));
    }

    @Test
    void runsMigrationsInConstructionOrder() throws Exception {
        List<String> calls = new ArrayList<>();
        ContentMigrationPipeline pipeline = new ContentMigrationPipeline(List.of(
                new AppendingMigration("first", calls),
                new AppendingMigration("second", calls)
        ));

        String output = text(pipeline.applyMigrations(bytes("+++\na = 1\n+++\nbody")));

        Assertions.assertEquals(List.of("first", "second"), calls);
        Assertions.assertEquals("+++\na = 1\n+++\nbody|first|second", output);
    }

    @Test
    void failureAbortsAndCarriesOriginalContent() {
        List<String> calls = new ArrayList<>();
        ContentMigrationPipeline pipeline = new ContentMigrationPipeline(List.of(
                new AppendingMigration("first", calls),
                new FailingMigration(Set.of(FrontmatterFormat.TOML)),
                new AppendingMigration("never", calls)
        ));
        byte[] original = bytes("+++\na = 1\n+++\nbody");

        MigrationException error = Assertions.assertThrows(
                MigrationException.class,
                () -> pipeline.applyMigrations(original)
        );

        Assertions.assertArrayEquals(original, error.originalContent());
        Assertions.assertEquals(List.of("first"), calls);
    }

    @Test
    void convertsYamlThenAppliesTomlMigrationsInOnePass() throws Exception {
        ContentMigrationPipeline pipeline = ContentMigrationPipeline.fromSettings(
                new PageKeysSettings(10, true, true, false));
        byte[] yaml = bytes("---\ntitle: Hello\nidentifier: MyPage\ninventory:\n  container: Shelf A\n---\nbody\n");

        byte[] once = pipeline.applyMigrations(yaml);
        String output = text(once);

        Assertions.assertTrue(output.startsWith("+++\n"), output);
        Assertions.assertTrue(output.endsWith("+++\nbody\n"), output);
        JsonNode root = TomlFrontmatter.parse(TomlFrontmatter.split(once).orElseThrow().frontmatter());
        Assertions.assertEquals("Hello", root.path("title").asText());
        Assertions.assertEquals("my_page", root.path("identifier").asText());
        Assertions.assertEquals("shelf_a", root.path("inventory").path("container").asText());
        for (String line : output.split("\n")) {
            Assertions.assertFalse(line.startsWith("inventory."), output);
        }
        Assertions.assertArrayEquals(once, pipeline.applyMigrations(once));
    }

    @Test
    void fromSettingsKeepsSpacingLast() {
        List<ContentMigration> migrations = ContentMigrationPipeline.fromSettings(
                new PageKeysSettings(10, true, true, false)).migrations();
        Assertions.assertEquals(5, migrations.size());
        Assertions.assertInstanceOf(YamlToTomlMigration.class, migrations.get(0));
        Assertions.assertInstanceOf(TableSpacingMigration.class, migrations.get(4));
        Assertions.assertEquals(2, ContentMigrationPipeline.fromSettings(PageKeysSettings.defaults()).migrations().size());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    private static final class AppendingMigration implements ContentMigration {
        private final String marker;
        private final List<String> calls;

        private AppendingMigration(String marker, List<String> calls) {
            this.marker = marker;
            this.calls = calls;
        }

        @Override
        public Set<FrontmatterFormat> supportedFormats() {
            return Set.of(FrontmatterFormat.TOML);
        }

        @Override
        public boolean appliesTo(byte[] content) {
            return true;
        }

        @Override
        public byte[] apply(byte[] content) {
            calls.add(marker);
            return bytes(text(content) + "|" + marker);
        }
    }

    private static final class FailingMigration implements ContentMigration {
        private final Set<FrontmatterFormat> formats;

        private FailingMigration(Set<FrontmatterFormat> formats) {
            this.formats = formats;
        }

        @Override
        public Set<FrontmatterFormat> supportedFormats() {
            return formats;
        }

        @Override
        public boolean appliesTo(byte[] content) {
            return true;
        }

        @Override
        public byte[] apply(byte[] content) throws MigrationException {
            throw new MigrationException("boom", content);
        }
    }
}
