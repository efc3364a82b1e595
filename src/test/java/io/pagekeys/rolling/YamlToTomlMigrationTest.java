package io.pagekeys.rolling;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class YamlToTomlMigrationTest {
    private final YamlToTomlMigration migration = new YamlToTomlMigration();

    @Test
    void convertsFrontmatterAndKeepsBody() throws Exception {
        byte[] input = bytes("---\ntitle: Hello\ntags:\n  - a\n  - b\ncount: 3\nempty: null\n---\nBody text\n---\nnot a delimiter\n");

        Assertions.assertTrue(migration.appliesTo(input));
        byte[] output = migration.apply(input);
        TomlFrontmatter.Parts parts = TomlFrontmatter.split(output).orElseThrow();
        JsonNode root = TomlFrontmatter.parse(parts.frontmatter());

        Assertions.assertEquals("Body text\n---\nnot a delimiter\n", parts.body());
        Assertions.assertEquals("Hello", root.path("title").asText());
        Assertions.assertEquals(2, root.path("tags").size());
        Assertions.assertEquals(3, root.path("count").asInt());
        Assertions.assertFalse(root.has("empty"));
    }

    @Test
    void rejectsMalformedYaml() {
        Assertions.assertThrows(MigrationException.class, () -> migration.apply(bytes("---\ntitle: [unclosed\n---\nbody")));
        Assertions.assertThrows(MigrationException.class, () -> migration.apply(bytes("---\ntitle: x\nno closing\n")));
        Assertions.assertThrows(MigrationException.class, () -> migration.apply(bytes("---\n- just\n- a list\n---\n")));
    }

    @Test
    void ignoresTomlContent() {
        Assertions.assertFalse(migration.appliesTo(bytes("+++\ntitle = 'x'\n+++\n")));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
