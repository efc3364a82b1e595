package io.pagekeys.rolling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.pagekeys.model.FrontmatterFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts {@code ---}-delimited YAML frontmatter into {@code +++}-delimited TOML.
 * Null values have no TOML representation and are dropped. The body is kept as is.
 */
public final class YamlToTomlMigration implements ContentMigration {
    private static final String YAML_DELIMITER = "---";
    private static final String CLOSING = "\n---";

    private static final YAMLMapper YAML = new YAMLMapper();
    private static final TomlMapper TOML = new TomlMapper();

    @Override
    public Set<FrontmatterFormat> supportedFormats() {
        return Set.of(FrontmatterFormat.YAML);
    }

    @Override
    public boolean appliesTo(byte[] content) {
        return FrontmatterFormat.detect(content) == FrontmatterFormat.YAML;
    }

    @Override
    public byte[] apply(byte[] content) throws MigrationException {
        Optional<String> decoded = TomlFrontmatter.decode(content);
        if (decoded.isEmpty()) {
            throw new MigrationException("content is not valid UTF-8", content);
        }
        String text = decoded.get();
        if (!text.startsWith(YAML_DELIMITER + "\n")) {
            throw new MigrationException("YAML frontmatter must start with '---' on its own line", content);
        }
        String rest = text.substring(YAML_DELIMITER.length() + 1);
        int closing = rest.indexOf(CLOSING);
        if (closing < 0) {
            throw new MigrationException("YAML frontmatter has no closing '---'", content);
        }
        String frontmatter = rest.substring(0, closing);
        String remaining = rest.substring(closing);
        String body;
        if (remaining.equals(CLOSING)) {
            body = "";
        } else if (remaining.startsWith(CLOSING + "\n")) {
            body = remaining.substring(CLOSING.length() + 1);
        } else {
            throw new MigrationException("YAML frontmatter closing '---' must be on its own line", content);
        }
        if (frontmatter.isBlank()) {
            return content;
        }

        String toml;
        try {
            JsonNode tree = YAML.readTree(frontmatter);
            if (tree == null || !tree.isObject()) {
                throw new MigrationException("YAML frontmatter must be a mapping", content);
            }
            dropNulls(tree);
            toml = TOML.writeValueAsString(tree);
        } catch (IOException e) {
            throw new MigrationException("failed to convert YAML frontmatter: " + e.getMessage(), content, e);
        }
        if (!toml.endsWith("\n")) {
            toml = toml + "\n";
        }
        return (TomlFrontmatter.DELIMITER + "\n" + toml + TomlFrontmatter.DELIMITER + "\n" + body)
                .getBytes(StandardCharsets.UTF_8);
    }

    private static void dropNulls(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isNull()) {
                    fields.remove();
                } else {
                    dropNulls(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = array.size() - 1; i >= 0; i--) {
                if (array.get(i).isNull()) {
                    array.remove(i);
                } else {
                    dropNulls(array.get(i));
                }
            }
        }
    }
}
