package io.pagekeys.rolling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits and rebuilds {@code +++}-delimited TOML frontmatter.
 *
 * <p>The frontmatter returned by {@link #split(byte[])} keeps the newline after the
 * opening delimiter and the one before the closing delimiter, so
 * {@link #join(String, String)} restores the original bytes exactly. The one exception is a
 * closing delimiter at the very end of the content with no newline after it: that content
 * splits with an empty body and joins back with the newline added.
 */
public final class TomlFrontmatter {
    public static final String DELIMITER = "+++";
    private static final String CLOSING = "\n+++\n";
    private static final String CLOSING_AT_END = "\n+++";

    private static final Logger log = LoggerFactory.getLogger(TomlFrontmatter.class);

    private static final TomlMapper TOML = new TomlMapper();
    private static final Pattern TABLE_HEADER = Pattern.compile("^\\s*\\[\\s*([^\\[\\]]+?)\\s*]\\s*(#.*)?$");
    private static final Pattern ANY_TABLE_HEADER = Pattern.compile(
            "^\\s*\\[\\[?\\s*[A-Za-z0-9_\\-\"'. ]+?\\s*]]?\\s*(#.*)?$");
    private static final Pattern ARRAY_TABLE_HEADER = Pattern.compile("^\\s*\\[\\[");
    private static final Pattern STRING_ASSIGNMENT = Pattern.compile(
            "^(\\s*)([A-Za-z0-9_-]+(?:\\s*\\.\\s*[A-Za-z0-9_-]+)*)(\\s*=\\s*)(\"(?:[^\"\\\\]|\\\\.)*\"|'[^'\\n]*')(.*)$");
    private static final Pattern ANY_ASSIGNMENT = Pattern.compile(
            "^\\s*([A-Za-z0-9_-]+(?:\\s*\\.\\s*[A-Za-z0-9_-]+)*)\\s*=");

    private TomlFrontmatter() {
    }

    public record Parts(String frontmatter, String body) {
    }

    /**
     * Returns the frontmatter and body of {@code content}, or empty when the content
     * does not open with {@code +++}, has no closing delimiter line, or is not valid UTF-8.
     * Lines must end with {@code \n}; CRLF frontmatter is not recognized.
     */
    public static Optional<Parts> split(byte[] content) {
        Optional<String> text = decode(content);
        if (text.isEmpty()) {
            log.debug("Content is not valid UTF-8, frontmatter not split");
            return Optional.empty();
        }
        if (!text.get().startsWith(DELIMITER)) {
            return Optional.empty();
        }
        String rest = text.get().substring(DELIMITER.length());
        int closing = rest.indexOf(CLOSING);
        if (closing >= 0) {
            return Optional.of(new Parts(rest.substring(0, closing + 1), rest.substring(closing + CLOSING.length())));
        }
        if (rest.endsWith(CLOSING_AT_END)) {
            return Optional.of(new Parts(rest.substring(0, rest.length() - DELIMITER.length()), ""));
        }
        log.debug("No closing {} line found, frontmatter not split (crlf={})", DELIMITER, rest.contains("\r\n"));
        return Optional.empty();
    }

    /** Whether {@code line} is a {@code [table]} or {@code [[array.table]]} header, comment allowed. */
    public static boolean isTableHeader(String line) {
        return ANY_TABLE_HEADER.matcher(line).matches();
    }

    public static byte[] join(String frontmatter, String body) {
        return (DELIMITER + frontmatter + DELIMITER + "\n" + body).getBytes(StandardCharsets.UTF_8);
    }

    public static JsonNode parse(String frontmatter) throws IOException {
        return TOML.readTree(frontmatter);
    }

    public static Optional<String> textAt(JsonNode root, List<String> path) {
        JsonNode node = root;
        for (String segment : path) {
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            node = node.get(segment);
        }
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }

    /**
     * Rewrites the value of the string field at {@code path}, leaving every other byte of
     * the frontmatter untouched. The field may be written as a bare key inside its table,
     * as a dotted key, or as a mix of both.
     *
     * @return the rewritten frontmatter, or empty when the field is absent or its value is
     *     not a single-line string
     */
    public static Optional<String> replaceStringValue(String frontmatter, List<String> path, String newValue) {
        String[] lines = frontmatter.split("\n", -1);
        List<String> table = List.of();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (ARRAY_TABLE_HEADER.matcher(line).find()) {
                table = null;
                continue;
            }
            Matcher header = TABLE_HEADER.matcher(line);
            if (header.matches()) {
                table = splitKey(header.group(1));
                continue;
            }
            if (table == null) {
                continue;
            }
            Matcher assignment = ANY_ASSIGNMENT.matcher(line);
            if (!assignment.find() || !concat(table, splitKey(assignment.group(1))).equals(path)) {
                continue;
            }
            String rawValue = line.substring(assignment.end()).trim();
            Matcher value = STRING_ASSIGNMENT.matcher(line);
            if (rawValue.startsWith("\"\"\"") || rawValue.startsWith("'''") || !value.matches()) {
                return Optional.empty();
            }
            lines[i] = value.group(1) + value.group(2) + value.group(3) + quote(newValue) + value.group(5);
            return Optional.of(String.join("\n", lines));
        }
        return Optional.empty();
    }

    /** Encodes {@code value} as a TOML basic string. */
    public static String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (ch < 0x20 || ch == 0x7f) {
                        out.append(String.format("\\u%04X", (int) ch));
                    } else {
                        out.append(ch);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    static Optional<String> decode(byte[] content) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static List<String> splitKey(String key) {
        return Arrays.stream(key.split("\\.")).map(String::trim).toList();
    }

    private static List<String> concat(List<String> table, List<String> key) {
        List<String> full = new ArrayList<>(table.size() + key.size());
        full.addAll(table);
        full.addAll(key);
        return full;
    }
}
