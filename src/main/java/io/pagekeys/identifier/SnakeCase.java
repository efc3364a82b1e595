package io.pagekeys.identifier;

/**
 * ASCII snake_case conversion used by {@link IdentifierNormalizer}.
 *
 * <p>Only ASCII letters participate in case-boundary detection: {@code MyPage}
 * becomes {@code my_page} and {@code HTTPServer} becomes {@code http_server},
 * while letters of other scripts pass through untouched. Hyphens, underscores and
 * whitespace are delimiters; a run of them becomes a single {@code _}, except that
 * the final character of the input is always emitted as-is (lowercased).
 */
final class SnakeCase {
    private static final char DELIMITER = '_';

    private SnakeCase() {
    }

    static String of(String raw) {
        String s = raw == null ? "" : raw.strip();
        StringBuilder out = new StringBuilder(s.length() + 3);
        int prev = 0;
        int curr = 0;
        int i = 0;
        while (i < s.length()) {
            int next = s.codePointAt(i);
            i += Character.charCount(next);
            if (isDelimiter(curr)) {
                if (!isDelimiter(prev)) {
                    out.append(DELIMITER);
                }
            } else if (isUpper(curr)) {
                if (isLower(prev) || (isUpper(prev) && isLower(next))) {
                    out.append(DELIMITER);
                }
                out.appendCodePoint(toLower(curr));
            } else if (curr != 0) {
                out.appendCodePoint(toLower(curr));
            }
            prev = curr;
            curr = next;
        }
        if (!s.isEmpty()) {
            if (isUpper(curr) && isLower(prev) && prev != 0) {
                out.append(DELIMITER);
            }
            out.appendCodePoint(toLower(curr));
        }
        return out.toString();
    }

    private static boolean isLower(int ch) {
        return ch >= 'a' && ch <= 'z';
    }

    private static boolean isUpper(int ch) {
        return ch >= 'A' && ch <= 'Z';
    }

    private static int toLower(int ch) {
        return isUpper(ch) ? ch + 32 : ch;
    }

    private static boolean isDelimiter(int ch) {
        return ch == '-' || ch == '_' || ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r';
    }
}
