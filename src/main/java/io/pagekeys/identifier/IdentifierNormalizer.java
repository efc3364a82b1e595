package io.pagekeys.identifier;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps raw page identifiers to their canonical form.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>NFKC normalization, collapsing stylized and decomposed variants.</li>
 *   <li>Removal of format, private-use, surrogate and non-whitespace control code points.</li>
 *   <li>Replacement of punctuation, symbols and whitespace with {@code _}; letters, digits and
 *       combining marks of any script survive, as do {@code _} and {@code -}.</li>
 *   <li>Lowercasing only, when the value contains a UUID; snake_case then lowercasing otherwise.
 *       NFKC is applied once more afterwards.</li>
 *   <li>Removal of anything still outside the allowed set.</li>
 *   <li>Collapsing of {@code _} runs.</li>
 *   <li>Trimming of outer underscores, rejecting a value with nothing else left, then restoring a single leading {@code _}, a trailing
 *       {@code __} (dunderscore) or a single trailing {@code _} when the raw input had one.</li>
 * </ol>
 *
 * <p>Each result is checked to be free of disallowed code points, idempotent, and unchanged by a
 * percent-encoding round trip.
 */
public final class IdentifierNormalizer {
    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[1-5][0-9a-fA-F]{3}-[89abAB][0-9a-fA-F]{3}-[0-9a-fA-F]{12}");
    private static final String UNDERSCORE = "_";
    private static final String DUNDERSCORE = "__";

    private IdentifierNormalizer() {
    }

    public static String normalize(String raw) throws IdentifierException {
        String result = normalizeUnchecked(raw);

        if (containsDisallowed(result)) {
            throw new IdentifierException(IdentifierException.Kind.INVARIANT_VIOLATED, raw,
                    "internal error: result '" + result + "' contains disallowed code points");
        }

        String again;
        try {
            again = normalizeUnchecked(result);
        } catch (IdentifierException e) {
            throw new IdentifierException(IdentifierException.Kind.INVARIANT_VIOLATED, raw,
                    "internal error: result '" + result + "' is rejected when normalized again", e);
        }
        if (!again.equals(result)) {
            throw new IdentifierException(IdentifierException.Kind.INVARIANT_VIOLATED, raw,
                    "internal error: result '" + result + "' is not idempotent (normalizes to '" + again + "')");
        }

        String encoded = URLEncoder.encode(result, StandardCharsets.UTF_8);
        String decoded = URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        if (!decoded.equals(result)) {
            throw new IdentifierException(IdentifierException.Kind.INVARIANT_VIOLATED, raw,
                    "internal error: result '" + result + "' is not URL-safe (encodes to '" + encoded + "')");
        }
        return result;
    }

    public static Optional<String> tryNormalize(String raw) {
        try {
            return Optional.of(normalize(raw));
        } catch (IdentifierException e) {
            return Optional.empty();
        }
    }

    public static boolean isCanonical(String raw) {
        return tryNormalize(raw).map(canonical -> canonical.equals(raw)).orElse(false);
    }

    static String normalizeUnchecked(String raw) throws IdentifierException {
        String identifier = raw == null ? "" : raw;
        boolean trailingDunderscore = hasTrailingDunderscore(identifier);
        boolean singleLeadingUnderscore = identifier.length() >= 2
                && identifier.charAt(0) == '_'
                && identifier.charAt(1) != '_';
        boolean singleTrailingUnderscore = identifier.length() >= 2
                && identifier.charAt(identifier.length() - 1) == '_'
                && identifier.charAt(identifier.length() - 2) != '_'
                && !trailingDunderscore;

        String cleaned = Normalizer.normalize(identifier, Normalizer.Form.NFKC);
        cleaned = removeAdversarial(cleaned);
        cleaned = replaceProblematic(cleaned);

        String result = UUID_PATTERN.matcher(cleaned).find()
                ? lowerCase(cleaned)
                : lowerCase(SnakeCase.of(cleaned));
        // Stripping and lowercasing can leave a base letter next to a mark it composes with.
        result = Normalizer.normalize(result, Normalizer.Form.NFKC);
        result = keepAllowed(result);
        result = collapseUnderscores(result);
        result = trimUnderscores(result);

        if (result.isEmpty()) {
            throw new IdentifierException(IdentifierException.Kind.EMPTY_AFTER_SANITIZATION, raw,
                    "identifier cannot be empty after sanitization");
        }
        if (singleLeadingUnderscore && !result.startsWith(UNDERSCORE)) {
            result = UNDERSCORE + result;
        }
        if (trailingDunderscore && !result.endsWith(DUNDERSCORE)) {
            result = result + DUNDERSCORE;
        } else if (singleTrailingUnderscore && !result.endsWith(UNDERSCORE)) {
            result = result + UNDERSCORE;
        }
        return result;
    }

    static boolean isAdversarial(int cp) {
        int type = Character.getType(cp);
        if (type == Character.FORMAT || type == Character.PRIVATE_USE || type == Character.SURROGATE) {
            return true;
        }
        return type == Character.CONTROL && cp != '\t' && cp != '\n' && cp != '\r';
    }

    static boolean isAllowed(int cp) {
        return Character.isLetter(cp) || Character.isDigit(cp) || isMark(cp) || cp == '_' || cp == '-';
    }

    private static boolean isMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    private static String removeAdversarial(String s) {
        StringBuilder out = new StringBuilder(s.length());
        s.codePoints().filter(cp -> !isAdversarial(cp)).forEach(out::appendCodePoint);
        return out.toString();
    }

    private static String replaceProblematic(String s) {
        StringBuilder out = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> out.appendCodePoint(isAllowed(cp) ? cp : '_'));
        return out.toString();
    }

    private static String keepAllowed(String s) {
        StringBuilder out = new StringBuilder(s.length());
        s.codePoints().filter(IdentifierNormalizer::isAllowed).forEach(out::appendCodePoint);
        return out.toString();
    }

    // Per code point so that, e.g., U+0130 maps to a single 'i'.
    private static String lowerCase(String s) {
        StringBuilder out = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> out.appendCodePoint(Character.toLowerCase(cp)));
        return out.toString();
    }

    private static String collapseUnderscores(String s) {
        StringBuilder out = new StringBuilder(s.length());
        boolean previousUnderscore = false;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '_') {
                if (!previousUnderscore) {
                    out.append(ch);
                }
                previousUnderscore = true;
            } else {
                out.append(ch);
                previousUnderscore = false;
            }
        }
        return out.toString();
    }

    private static String trimUnderscores(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '_') {
            end--;
        }
        return s.substring(start, end);
    }

    private static boolean hasTrailingDunderscore(String s) {
        return s.length() >= 2 && s.endsWith(DUNDERSCORE);
    }

    private static boolean containsDisallowed(String s) {
        return s.codePoints().anyMatch(cp -> isAdversarial(cp) || !isAllowed(cp));
    }
}
