package io.pagekeys.storage;

import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps identifiers to storage keys: unpadded base32 of the lowercased identifier.
 * Identifiers differing only by case share a key.
 */
public final class PageKeys {
    private static final BaseEncoding BASE32 = BaseEncoding.base32().omitPadding();

    private PageKeys() {
    }

    public static String storageKey(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        return BASE32.encode(identifier.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    /** The (lowercased) identifier a key was derived from, or empty for foreign file names. */
    public static Optional<String> decode(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new String(BASE32.decode(key), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
