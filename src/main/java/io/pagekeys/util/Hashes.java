package io.pagekeys.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

public final class Hashes {
    private Hashes() {
    }

    public static String sha256Hex(String value) {
        return Hashing.sha256()
                .hashString(value == null ? "" : value, StandardCharsets.UTF_8)
                .toString();
    }
}
