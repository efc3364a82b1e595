package io.pagekeys.sweep;

import java.util.Optional;

/**
 * Both copies of one logical page as read by the resolver. Only lives for the
 * duration of one {@link ShadowingMigrationJob}.
 */
public record ReconciliationCandidate(
        String legacyIdentifier,
        String canonicalIdentifier,
        byte[] legacyContent,
        Optional<byte[]> canonicalContent
) {
    /**
     * The legacy copy wins when there is no canonical copy, or when it is strictly
     * longer. Equal lengths keep the canonical copy.
     */
    public boolean legacyWins() {
        return canonicalContent.map(canonical -> legacyContent.length > canonical.length).orElse(true);
    }

    public byte[] winningContent() {
        return legacyWins() ? legacyContent : canonicalContent.orElseThrow();
    }
}
