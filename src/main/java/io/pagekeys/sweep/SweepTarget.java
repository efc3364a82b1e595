package io.pagekeys.sweep;

/**
 * A page found under a non-canonical key: the identifier it declares, the key its
 * files actually live under, and the canonical identifier it should move to.
 */
public record SweepTarget(
        String legacyIdentifier,
        String legacyKey,
        String canonicalIdentifier
) {
}
