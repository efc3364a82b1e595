package io.pagekeys.model;

/**
 * A page as found by the store: the slot it was read from, the identifier that slot
 * answers to, and the raw content bytes (a private copy).
 */
public record StoredPage(
        String key,
        String identifier,
        byte[] content
) {
}
