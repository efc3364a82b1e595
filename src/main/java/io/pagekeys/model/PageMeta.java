package io.pagekeys.model;

public record PageMeta(
        String identifier,
        long updatedAtMs
) {
}
