package io.pagekeys.rolling;

import io.pagekeys.model.FrontmatterFormat;

import java.util.Set;

/**
 * One content-level fix applied to a stored page when it is read.
 *
 * <p>Implementations are stateless. {@link #apply(byte[])} is only called when the
 * content's format is in {@link #supportedFormats()} and {@link #appliesTo(byte[])}
 * returned {@code true} for the same bytes.
 */
public interface ContentMigration {
    Set<FrontmatterFormat> supportedFormats();

    boolean appliesTo(byte[] content);

    byte[] apply(byte[] content) throws MigrationException;

    default String name() {
        return getClass().getSimpleName();
    }
}
