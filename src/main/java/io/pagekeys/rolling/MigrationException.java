package io.pagekeys.rolling;

/**
 * A content migration failed. {@link #originalContent()} holds the bytes as they were
 * before any migration ran, so the caller can keep serving or storing them unchanged.
 */
public final class MigrationException extends Exception {
    private final byte[] originalContent;

    public MigrationException(String message, byte[] originalContent) {
        this(message, originalContent, null);
    }

    public MigrationException(String message, byte[] originalContent, Throwable cause) {
        super(message, cause);
        this.originalContent = originalContent == null ? new byte[0] : originalContent.clone();
    }

    public byte[] originalContent() {
        return originalContent.clone();
    }
}
