package io.pagekeys.identifier;

/**
 * Raised when an identifier cannot be normalized.
 *
 * <p>{@link Kind#EMPTY_AFTER_SANITIZATION} means the input itself is unusable and
 * the caller must reject it. {@link Kind#INVARIANT_VIOLATED} means the normalizer
 * produced a result that failed its own post-condition checks.
 */
public final class IdentifierException extends Exception {
    public enum Kind {
        EMPTY_AFTER_SANITIZATION,
        INVARIANT_VIOLATED
    }

    private final Kind kind;
    private final String input;

    IdentifierException(Kind kind, String input, String message) {
        this(kind, input, message, null);
    }

    IdentifierException(Kind kind, String input, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.input = input;
    }

    public Kind kind() {
        return kind;
    }

    public String input() {
        return input;
    }
}
