package com.adlanda.apidocsrag.exception;

/**
 * Thrown when the endpoint corpus cannot be loaded.
 */
public class CorpusLoadException extends RuntimeException {

    /**
     * Why the load failed.
     */
    public enum Reason {
        /** The source is not a valid collection of endpoint objects. */
        MALFORMED,
        /** No valid entries remained after filtering. */
        EMPTY,
        /** The source could not be read. */
        UNREADABLE
    }

    private final Reason reason;

    public CorpusLoadException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CorpusLoadException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
