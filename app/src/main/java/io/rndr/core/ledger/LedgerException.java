package io.rndr.core.ledger;

/**
 * Raised by any rejected ledger call. The enclosing unit of work is discarded
 * before the exception reaches the external caller.
 */
public class LedgerException extends RuntimeException {
    private final LedgerError error;

    public LedgerException(LedgerError error) {
        this(error, error.description());
    }

    public LedgerException(LedgerError error, String message) {
        super(error.code() + ": " + message);
        this.error = error;
    }

    public LedgerError error() {
        return error;
    }

    public String code() {
        return error.code();
    }
}
