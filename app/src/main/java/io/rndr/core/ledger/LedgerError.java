package io.rndr.core.ledger;

/**
 * Failure reasons reported to callers. {@link #code()} is the stable string
 * clients match on.
 */
public enum LedgerError {
    NOT_OWNER("NotOwner", "Caller is not the owner"),
    NOT_AUTHORIZED("NotAuthorized", "Caller is not authorized for this entry point"),
    INVALID_ADDRESS("InvalidAddress", "Address is null or malformed"),
    INVALID_RECIPIENT("InvalidRecipient", "Recipient is null or malformed"),
    INSUFFICIENT_BALANCE("InsufficientBalance", "Amount exceeds balance"),
    INSUFFICIENT_ALLOWANCE("InsufficientAllowance", "Amount exceeds allowance"),
    INSUFFICIENT_ESCROW_BALANCE("InsufficientEscrowBalance", "Amount exceeds escrowed balance"),
    INVALID_ESCROW_ID("InvalidEscrowId", "Escrow id is missing"),
    NO_BALANCE("NoBalance", "Escrow id has no available balance"),
    LENGTH_MISMATCH("LengthMismatch", "Recipients and amounts must be the same length"),
    ESCROW_NOT_CONFIGURED("EscrowNotConfigured", "No escrow ledger configured"),
    ARITHMETIC_OVERFLOW("ArithmeticOverflow", "Amount outside the uint256 range"),
    MALFORMED_DEPOSIT_DATA("MalformedDepositData", "Deposit data is not a single uint256 word"),
    LEGACY_SOURCE_NOT_CONFIGURED("LegacySourceNotConfigured", "No legacy token configured for migration"),
    ALREADY_INITIALIZED("AlreadyInitialized", "Ledger already initialized");

    private final String code;
    private final String description;

    LedgerError(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }
}
