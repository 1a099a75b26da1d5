package io.rndr.core.protocol;

import io.rndr.core.ledger.LedgerError;
import io.rndr.core.ledger.LedgerException;

import java.math.BigInteger;

/**
 * Checked uint256 arithmetic. Nothing wraps: leaving [0, 2^256-1] fails.
 */
public final class Amounts {
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Amounts(){}

    public static BigInteger requireUint256(BigInteger value) {
        if (value == null) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "amount is required");
        }
        if (value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "amount out of range: " + value);
        }
        return value;
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        BigInteger sum = requireUint256(a).add(requireUint256(b));
        if (sum.compareTo(MAX_UINT256) > 0) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "addition overflows uint256");
        }
        return sum;
    }

    /** Subtraction that fails with {@code onUnderflow} instead of going negative. */
    public static BigInteger sub(BigInteger a, BigInteger b, LedgerError onUnderflow) {
        requireUint256(a);
        requireUint256(b);
        if (b.compareTo(a) > 0) {
            throw new LedgerException(onUnderflow, "required " + b + ", available " + a);
        }
        return a.subtract(b);
    }

    /** Subtraction that floors at zero. */
    public static BigInteger saturatingSub(BigInteger a, BigInteger b) {
        requireUint256(a);
        requireUint256(b);
        return b.compareTo(a) >= 0 ? BigInteger.ZERO : a.subtract(b);
    }

    public static BigInteger parse(String text) {
        if (text == null || text.isBlank()) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "amount is required");
        }
        String s = text.trim();
        try {
            BigInteger value = s.startsWith("0x") || s.startsWith("0X")
                    ? new BigInteger(s.substring(2), 16)
                    : new BigInteger(s);
            return requireUint256(value);
        } catch (NumberFormatException e) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "not an integer amount: " + text);
        }
    }

    public static byte[] toBytes(BigInteger value) {
        return requireUint256(value).toByteArray();
    }

    public static BigInteger fromBytes(byte[] data) {
        if (data == null || data.length == 0) {
            return BigInteger.ZERO;
        }
        return new BigInteger(data);
    }
}
