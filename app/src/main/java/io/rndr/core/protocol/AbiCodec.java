package io.rndr.core.protocol;

import io.rndr.core.ledger.LedgerError;
import io.rndr.core.ledger.LedgerException;

import java.math.BigInteger;

/**
 * Encodes and decodes the single-word ABI payload the bridge sends with a deposit:
 * one 32-byte big-endian unsigned integer.
 */
public final class AbiCodec {
    private AbiCodec(){}

    public static byte[] encodeUint256(BigInteger value) {
        byte[] raw = Amounts.requireUint256(value).toByteArray();
        byte[] out = new byte[ProtocolLimits.UINT256_BYTES];
        // toByteArray may carry a leading sign byte
        int copy = Math.min(raw.length, ProtocolLimits.UINT256_BYTES);
        System.arraycopy(raw, raw.length - copy, out, ProtocolLimits.UINT256_BYTES - copy, copy);
        return out;
    }

    public static BigInteger decodeUint256(byte[] data) {
        if (data == null || data.length != ProtocolLimits.UINT256_BYTES) {
            throw new LedgerException(LedgerError.MALFORMED_DEPOSIT_DATA,
                    "expected " + ProtocolLimits.UINT256_BYTES + " bytes, got " + (data == null ? 0 : data.length));
        }
        return new BigInteger(1, data);
    }

    public static String toHex(byte[] bytes) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return "0x" + new String(out);
    }

    public static byte[] parseHex(String hex) {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            normalized = "0" + normalized;
        }
        int len = normalized.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new LedgerException(LedgerError.MALFORMED_DEPOSIT_DATA, "deposit data must be hexadecimal");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }
}
