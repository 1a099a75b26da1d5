package io.rndr.core.protocol;

import io.rndr.core.ledger.LedgerError;
import io.rndr.core.ledger.LedgerException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class AbiCodecTest {

    @Test
    void encodesBigEndianIntoOneWord() {
        byte[] word = AbiCodec.encodeUint256(BigInteger.valueOf(0x0102));
        assertEquals(32, word.length);
        assertEquals(0x01, word[30]);
        assertEquals(0x02, word[31]);
        for (int i = 0; i < 30; i++) {
            assertEquals(0, word[i]);
        }
    }

    @Test
    void maxValueFillsTheWord() {
        byte[] word = AbiCodec.encodeUint256(Amounts.MAX_UINT256);
        byte[] expected = new byte[32];
        Arrays.fill(expected, (byte) 0xff);
        assertArrayEquals(expected, word);
        assertEquals(Amounts.MAX_UINT256, AbiCodec.decodeUint256(word));
    }

    @Test
    void rejectsAnythingButExactlyOneWord() {
        LedgerException shortData = assertThrows(LedgerException.class, () -> AbiCodec.decodeUint256(new byte[31]));
        assertEquals(LedgerError.MALFORMED_DEPOSIT_DATA, shortData.error());
        assertThrows(LedgerException.class, () -> AbiCodec.decodeUint256(new byte[64]));
        assertThrows(LedgerException.class, () -> AbiCodec.decodeUint256(null));
    }

    @Test
    void hexHelpers() {
        assertEquals("0x00ff10", AbiCodec.toHex(new byte[] {0x00, (byte) 0xff, 0x10}));
        assertArrayEquals(new byte[] {0x0a, (byte) 0xbc}, AbiCodec.parseHex("0xabc"));
        assertEquals(0, AbiCodec.parseHex(null).length);
        LedgerException ex = assertThrows(LedgerException.class, () -> AbiCodec.parseHex("0xzz"));
        assertEquals(LedgerError.MALFORMED_DEPOSIT_DATA, ex.error());
    }
}
