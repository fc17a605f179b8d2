package com.prozchain.utils;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LittleEndianUtilsTest {

    @Test
    void testToLittleEndianBytes() {
        byte[] expected = {0x04, 0x03, 0x02, 0x01, 0, 0, 0, 0};
        assertArrayEquals(expected, LittleEndianUtils.toLittleEndianBytes(0x01020304L));
    }

    @Test
    void testToLittleEndianBytesWithMaxLongValue() {
        byte[] expected = new byte[]{-1, -1, -1, -1, -1, -1, -1, 127};
        assertArrayEquals(expected, LittleEndianUtils.toLittleEndianBytes(Long.MAX_VALUE));
    }

    @Test
    void testFromLittleEndianByteArrayIsUnsigned() {
        byte[] input = {(byte) 0xFF, (byte) 0xFF};
        assertEquals(BigInteger.valueOf(65535), LittleEndianUtils.fromLittleEndianByteArray(input));
    }

    @Test
    void testFromLittleEndianByteArrayReadsLowByteFirst() {
        byte[] input = {0x01, 0x02};
        assertEquals(BigInteger.valueOf(0x0201), LittleEndianUtils.fromLittleEndianByteArray(input));
    }
}
