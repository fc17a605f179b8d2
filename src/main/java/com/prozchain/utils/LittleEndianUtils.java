package com.prozchain.utils;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.ArrayUtils;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

@UtilityClass
public class LittleEndianUtils {

    public static byte[] toLittleEndianBytes(long value) {
        return ByteBuffer.allocate(Long.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(value)
                .array();
    }

    /**
     * Interprets the given bytes as an unsigned little endian integer.
     */
    public static BigInteger fromLittleEndianByteArray(byte[] input) {
        byte[] reversed = ArrayUtils.clone(input);
        ArrayUtils.reverse(reversed);
        return new BigInteger(1, reversed);
    }
}
