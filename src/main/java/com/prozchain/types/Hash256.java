package com.prozchain.types;

import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Immutable 32 byte value used for block hashes, state roots and public keys.
 * Ordering is unsigned lexicographic over the raw bytes.
 */
public final class Hash256 implements Serializable, Comparable<Hash256> {

    public static final int SIZE_BYTES = 32;

    private final byte[] bytes;

    public Hash256(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE_BYTES) {
            throw new IllegalArgumentException("Hash256 requires exactly " + SIZE_BYTES + " bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash256 empty() {
        return new Hash256(new byte[SIZE_BYTES]);
    }

    public static Hash256 from(String hex) {
        String value = hex.startsWith("0x") ? hex.substring(2) : hex;
        return new Hash256(Hex.decode(value));
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public boolean isEmpty() {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    @Override
    public int compareTo(Hash256 other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash256)) return false;
        return Arrays.equals(bytes, ((Hash256) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "0x" + Hex.toHexString(bytes);
    }
}
