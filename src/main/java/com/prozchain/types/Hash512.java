package com.prozchain.types;

import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Immutable 64 byte value, used for Ed25519 signatures.
 */
public final class Hash512 implements Serializable {

    public static final int SIZE_BYTES = 64;

    private final byte[] bytes;

    public Hash512(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE_BYTES) {
            throw new IllegalArgumentException("Hash512 requires exactly " + SIZE_BYTES + " bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash512 empty() {
        return new Hash512(new byte[SIZE_BYTES]);
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash512)) return false;
        return Arrays.equals(bytes, ((Hash512) o).bytes);
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
