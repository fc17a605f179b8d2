package com.prozchain.utils;

import com.prozchain.types.Hash256;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Builds the canonical byte encoding that hashes and signatures are computed over.
 * Integers are 8 byte little endian, variable length data is prefixed with its length.
 */
public class CanonicalWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public CanonicalWriter writeByte(int value) {
        out.write(value);
        return this;
    }

    public CanonicalWriter writeLong(long value) {
        out.writeBytes(LittleEndianUtils.toLittleEndianBytes(value));
        return this;
    }

    public CanonicalWriter writeHash(Hash256 hash) {
        out.writeBytes(hash.getBytes());
        return this;
    }

    public CanonicalWriter writeBytes(byte[] bytes) {
        writeLong(bytes.length);
        out.writeBytes(bytes);
        return this;
    }

    public CanonicalWriter writeString(String value) {
        return writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
