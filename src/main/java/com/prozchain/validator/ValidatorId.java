package com.prozchain.validator;

import com.prozchain.types.Hash256;
import com.prozchain.utils.HashUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Identity of a validator: its Ed25519 public key. The address is the first 20 bytes
 * of the Blake2b-256 hash of that key.
 */
@Getter
@EqualsAndHashCode
public final class ValidatorId implements Serializable, Comparable<ValidatorId> {

    private static final int ADDRESS_LENGTH = 20;

    private final Hash256 publicKey;

    public ValidatorId(Hash256 publicKey) {
        this.publicKey = publicKey;
    }

    public static ValidatorId fromPublicKey(byte[] publicKey) {
        return new ValidatorId(new Hash256(publicKey));
    }

    public String getAddress() {
        byte[] hash = HashUtils.hashWithBlake2b(publicKey.getBytes());
        return "0x" + Hex.toHexString(Arrays.copyOf(hash, ADDRESS_LENGTH));
    }

    @Override
    public int compareTo(ValidatorId other) {
        return publicKey.compareTo(other.publicKey);
    }

    @Override
    public String toString() {
        String hex = publicKey.toString();
        return hex.substring(0, 10) + ".." + hex.substring(hex.length() - 4);
    }
}
