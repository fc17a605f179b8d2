package com.prozchain.checkpoint;

import com.prozchain.types.Hash256;
import com.prozchain.types.Hash512;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.Ed25519Utils;
import com.prozchain.validator.ValidatorId;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;

/**
 * A validator's signature over the fixed checkpoint message (height and block hash).
 */
@Getter
@EqualsAndHashCode
public class CheckpointSignature implements Serializable {

    private static final String DOMAIN = "prozchain/checkpoint";

    private final ValidatorId validator;
    private final long height;
    private final Hash256 blockHash;
    private final Hash512 signature;

    public CheckpointSignature(ValidatorId validator, long height, Hash256 blockHash, Hash512 signature) {
        this.validator = validator;
        this.height = height;
        this.blockHash = blockHash;
        this.signature = signature;
    }

    public static byte[] signingPayload(long height, Hash256 blockHash) {
        return new CanonicalWriter()
                .writeString(DOMAIN)
                .writeLong(height)
                .writeHash(blockHash)
                .toByteArray();
    }

    public static CheckpointSignature sign(byte[] privateKey, ValidatorId validator, long height, Hash256 blockHash) {
        return new CheckpointSignature(validator, height, blockHash,
                Ed25519Utils.signMessage(privateKey, signingPayload(height, blockHash)));
    }

    public boolean isSignatureValid() {
        return signature != null && Ed25519Utils.verifySignature(
                signature, signingPayload(height, blockHash), validator.getPublicKey());
    }

    @Override
    public String toString() {
        return String.format("CheckpointSignature{%s #%d %s}", validator, height, blockHash);
    }
}
