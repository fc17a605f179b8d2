package com.prozchain.finality;

import com.prozchain.types.Hash256;
import com.prozchain.types.Hash512;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.Ed25519Utils;
import com.prozchain.validator.ValidatorId;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;

/**
 * A signed attestation for a block in one stage of a voting round. Immutable.
 */
@Getter
@EqualsAndHashCode
public class Vote implements Serializable {

    private static final String DOMAIN = "prozchain/vote";

    private final ValidatorId validator;
    private final Hash256 blockHash;
    private final long height;
    private final long round;
    private final VoteStage stage;
    private final Hash512 signature;

    public Vote(ValidatorId validator, Hash256 blockHash, long height, long round, VoteStage stage,
                Hash512 signature) {
        this.validator = validator;
        this.blockHash = blockHash;
        this.height = height;
        this.round = round;
        this.stage = stage;
        this.signature = signature;
    }

    public static Vote sign(byte[] privateKey, ValidatorId validator, Hash256 blockHash, long height, long round,
                            VoteStage stage) {
        byte[] payload = signingPayload(blockHash, height, round, stage);
        return new Vote(validator, blockHash, height, round, stage, Ed25519Utils.signMessage(privateKey, payload));
    }

    public static byte[] signingPayload(Hash256 blockHash, long height, long round, VoteStage stage) {
        return new CanonicalWriter()
                .writeString(DOMAIN)
                .writeHash(blockHash)
                .writeLong(height)
                .writeLong(round)
                .writeByte(stage.getStage())
                .toByteArray();
    }

    public byte[] signingPayload() {
        return signingPayload(blockHash, height, round, stage);
    }

    public boolean isSignatureValid() {
        return signature != null
                && Ed25519Utils.verifySignature(signature, signingPayload(), validator.getPublicKey());
    }

    /**
     * @return true if both votes come from the same validator for the same slot of the protocol
     * but reference different blocks
     */
    public boolean conflictsWith(Vote other) {
        return validator.equals(other.validator)
                && height == other.height
                && round == other.round
                && stage == other.stage
                && !blockHash.equals(other.blockHash);
    }

    @Override
    public String toString() {
        return String.format("Vote{%s %s #%d r%d %s}", stage, validator, height, round, blockHash);
    }
}
