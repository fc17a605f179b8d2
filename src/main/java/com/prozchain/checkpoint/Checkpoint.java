package com.prozchain.checkpoint;

import com.prozchain.types.Hash256;
import lombok.Getter;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.List;

/**
 * A sealed, supermajority signed finality anchor. Light clients verify it by checking the signatures against
 * the validator set of its epoch.
 */
@Getter
public class Checkpoint implements Serializable {

    private final long height;
    private final Hash256 blockHash;
    private final Hash256 stateRoot;
    private final List<CheckpointSignature> signatures;
    private final BigInteger signedPower;
    private final BigInteger totalPower;

    public Checkpoint(long height, Hash256 blockHash, Hash256 stateRoot, List<CheckpointSignature> signatures,
                      BigInteger signedPower, BigInteger totalPower) {
        this.height = height;
        this.blockHash = blockHash;
        this.stateRoot = stateRoot;
        this.signatures = List.copyOf(signatures);
        this.signedPower = signedPower;
        this.totalPower = totalPower;
    }

    @Override
    public String toString() {
        return String.format("Checkpoint{#%d %s, %d signatures}", height, blockHash, signatures.size());
    }
}
