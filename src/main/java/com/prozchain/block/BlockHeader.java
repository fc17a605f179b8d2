package com.prozchain.block;

import com.prozchain.types.Hash256;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.HashUtils;
import com.prozchain.validator.ValidatorId;
import lombok.Builder;
import lombok.Getter;

import java.io.Serializable;

@Getter
@Builder
public class BlockHeader implements Serializable {

    private final Hash256 parentHash;
    private final long height;
    private final Hash256 stateRoot;
    private final Hash256 payloadRoot;
    private final ValidatorId proposer;
    private final long slot;
    private final long timestamp;

    public byte[] encode() {
        return new CanonicalWriter()
                .writeHash(parentHash)
                .writeLong(height)
                .writeHash(stateRoot)
                .writeHash(payloadRoot)
                .writeHash(proposer.getPublicKey())
                .writeLong(slot)
                .writeLong(timestamp)
                .toByteArray();
    }

    public Hash256 getHash() {
        return HashUtils.blake2bHash(encode());
    }

    @Override
    public String toString() {
        return "BlockHeader{" +
                "parentHash=" + parentHash +
                ", height=" + height +
                ", stateRoot=" + stateRoot +
                ", proposer=" + proposer +
                ", slot=" + slot +
                '}';
    }
}
