package com.prozchain.block;

import com.prozchain.types.Hash256;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.HashUtils;
import com.prozchain.validator.ValidatorId;
import lombok.Getter;

import java.io.Serializable;
import java.util.List;

/**
 * Header plus an ordered transaction payload which is opaque to consensus.
 * Blocks are immutable and referenced everywhere by {@link #getHash()}.
 */
@Getter
public class Block implements Serializable {

    private final BlockHeader header;
    private final List<byte[]> payload;
    private final Hash256 hash;

    public Block(BlockHeader header, List<byte[]> payload) {
        this.header = header;
        this.payload = List.copyOf(payload);
        this.hash = header.getHash();
    }

    /**
     * Builds a block whose header commits to the given payload.
     */
    public static Block create(Hash256 parentHash,
                               long height,
                               Hash256 stateRoot,
                               ValidatorId proposer,
                               long slot,
                               long timestamp,
                               List<byte[]> payload) {
        BlockHeader header = BlockHeader.builder()
                .parentHash(parentHash)
                .height(height)
                .stateRoot(stateRoot)
                .payloadRoot(payloadRoot(payload))
                .proposer(proposer)
                .slot(slot)
                .timestamp(timestamp)
                .build();
        return new Block(header, payload);
    }

    public static Block genesis(Hash256 stateRoot, ValidatorId proposer) {
        return create(Hash256.empty(), 0, stateRoot, proposer, 0, 0, List.of());
    }

    public static Hash256 payloadRoot(List<byte[]> payload) {
        CanonicalWriter writer = new CanonicalWriter().writeLong(payload.size());
        payload.forEach(writer::writeBytes);
        return HashUtils.blake2bHash(writer.toByteArray());
    }

    public boolean isPayloadConsistent() {
        return payloadRoot(payload).equals(header.getPayloadRoot());
    }

    public Hash256 getParentHash() {
        return header.getParentHash();
    }

    public long getHeight() {
        return header.getHeight();
    }

    public ValidatorId getProposer() {
        return header.getProposer();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        return hash.equals(((Block) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Block{#" + getHeight() + " " + hash + "}";
    }
}
