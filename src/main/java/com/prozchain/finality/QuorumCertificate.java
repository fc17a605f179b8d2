package com.prozchain.finality;

import com.prozchain.types.Hash256;
import lombok.Getter;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.List;

/**
 * The votes of one stage whose combined power reached quorum for a block.
 */
@Getter
public class QuorumCertificate implements Serializable {

    private final Hash256 blockHash;
    private final long height;
    private final VoteStage stage;
    private final List<Vote> votes;
    private final BigInteger votedPower;
    private final BigInteger totalPower;

    public QuorumCertificate(Hash256 blockHash, long height, VoteStage stage, List<Vote> votes,
                             BigInteger votedPower, BigInteger totalPower) {
        this.blockHash = blockHash;
        this.height = height;
        this.stage = stage;
        this.votes = List.copyOf(votes);
        this.votedPower = votedPower;
        this.totalPower = totalPower;
    }

    public long getRound() {
        return votes.stream().mapToLong(Vote::getRound).max().orElse(0);
    }
}
