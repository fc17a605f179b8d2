package com.prozchain.finality;

import com.prozchain.block.Block;
import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorId;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append only vote collection and voting state of one candidate block.
 */
@Getter
public class BlockVotes {

    private final Block block;
    private final Map<ValidatorId, Vote> prepares = new LinkedHashMap<>();
    private final Map<ValidatorId, Vote> commits = new LinkedHashMap<>();

    @Setter(AccessLevel.PACKAGE)
    private CandidateState state = CandidateState.PROPOSED;

    public BlockVotes(Block block) {
        this.block = block;
    }

    public Hash256 getBlockHash() {
        return block.getHash();
    }

    public long getHeight() {
        return block.getHeight();
    }

    /**
     * @return false if the validator already has a vote in this stage
     */
    boolean addVote(Vote vote) {
        Map<ValidatorId, Vote> stageVotes = votesFor(vote.getStage());
        return stageVotes.putIfAbsent(vote.getValidator(), vote) == null;
    }

    public Map<ValidatorId, Vote> votesFor(VoteStage stage) {
        return switch (stage) {
            case PREPARE -> prepares;
            case COMMIT -> commits;
            default -> throw new IllegalArgumentException("No votes are collected for stage " + stage);
        };
    }

    /**
     * @return one vote per distinct validator that took part in either stage, commits preferred
     */
    public List<Vote> getParticipants() {
        Map<ValidatorId, Vote> participants = new LinkedHashMap<>(prepares);
        participants.putAll(commits);
        return new ArrayList<>(participants.values());
    }
}
