package com.prozchain.finality;

/**
 * Result of handing a vote to the {@link FinalityGadget}.
 */
public enum VoteOutcome {
    ACCEPTED,
    DUPLICATE,
    /**
     * The referenced block is unknown, the vote waits in the pending buffer.
     */
    BUFFERED,
    REJECTED,
    /**
     * The validator already voted for a different block at the same height, round and stage.
     * The earlier vote keeps counting.
     */
    EQUIVOCATION
}
