package com.prozchain.finality;

public enum CandidateState {
    PROPOSED,
    PREPARED,
    COMMITTED,
    FINALIZED,
    ABANDONED;

    public boolean isTerminal() {
        return this == FINALIZED || this == ABANDONED;
    }
}
