package com.prozchain.finality;

/**
 * How blocks become irreversible. Fixed at genesis, a running network never switches between the two.
 */
public enum FinalityMode {
    /**
     * Two phase prepare/commit voting with a stake weighted supermajority.
     */
    BFT,
    /**
     * Probabilistic finality: a block on the canonical chain buried under enough descendants.
     */
    CONFIRMATION_DEPTH
}
