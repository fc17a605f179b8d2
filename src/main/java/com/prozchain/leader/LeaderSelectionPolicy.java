package com.prozchain.leader;

public enum LeaderSelectionPolicy {
    /**
     * Slot modulo the size of the active set, in snapshot order.
     */
    ROUND_ROBIN,
    /**
     * Pseudo-random draw proportional to voting power, seeded by the epoch randomness.
     */
    STAKE_WEIGHTED
}
