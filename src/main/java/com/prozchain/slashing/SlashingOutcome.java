package com.prozchain.slashing;

public enum SlashingOutcome {
    SLASHED,
    EXPIRED,
    ALREADY_PROCESSED,
    /**
     * The evidence does not prove an offense, or names a validator the registry does not know.
     */
    INVALID
}
