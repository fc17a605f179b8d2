package com.prozchain.leader;

import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorSetSnapshot;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Represents the validator set and randomness of one epoch.
 */
@Getter
@AllArgsConstructor
public class EpochData {
    private final long epochIndex;
    private final ValidatorSetSnapshot snapshot;
    private final Hash256 randomness;
}
