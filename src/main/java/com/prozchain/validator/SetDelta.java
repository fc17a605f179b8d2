package com.prozchain.validator;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Difference between the active sets of two consecutive epochs.
 */
@Getter
@AllArgsConstructor
public class SetDelta {
    private final long epoch;
    private final List<ValidatorId> added;
    private final List<ValidatorId> removed;
    private final List<ValidatorId> retained;

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
