package com.prozchain.validator;

import lombok.Getter;

import java.util.EventObject;

@Getter
public class ValidatorSetChangeEvent extends EventObject {

    private final SetDelta delta;
    private final ValidatorSetSnapshot snapshot;

    /**
     * @param source   the registry that rotated the set
     * @param delta    validators added, removed and retained by the rotation
     * @param snapshot the frozen set for the new epoch
     */
    public ValidatorSetChangeEvent(Object source, SetDelta delta, ValidatorSetSnapshot snapshot) {
        super(source);
        this.delta = delta;
        this.snapshot = snapshot;
    }
}
