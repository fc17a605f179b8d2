package com.prozchain.slashing;

import lombok.Getter;

@Getter
public enum OffenseType {

    DOUBLE_VOTING(0),
    LONG_RANGE_EQUIVOCATION(1),
    UNAVAILABILITY(2);

    OffenseType(int code) {
        this.code = code;
    }

    private final int code;

    public boolean isEquivocation() {
        return this != UNAVAILABILITY;
    }
}
