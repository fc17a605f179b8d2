package com.prozchain.finality;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum VoteStage {

    PREPARE(0),
    COMMIT(1),
    UNKNOWN(-1);

    VoteStage(int stage) {
        this.stage = stage;
    }

    private final int stage;

    public static VoteStage getByStage(int stage) {
        return Arrays.stream(values())
                .filter(t -> t.stage == stage)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
