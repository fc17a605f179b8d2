package com.prozchain.exception.checkpoint;

import com.prozchain.exception.ConsensusGenericException;

public class CheckpointMonotonicityException extends ConsensusGenericException {

    public CheckpointMonotonicityException(String message) {
        super(message);
    }
}
