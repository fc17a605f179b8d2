package com.prozchain.exception.forkchoice;

import com.prozchain.exception.ConsensusGenericException;

public class InvalidAncestryException extends ConsensusGenericException {

    public InvalidAncestryException(String message) {
        super(message);
    }
}
