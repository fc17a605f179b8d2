package com.prozchain.exception.forkchoice;

import com.prozchain.exception.ConsensusGenericException;

public class BlockNotFoundException extends ConsensusGenericException {

    public BlockNotFoundException(String message) {
        super(message);
    }
}
