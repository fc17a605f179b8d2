package com.prozchain.exception.global;

import com.prozchain.exception.ConsensusGenericException;

public class ThreadInterruptedException extends ConsensusGenericException {

    public ThreadInterruptedException(Throwable cause) {
        super("Thread was interrupted", cause);
    }
}
