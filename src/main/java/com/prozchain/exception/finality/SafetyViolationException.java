package com.prozchain.exception.finality;

import com.prozchain.exception.ConsensusGenericException;

/**
 * Raised when two conflicting blocks would both be final. Finalization halts once this is thrown.
 */
public class SafetyViolationException extends ConsensusGenericException {

    public SafetyViolationException(String message) {
        super(message);
    }
}
