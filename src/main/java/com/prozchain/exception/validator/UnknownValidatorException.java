package com.prozchain.exception.validator;

import com.prozchain.exception.ConsensusGenericException;

public class UnknownValidatorException extends ConsensusGenericException {

    public UnknownValidatorException(String message) {
        super(message);
    }
}
