package com.prozchain.exception.crypto;

import com.prozchain.exception.ConsensusGenericException;

public class InvalidSignatureException extends ConsensusGenericException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
