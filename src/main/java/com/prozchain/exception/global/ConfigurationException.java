package com.prozchain.exception.global;

import com.prozchain.exception.ConsensusGenericException;

public class ConfigurationException extends ConsensusGenericException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
