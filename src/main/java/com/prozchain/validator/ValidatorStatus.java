package com.prozchain.validator;

public enum ValidatorStatus {
    ACTIVE,
    QUEUED,
    EJECTED
}
