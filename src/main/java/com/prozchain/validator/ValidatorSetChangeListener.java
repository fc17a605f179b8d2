package com.prozchain.validator;

public interface ValidatorSetChangeListener {

    void validatorSetChanged(ValidatorSetChangeEvent event);
}
