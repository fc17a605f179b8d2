package com.prozchain.state;

import lombok.Getter;

public abstract class AbstractState implements ServiceState {

    @Getter
    protected boolean initialized;

    @Override
    public void initializeFromDatabase() {
        //Do nothing
    }

    @Override
    public void persistState() {
        //Do nothing
    }
}
