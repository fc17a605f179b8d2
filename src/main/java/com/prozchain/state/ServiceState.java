package com.prozchain.state;

public interface ServiceState {

    void initializeFromDatabase();

    void persistState();
}
