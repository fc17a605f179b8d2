package com.prozchain.finality;

public enum FinalityJustification {
    QUORUM_CERTIFICATE,
    ANCESTOR_OF_FINALIZED,
    CHECKPOINT,
    CONFIRMATION_DEPTH
}
