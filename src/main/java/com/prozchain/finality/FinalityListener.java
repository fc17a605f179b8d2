package com.prozchain.finality;

/**
 * Notified once per finalized block, in ascending height order.
 */
public interface FinalityListener {

    void blockFinalized(FinalityEvent event);
}
