package com.prozchain.finality;

import com.prozchain.types.Hash256;
import lombok.Builder;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;

/**
 * Persisted metadata of a finalized height. Permanent once written.
 */
@Getter
@Builder
public class FinalityRecord implements Serializable {

    private final long height;
    private final Hash256 blockHash;
    private final Hash256 stateRoot;
    private final long round;
    private final FinalityJustification justification;
    /**
     * The block whose certificate, checkpoint or depth finalized this one. Equals {@link #blockHash} unless
     * this block was finalized as an ancestor.
     */
    private final Hash256 justifiedBy;
    @Nullable
    private final QuorumCertificate certificate;
}
