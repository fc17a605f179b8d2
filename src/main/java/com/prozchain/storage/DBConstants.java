package com.prozchain.storage;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DBConstants {

    public static final String FINALIZED_BLOCK = "fin::block::";
    public static final String FINALIZED_RECORD = "fin::record::";
    public static final String LAST_FINALIZED_HEIGHT = "fin::lastHeight";

    public static final String CHECKPOINT = "cp::";
    public static final String LATEST_CHECKPOINT_HEIGHT = "cp::latest";

    public static final String SLASHING_EVIDENCE = "slash::";

    public static final String KEY_STORE = "keys::";

    public static final String VALIDATOR_SET = "vset::";
    public static final String LATEST_EPOCH = "vset::latest";
    public static final String VALIDATOR = "val::";

    public static final String EPOCH_RANDOMNESS = "epoch::rand::";
}
