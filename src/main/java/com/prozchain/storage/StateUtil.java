package com.prozchain.storage;

import com.prozchain.types.Hash256;
import lombok.experimental.UtilityClass;

@UtilityClass
public class StateUtil {

    // Heights are zero padded so prefix scans return them in order.
    public static String generateHeightKey(String prefix, long height) {
        return prefix + String.format("%020d", height);
    }

    public static String generateEpochKey(String prefix, long epoch) {
        return prefix + String.format("%020d", epoch);
    }

    public static String generateHashKey(String prefix, Hash256 hash) {
        return prefix + hash;
    }
}
