package com.prozchain.utils;

import com.prozchain.types.Hash256;
import lombok.experimental.UtilityClass;
import org.bouncycastle.jcajce.provider.digest.Blake2b;

@UtilityClass
public class HashUtils {

    public static byte[] hashWithBlake2b(byte[] input) {
        Blake2b.Blake2b256 blake2b256 = new Blake2b.Blake2b256();
        return blake2b256.digest(input);
    }

    public static Hash256 blake2bHash(byte[] input) {
        return new Hash256(hashWithBlake2b(input));
    }
}
