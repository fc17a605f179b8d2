package com.prozchain.utils;

import com.prozchain.types.Hash256;
import com.prozchain.types.Hash512;
import lombok.experimental.UtilityClass;
import lombok.extern.java.Log;
import org.bouncycastle.crypto.generators.Ed25519KeyPairGenerator;
import org.bouncycastle.crypto.params.Ed25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.javatuples.Pair;

import java.security.SecureRandom;

/**
 * Ed25519 helpers over BouncyCastle. Key pairs are returned as (publicKey, privateKey).
 */
@Log
@UtilityClass
public class Ed25519Utils {

    private static final SecureRandom RANDOM = new SecureRandom();

    public static Pair<byte[], byte[]> generateKeyPair() {
        Ed25519KeyPairGenerator generator = new Ed25519KeyPairGenerator();
        generator.init(new Ed25519KeyGenerationParameters(RANDOM));
        var keyPair = generator.generateKeyPair();

        byte[] privateKey = ((Ed25519PrivateKeyParameters) keyPair.getPrivate()).getEncoded();
        byte[] publicKey = ((Ed25519PublicKeyParameters) keyPair.getPublic()).getEncoded();
        return new Pair<>(publicKey, privateKey);
    }

    public static byte[] publicKeyFromPrivate(byte[] privateKey) {
        return new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
    }

    public static Hash512 signMessage(byte[] privateKey, byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, new Ed25519PrivateKeyParameters(privateKey, 0));
        signer.update(message, 0, message.length);
        return new Hash512(signer.generateSignature());
    }

    public static boolean verifySignature(Hash512 signature, byte[] message, Hash256 publicKey) {
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey.getBytes(), 0));
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature.getBytes());
        } catch (IllegalArgumentException e) {
            log.fine("Malformed ed25519 public key: " + e.getMessage());
            return false;
        }
    }
}
