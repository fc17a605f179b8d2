package com.prozchain.storage.crypto;

import com.prozchain.storage.DBConstants;
import com.prozchain.storage.KVRepository;
import com.prozchain.types.Hash256;
import com.prozchain.types.Hash512;
import com.prozchain.utils.Ed25519Utils;
import com.prozchain.validator.ValidatorId;
import lombok.extern.java.Log;
import org.javatuples.Pair;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Ed25519 signing keys of the local node, stored by public key.
 */
@Log
@Component
public class ValidatorKeyStore {

    private final KVRepository<String, Object> repository;

    public ValidatorKeyStore(KVRepository<String, Object> repository) {
        this.repository = repository;
    }

    public void put(byte[] publicKey, byte[] privateKey) {
        repository.save(getKey(publicKey), privateKey);
    }

    public byte[] get(byte[] publicKey) {
        return (byte[]) repository.find(getKey(publicKey)).orElse(null);
    }

    public boolean contains(byte[] publicKey) {
        return get(publicKey) != null;
    }

    /**
     * Creates and stores a fresh key pair.
     *
     * @return the validator identity of the new key
     */
    public ValidatorId generate() {
        Pair<byte[], byte[]> keyPair = Ed25519Utils.generateKeyPair();
        put(keyPair.getValue0(), keyPair.getValue1());
        log.fine("Generated validator key " + ValidatorId.fromPublicKey(keyPair.getValue0()));
        return ValidatorId.fromPublicKey(keyPair.getValue0());
    }

    public List<ValidatorId> getValidatorIds() {
        return repository.findKeysByPrefix(DBConstants.KEY_STORE, 1000).stream()
                .map(key -> key.substring(DBConstants.KEY_STORE.length()))
                .map(Hash256::from)
                .map(ValidatorId::new)
                .toList();
    }

    /**
     * @return the key the node signs consensus messages with, if it holds one
     */
    public Optional<ValidatorId> getLocalValidator() {
        return getValidatorIds().stream().findFirst();
    }

    /**
     * @return Pair of (privateKey, publicKey)
     */
    public Optional<Pair<byte[], byte[]>> getKeyPair(ValidatorId validator) {
        byte[] publicKey = validator.getPublicKey().getBytes();
        byte[] privateKey = get(publicKey);
        if (privateKey != null) {
            return Optional.of(new Pair<>(privateKey, publicKey));
        }
        return Optional.empty();
    }

    public Optional<Hash512> sign(ValidatorId validator, byte[] message) {
        return getKeyPair(validator).map(pair -> Ed25519Utils.signMessage(pair.getValue0(), message));
    }

    private String getKey(byte[] publicKey) {
        return DBConstants.KEY_STORE + new Hash256(publicKey);
    }
}
