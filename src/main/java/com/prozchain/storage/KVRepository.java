package com.prozchain.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key-value boundary to the node's storage engine.
 */
public interface KVRepository<K, V> {

    boolean save(K key, V value);

    Optional<V> find(K key);

    /**
     * @return the stored value cast to the type of the default, or the default if absent
     */
    <T> T find(K key, T defaultValue);

    boolean delete(K key);

    List<K> findKeysByPrefix(String prefix, int limit);
}
