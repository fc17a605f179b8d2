package com.prozchain.storage;

import lombok.extern.java.Log;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

@Log
public class InMemoryRepository implements KVRepository<String, Object> {

    private final Map<String, Object> storage = new ConcurrentSkipListMap<>();

    @Override
    public boolean save(String key, Object value) {
        storage.put(key, value);
        return true;
    }

    @Override
    public Optional<Object> find(String key) {
        return Optional.ofNullable(storage.get(key));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T find(String key, T defaultValue) {
        Object value = storage.get(key);
        return value != null ? (T) value : defaultValue;
    }

    @Override
    public boolean delete(String key) {
        return storage.remove(key) != null;
    }

    @Override
    public List<String> findKeysByPrefix(String prefix, int limit) {
        return storage.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .limit(limit)
                .toList();
    }
}
