package com.example.namespacedcache.cache;

/**
 * The key does not exist in the backend, either because it was never set or because its expiry
 * has passed. Callers treat this as a cache miss.
 */
public class KeyNotFoundException extends CacheException {

    public KeyNotFoundException(String key) {
        super("key " + key + " not found", key, null);
    }
}
