package com.example.namespacedcache.cache;

import java.time.Duration;

/**
 * String cache with mandatory expiry.
 */
public interface CacheStore {

    /**
     * Stores {@code value} under {@code key} for {@code expiry}.
     *
     * @throws InvalidExpiryException if {@code expiry} is not positive
     * @throws CacheSetException if the backend rejects or fails the write
     */
    void set(String key, String value, Duration expiry);

    /**
     * Returns the value stored under {@code key}.
     *
     * @throws KeyNotFoundException if the key is absent or expired
     * @throws CacheGetException if the backend fails the read
     */
    String get(String key);
}
