package com.example.namespacedcache.cache;

/**
 * Base type for failures raised by a {@link CacheStore}. Carries the key sent to the backend,
 * which already includes the namespace prefix.
 */
public abstract class CacheException extends RuntimeException {

    private final String key;

    protected CacheException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * @return the namespaced key the failed operation addressed, or {@code null} when the failure
     *         was detected before a key was resolved.
     */
    public String getKey() {
        return key;
    }
}
