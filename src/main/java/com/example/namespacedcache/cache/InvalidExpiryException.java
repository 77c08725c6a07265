package com.example.namespacedcache.cache;

/**
 * Thrown by {@link CacheStore#set} when the expiry is not a positive duration. Raised before any
 * backend call.
 */
public class InvalidExpiryException extends CacheException {

    public InvalidExpiryException() {
        super("expiry must be greater than zero", null, null);
    }
}
