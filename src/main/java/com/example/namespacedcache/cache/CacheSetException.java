package com.example.namespacedcache.cache;

public class CacheSetException extends CacheException {

    public CacheSetException(String key, Throwable cause) {
        super("failed to set key " + key + ": " + cause.getMessage(), key, cause);
    }
}
