package com.example.namespacedcache.cache;

public class CacheGetException extends CacheException {

    public CacheGetException(String key, Throwable cause) {
        super("failed to get key " + key + ": " + cause.getMessage(), key, cause);
    }
}
