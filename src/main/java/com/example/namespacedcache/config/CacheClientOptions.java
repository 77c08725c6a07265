package com.example.namespacedcache.config;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved construction options for a cache client. TLS only applies in cluster mode.
 */
@Value
@Builder
public class CacheClientOptions {

    @Builder.Default
    String namespace = "";

    @Builder.Default
    boolean clusterMode = true;

    @Builder.Default
    boolean tls = true;

    /** Lettuce command timeout; {@code null} keeps the driver default. */
    Duration commandTimeout;
}
