package com.example.namespacedcache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Externalized configuration for the namespaced cache, bound from {@code cache.redis.*}.
 */
@Data
@ConfigurationProperties(prefix = "cache.redis")
public class RedisCacheProperties {

    /**
     * Redis server address as host:port.
     */
    private String address;

    private String password;

    /**
     * Prefix applied to every key, separated with ':'. Empty means keys are used verbatim.
     */
    private String namespace;

    /**
     * Production clients run in cluster mode. Local setups without a cluster should set this.
     */
    private boolean disableClusterMode = false;

    /**
     * TLS only applies in cluster mode. Local setups without TLS should set this.
     */
    private boolean disableTls = false;

    private Duration commandTimeout;

    public CacheClientOptions toOptions() {
        CacheClientOptions.CacheClientOptionsBuilder options = CacheClientOptions.builder()
                .clusterMode(!disableClusterMode)
                .tls(!disableTls)
                .commandTimeout(commandTimeout);
        if (StringUtils.hasText(namespace)) {
            options.namespace(namespace);
        }
        return options.build();
    }
}
