package com.example.namespacedcache.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.cluster.ClusterClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Builds the Lettuce connection factory behind a cache client. Cluster mode gets a cluster-aware
 * factory, optionally over TLS 1.2+; otherwise a single-node factory on database 0 without TLS.
 */
public final class RedisConnectionFactories {

    private static final Logger logger = LoggerFactory.getLogger(RedisConnectionFactories.class);

    static final String[] TLS_PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    private RedisConnectionFactories() {
    }

    /**
     * Creates an uninitialized factory. Callers own it and must call
     * {@link LettuceConnectionFactory#afterPropertiesSet()} before use and
     * {@link LettuceConnectionFactory#destroy()} when done.
     */
    public static LettuceConnectionFactory create(String address, String password, CacheClientOptions options) {
        HostAndPort node = HostAndPort.parse(address);

        if (options.isClusterMode()) {
            RedisClusterConfiguration cluster = new RedisClusterConfiguration(List.of(node.toString()));
            if (StringUtils.hasText(password)) {
                cluster.setPassword(password);
            }

            LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder();
            ClusterClientOptions.Builder clientOptions = ClusterClientOptions.builder();
            if (options.isTls()) {
                client.useSsl();
                clientOptions.sslOptions(SslOptions.builder().protocols(TLS_PROTOCOLS).build());
            }
            client.clientOptions(clientOptions.build());
            if (options.getCommandTimeout() != null) {
                client.commandTimeout(options.getCommandTimeout());
            }

            logger.info("Creating cluster-aware Redis connection factory for {}", node);
            logger.debug("TLS {} for {}", options.isTls() ? "enabled (minimum TLSv1.2)" : "disabled", node);
            return new LettuceConnectionFactory(cluster, client.build());
        }

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(node.host(), node.port());
        standalone.setDatabase(0);
        if (StringUtils.hasText(password)) {
            standalone.setPassword(password);
        }

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .clientOptions(ClientOptions.create());
        if (options.getCommandTimeout() != null) {
            client.commandTimeout(options.getCommandTimeout());
        }

        if (options.isTls()) {
            logger.debug("Ignoring TLS for single-node connection to {}", node);
        }
        logger.info("Creating single-node Redis connection factory for {}", node);
        return new LettuceConnectionFactory(standalone, client.build());
    }

    static final class HostAndPort {

        private final String host;
        private final int port;

        private HostAndPort(String host, int port) {
            this.host = host;
            this.port = port;
        }

        static HostAndPort parse(String address) {
            Assert.hasText(address, "Redis address must not be empty");
            int separator = address.lastIndexOf(':');
            if (separator <= 0 || separator == address.length() - 1) {
                throw new IllegalArgumentException("Redis address must be host:port, got '" + address + "'");
            }

            int port;
            try {
                port = Integer.parseInt(address.substring(separator + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in Redis address '" + address + "'", e);
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range in Redis address '" + address + "'");
            }
            return new HostAndPort(address.substring(0, separator), port);
        }

        String host() {
            return host;
        }

        int port() {
            return port;
        }

        @Override
        public String toString() {
            return host + ":" + port;
        }
    }
}
