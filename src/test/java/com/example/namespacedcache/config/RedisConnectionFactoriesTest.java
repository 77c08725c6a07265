package com.example.namespacedcache.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.cluster.ClusterClientOptions;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RedisConnectionFactoriesTest {

    private static final String ADDRESS = "redis.internal:6380";

    @Test
    void testCreate_ClusterWithTls() {
        // When
        LettuceConnectionFactory factory = RedisConnectionFactories.create(ADDRESS, "secret", CacheClientOptions.builder().build());

        // Then
        assertTrue(factory.isClusterAware());
        assertTrue(factory.isUseSsl());

        RedisClusterConfiguration cluster = factory.getClusterConfiguration();
        assertNotNull(cluster);
        assertEquals(1, cluster.getClusterNodes().size());
        RedisNode node = cluster.getClusterNodes().iterator().next();
        assertEquals("redis.internal", node.getHost());
        assertEquals(6380, node.getPort());
        assertTrue(cluster.getPassword().isPresent());
    }

    @Test
    void testCreate_ClusterTlsAllowsOnlyTls12AndNewer() {
        // When
        LettuceConnectionFactory factory = RedisConnectionFactories.create(ADDRESS, "secret", CacheClientOptions.builder().build());

        // Then
        ClientOptions clientOptions = factory.getClientConfiguration().getClientOptions().orElseThrow();
        assertInstanceOf(ClusterClientOptions.class, clientOptions);

        String[] protocols = clientOptions.getSslOptions().createSSLParameters().getProtocols();
        assertArrayEquals(new String[] {"TLSv1.3", "TLSv1.2"}, protocols);
    }

    @Test
    void testCreate_ClusterWithoutTls() {
        // Given
        CacheClientOptions options = CacheClientOptions.builder().tls(false).build();

        // When
        LettuceConnectionFactory factory = RedisConnectionFactories.create(ADDRESS, "", options);

        // Then
        assertTrue(factory.isClusterAware());
        assertFalse(factory.isUseSsl());
        assertFalse(factory.getClusterConfiguration().getPassword().isPresent());

        ClientOptions clientOptions = factory.getClientConfiguration().getClientOptions().orElseThrow();
        assertInstanceOf(ClusterClientOptions.class, clientOptions);
        String[] protocols = clientOptions.getSslOptions().createSSLParameters().getProtocols();
        assertTrue(protocols == null || protocols.length == 0);
    }

    @Test
    void testCreate_SingleNodeIgnoresTls() {
        // Given
        CacheClientOptions options = CacheClientOptions.builder().clusterMode(false).tls(true).build();

        // When
        LettuceConnectionFactory factory = RedisConnectionFactories.create(ADDRESS, "secret", options);

        // Then
        assertFalse(factory.isClusterAware());
        assertFalse(factory.isUseSsl());

        RedisStandaloneConfiguration standalone = factory.getStandaloneConfiguration();
        assertEquals("redis.internal", standalone.getHostName());
        assertEquals(6380, standalone.getPort());
        assertEquals(0, standalone.getDatabase());
    }

    @Test
    void testCreate_CommandTimeout() {
        // Given
        CacheClientOptions options = CacheClientOptions.builder()
                .clusterMode(false)
                .commandTimeout(Duration.ofSeconds(2))
                .build();

        // When
        LettuceConnectionFactory factory = RedisConnectionFactories.create(ADDRESS, null, options);

        // Then
        assertEquals(Duration.ofSeconds(2), factory.getClientConfiguration().getCommandTimeout());
    }

    @Test
    void testParse_InvalidAddresses() {
        // When / Then
        assertThrows(IllegalArgumentException.class, () -> RedisConnectionFactories.HostAndPort.parse(""));
        assertThrows(IllegalArgumentException.class, () -> RedisConnectionFactories.HostAndPort.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> RedisConnectionFactories.HostAndPort.parse(":6379"));
        assertThrows(IllegalArgumentException.class, () -> RedisConnectionFactories.HostAndPort.parse("localhost:"));
        assertThrows(IllegalArgumentException.class, () -> RedisConnectionFactories.HostAndPort.parse("localhost:redis"));
        assertThrows(IllegalArgumentException.class, () -> RedisConnectionFactories.HostAndPort.parse("localhost:70000"));
    }

    @Test
    void testParse_HostAndPort() {
        // When
        RedisConnectionFactories.HostAndPort node = RedisConnectionFactories.HostAndPort.parse("127.0.0.1:6379");

        // Then
        assertEquals("127.0.0.1", node.host());
        assertEquals(6379, node.port());
        assertEquals("127.0.0.1:6379", node.toString());
    }
}
