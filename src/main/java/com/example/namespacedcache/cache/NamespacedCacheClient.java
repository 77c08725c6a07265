package com.example.namespacedcache.cache;

import com.example.namespacedcache.config.CacheClientOptions;
import com.example.namespacedcache.config.RedisCacheProperties;
import com.example.namespacedcache.config.RedisConnectionFactories;
import com.example.namespacedcache.kv.KvClient;
import com.example.namespacedcache.kv.RedisKvClient;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link CacheStore} over a {@link KvClient} that prefixes every key with an optional namespace.
 *
 * <p>Instances are immutable and safe to share between threads. Clients created through
 * {@link #builder(String, String)} or {@link #fromProperties(RedisCacheProperties)} own their
 * Redis connection and release it on {@link #close()}.
 */
public class NamespacedCacheClient implements CacheStore, AutoCloseable {

    // Redis has no official namespace delimiter; ':' is the convention.
    static final String NAMESPACE_SEPARATOR = ":";

    private final KvClient kvClient;
    private final String namespace;
    private final LettuceConnectionFactory connectionFactory;

    public NamespacedCacheClient(KvClient kvClient, String namespace) {
        this(kvClient, namespace, null);
    }

    private NamespacedCacheClient(KvClient kvClient, String namespace, LettuceConnectionFactory connectionFactory) {
        Assert.notNull(kvClient, "KvClient must not be null");
        this.kvClient = kvClient;
        this.namespace = namespace == null ? "" : namespace;
        this.connectionFactory = connectionFactory;
    }

    public static Builder builder(String address, String password) {
        return new Builder(address, password);
    }

    public static NamespacedCacheClient fromProperties(RedisCacheProperties properties) {
        return create(properties.getAddress(), properties.getPassword(), properties.toOptions());
    }

    static NamespacedCacheClient create(String address, String password, CacheClientOptions options) {
        LettuceConnectionFactory factory = RedisConnectionFactories.create(address, password, options);
        initialize(factory, options);

        StringRedisTemplate template = new StringRedisTemplate(factory);
        return new NamespacedCacheClient(new RedisKvClient(template), options.getNamespace(), factory);
    }

    static void initialize(LettuceConnectionFactory factory, CacheClientOptions options) {
        // Cannot happen: the factory's topology follows directly from the options. Checked before
        // the factory starts.
        Assert.state(factory.isClusterAware() == options.isClusterMode(),
                () -> "Connection factory topology does not match cluster mode " + options.isClusterMode());
        factory.afterPropertiesSet();
    }

    @Override
    public void set(String key, String value, Duration expiry) {
        if (expiry == null || expiry.isZero() || expiry.isNegative()) {
            throw new InvalidExpiryException();
        }

        String namespacedKey = namespaceKey(key);
        try {
            kvClient.set(namespacedKey, value, expiry);
        } catch (RuntimeException e) {
            throw new CacheSetException(namespacedKey, e);
        }
    }

    @Override
    public String get(String key) {
        String namespacedKey = namespaceKey(key);

        Optional<String> value;
        try {
            value = kvClient.get(namespacedKey);
        } catch (RuntimeException e) {
            throw new CacheGetException(namespacedKey, e);
        }
        return value.orElseThrow(() -> new KeyNotFoundException(namespacedKey));
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * @return the connection factory this client owns, or {@code null} when it wraps an externally
     *         managed {@link KvClient}.
     */
    public LettuceConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    @Override
    public void close() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    String namespaceKey(String key) {
        if (!namespace.isEmpty()) {
            return namespace + NAMESPACE_SEPARATOR + key;
        }
        return key;
    }

    /**
     * Collects construction options. Cluster mode and TLS are on unless switched off; TLS is
     * ignored without cluster mode.
     */
    public static final class Builder {

        private final String address;
        private final String password;
        private final CacheClientOptions.CacheClientOptionsBuilder options = CacheClientOptions.builder();

        private Builder(String address, String password) {
            this.address = address;
            this.password = password;
        }

        public Builder namespace(String namespace) {
            options.namespace(namespace == null ? "" : namespace);
            return this;
        }

        public Builder clusterMode(boolean clusterMode) {
            options.clusterMode(clusterMode);
            return this;
        }

        public Builder tls(boolean tls) {
            options.tls(tls);
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            options.commandTimeout(commandTimeout);
            return this;
        }

        public NamespacedCacheClient build() {
            return create(address, password, options.build());
        }
    }
}
