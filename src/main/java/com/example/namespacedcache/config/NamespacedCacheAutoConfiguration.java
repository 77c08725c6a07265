package com.example.namespacedcache.config;

import com.example.namespacedcache.cache.CacheStore;
import com.example.namespacedcache.cache.NamespacedCacheClient;
import com.example.namespacedcache.kv.KvClient;
import com.example.namespacedcache.kv.RedisKvClient;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires a {@link CacheStore} from {@code cache.redis.*}. Runs ahead of Spring Boot's Redis
 * auto-configuration so the connection factory defined here is the only one.
 */
@AutoConfiguration(before = RedisAutoConfiguration.class)
@ConditionalOnProperty(prefix = "cache.redis", name = "address")
@EnableConfigurationProperties(RedisCacheProperties.class)
public class NamespacedCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LettuceConnectionFactory namespacedCacheConnectionFactory(RedisCacheProperties properties) {
        return RedisConnectionFactories.create(properties.getAddress(), properties.getPassword(), properties.toOptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public KvClient namespacedCacheKvClient(LettuceConnectionFactory namespacedCacheConnectionFactory) {
        return new RedisKvClient(new StringRedisTemplate(namespacedCacheConnectionFactory));
    }

    @Bean
    @ConditionalOnMissingBean(CacheStore.class)
    public NamespacedCacheClient namespacedCacheClient(KvClient kvClient, RedisCacheProperties properties) {
        return new NamespacedCacheClient(kvClient, properties.toOptions().getNamespace());
    }
}
