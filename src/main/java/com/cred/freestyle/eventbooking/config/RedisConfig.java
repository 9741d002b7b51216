package com.cred.freestyle.eventbooking.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;

/**
 * Redis wiring for the distributed lock.
 *
 * Redis only ever sees short SET NX PX / EVAL round trips from this service, so command and
 * connect timeouts are tight: a slow Redis must fail the lock attempt quickly rather than stall
 * a request thread. stringRedisTemplate comes from Spring Boot's RedisAutoConfiguration.
 *
 * @author Event Booking Team
 */
@Configuration
public class RedisConfig {

    static final String LOCK_RELEASE_LUA =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "return redis.call('del', KEYS[1]) " +
            "else return 0 end";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    @Bean
    public RedisConnectionFactory redisConnectionFactory(RedisProperties properties) {
        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                properties.getHost(), properties.getPort());
        server.setDatabase(properties.getDatabase());
        if (properties.getPassword() != null && !properties.getPassword().isEmpty()) {
            server.setPassword(properties.getPassword());
        }

        Duration timeout = properties.getTimeout() != null ? properties.getTimeout() : DEFAULT_TIMEOUT;

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(timeout)
                        .keepAlive(true)
                        .build())
                .autoReconnect(true)
                .build();

        LettucePoolingClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .poolConfig(lockPoolConfig(properties.getLettuce().getPool()))
                .clientOptions(clientOptions)
                .commandTimeout(timeout)
                .build();

        return new LettuceConnectionFactory(server, clientConfig);
    }

    private static GenericObjectPoolConfig<?> lockPoolConfig(RedisProperties.Pool pool) {
        GenericObjectPoolConfig<?> config = new GenericObjectPoolConfig<>();
        if (pool != null) {
            config.setMaxTotal(pool.getMaxActive());
            config.setMaxIdle(pool.getMaxIdle());
            config.setMinIdle(pool.getMinIdle());
            if (pool.getMaxWait() != null) {
                config.setMaxWait(pool.getMaxWait());
            }
        }
        // Idle validation only, no PING on borrow
        config.setTestWhileIdle(true);
        return config;
    }

    /**
     * Compare-and-delete script for releasing a distributed lock.
     * Deletes the key only while it still holds the caller's token, in one atomic step.
     *
     * @return Lock release script returning 1 if deleted, 0 otherwise
     */
    @Bean
    public RedisScript<Long> lockReleaseScript() {
        return new DefaultRedisScript<>(LOCK_RELEASE_LUA, Long.class);
    }
}
