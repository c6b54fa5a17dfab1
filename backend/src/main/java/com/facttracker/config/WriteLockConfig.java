package com.facttracker.config;

import com.facttracker.service.lock.LocalUserWriteLock;
import com.facttracker.service.lock.RedisUserWriteLock;
import com.facttracker.service.lock.UserWriteLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Selects the per-user write lock implementation.
 *
 * Configuration Properties:
 * - app.facts.write-lock.mode: "redis" (default, shared across instances) or "local" (single JVM)
 * - app.facts.write-lock.acquire-timeout: longest wait before answering Busy (default: 2s)
 * - app.facts.write-lock.stripes: lock stripes in local mode (default: 64)
 * - app.facts.write-lock.lease: Redis key expiry in redis mode (default: 10s)
 * - app.facts.write-lock.retry-interval: Redis acquire polling interval (default: 25ms)
 */
@Configuration
public class WriteLockConfig {

    @Value("${app.facts.write-lock.acquire-timeout:2s}")
    private Duration acquireTimeout;

    @Bean
    @ConditionalOnProperty(name = "app.facts.write-lock.mode", havingValue = "local")
    public UserWriteLock localUserWriteLock(@Value("${app.facts.write-lock.stripes:64}") int stripes) {
        return new LocalUserWriteLock(stripes, acquireTimeout);
    }

    @Bean
    @ConditionalOnProperty(name = "app.facts.write-lock.mode", havingValue = "redis", matchIfMissing = true)
    public UserWriteLock redisUserWriteLock(
            @Qualifier("redisStringTemplate") RedisTemplate<String, String> redisStringTemplate,
            @Value("${app.facts.write-lock.lease:10s}") Duration lease,
            @Value("${app.facts.write-lock.retry-interval:25ms}") Duration retryInterval) {
        return new RedisUserWriteLock(redisStringTemplate, acquireTimeout, lease, retryInterval);
    }
}
