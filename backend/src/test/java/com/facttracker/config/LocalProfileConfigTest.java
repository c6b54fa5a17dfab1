package com.facttracker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the "local" profile settings used by single-instance deployments.
 */
@DisplayName("Local Profile Configuration Tests")
class LocalProfileConfigTest {

    private PropertySource<?> load(String resource) throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load(resource, new ClassPathResource(resource));
        assertEquals(1, sources.size());
        return sources.get(0);
    }

    @Test
    @DisplayName("local profile selects the in-process lock and turns off the Redis health check")
    void testLocalProfile_NoRedisDependency() throws IOException {
        // Act
        PropertySource<?> local = load("application-local.yml");

        // Assert
        assertEquals("local", String.valueOf(local.getProperty("app.facts.write-lock.mode")));
        assertEquals("false", String.valueOf(local.getProperty("management.health.redis.enabled")));
    }

    @Test
    @DisplayName("default configuration keeps the Redis lock and its health check")
    void testDefaultProfile_RedisLock() throws IOException {
        // Act
        PropertySource<?> defaults = load("application.yml");

        // Assert
        assertEquals("${FACTS_WRITE_LOCK_MODE:redis}", String.valueOf(defaults.getProperty("app.facts.write-lock.mode")));
        assertEquals("${REDIS_HEALTH_ENABLED:true}",
                String.valueOf(defaults.getProperty("management.health.redis.enabled")));
    }
}
