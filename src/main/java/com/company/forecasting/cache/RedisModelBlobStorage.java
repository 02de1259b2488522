package com.company.forecasting.cache;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.exception.StorageUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Model blobs in Redis under {@code <prefix><entity>:<metric>}, expiring after the configured TTL.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "forecasting.model-store.type",
        havingValue = "redis",
        matchIfMissing = true
)
public class RedisModelBlobStorage implements ModelBlobStorage {

    static final String CIRCUIT_BREAKER = "model-store";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisModelBlobStorage(@Qualifier("modelRedisTemplate") RedisTemplate<String, byte[]> redisTemplate,
                                 ForecastingProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getModelStore().getKeyPrefix();
        this.ttl = properties.getModelStore().getTtl();
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "saveFallback")
    public void save(SeriesKey key, byte[] blob) {
        try {
            redisTemplate.opsForValue().set(redisKey(key), blob, ttl);
            log.debug("Stored model blob for {} ({} bytes, ttl {})", key, blob.length, ttl);
        } catch (RuntimeException e) {
            throw new StorageUnavailableException(key, "save", e);
        }
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "loadFallback")
    public Optional<byte[]> load(SeriesKey key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key)));
        } catch (RuntimeException e) {
            throw new StorageUnavailableException(key, "load", e);
        }
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "deleteFallback")
    public void delete(SeriesKey key) {
        try {
            Boolean deleted = redisTemplate.delete(redisKey(key));
            if (Boolean.TRUE.equals(deleted)) {
                log.debug("Deleted model blob for {}", key);
            }
        } catch (RuntimeException e) {
            throw new StorageUnavailableException(key, "delete", e);
        }
    }

    String redisKey(SeriesKey key) {
        return keyPrefix + key.asStorageId();
    }

    // Fallbacks run when the call failed or the breaker is open

    private void saveFallback(SeriesKey key, byte[] blob, Throwable t) {
        throw unavailable(key, "save", t);
    }

    private Optional<byte[]> loadFallback(SeriesKey key, Throwable t) {
        throw unavailable(key, "load", t);
    }

    private void deleteFallback(SeriesKey key, Throwable t) {
        throw unavailable(key, "delete", t);
    }

    private static StorageUnavailableException unavailable(SeriesKey key, String operation, Throwable t) {
        if (t instanceof StorageUnavailableException storageUnavailable) {
            return storageUnavailable;
        }
        log.warn("Model store circuit rejected {} for {}: {}", operation, key, t.getMessage());
        return new StorageUnavailableException(key, operation, t);
    }
}
