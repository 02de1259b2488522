package com.company.forecasting.cache;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.exception.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static com.company.forecasting.support.TestSeries.KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisModelBlobStorage")
class RedisModelBlobStorageTest {

    @Mock
    private RedisTemplate<String, byte[]> redisTemplate;

    @Mock
    private ValueOperations<String, byte[]> valueOperations;

    private RedisModelBlobStorage storage;

    @BeforeEach
    void setUp() {
        ForecastingProperties properties = new ForecastingProperties();
        properties.getModelStore().setKeyPrefix("test:model:");
        properties.getModelStore().setTtl(Duration.ofDays(7));
        storage = new RedisModelBlobStorage(redisTemplate, properties);
    }

    @Test
    @DisplayName("Keys combine the prefix with entity and metric")
    void redisKey() {
        assertThat(storage.redisKey(KEY)).isEqualTo("test:model:vm-01:cpu.usage.average");
    }

    @Test
    @DisplayName("Saves blobs with the configured TTL")
    void saveWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        byte[] blob = {1, 2, 3};

        storage.save(KEY, blob);

        verify(valueOperations).set("test:model:vm-01:cpu.usage.average", blob, Duration.ofDays(7));
    }

    @Test
    @DisplayName("Missing keys load as empty")
    void missingKey() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn(null);

        assertThat(storage.load(KEY)).isEmpty();
    }

    @Test
    @DisplayName("Stored blobs are returned")
    void loadsBlob() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("test:model:vm-01:cpu.usage.average")).thenReturn(new byte[]{7});

        assertThat(storage.load(KEY)).hasValueSatisfying(blob -> assertThat(blob).containsExactly(7));
    }

    @Test
    @DisplayName("Connection failures surface as storage unavailable")
    void connectionFailure() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), any(byte[].class), eq(Duration.ofDays(7)));

        assertThatThrownBy(() -> storage.load(KEY))
                .isInstanceOf(StorageUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
        assertThatThrownBy(() -> storage.save(KEY, new byte[]{1}))
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("Deletes the key")
    void delete() {
        when(redisTemplate.delete("test:model:vm-01:cpu.usage.average")).thenReturn(true);

        storage.delete(KEY);

        verify(redisTemplate).delete("test:model:vm-01:cpu.usage.average");
    }
}
