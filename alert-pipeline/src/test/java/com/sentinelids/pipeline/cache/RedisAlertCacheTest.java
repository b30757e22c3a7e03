package com.sentinelids.pipeline.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelids.pipeline.stream.FieldCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisAlertCacheTest {

    private ValueOperations<String, String> values;
    private SimpleMeterRegistry registry;
    private RedisAlertCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(values);
        registry = new SimpleMeterRegistry();
        cache = new RedisAlertCache(template, new FieldCodec(new ObjectMapper()), registry);
    }

    @Test
    void shouldStoreJsonWithTtl() {
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("id", 7);
        alert.put("ml_prediction", 1);

        assertTrue(cache.put(AlertCache.recentAlertKey(7), alert, Duration.ofSeconds(3600)));

        verify(values).set("recent_alert_7", "{\"id\":7,\"ml_prediction\":1}", 3_600_000L, TimeUnit.MILLISECONDS);
    }

    @Test
    void shouldSwallowWriteFailures() {
        doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(values).set(anyString(), anyString(), anyLong(), eq(TimeUnit.MILLISECONDS));

        assertFalse(cache.put("recent_alert_1", "{}", Duration.ofSeconds(60)));
        assertEquals(1.0, registry.get("sentinel.cache.failures").counter().count());
    }

    @Test
    void shouldSwallowReadFailures() {
        when(values.get("recent_alert_1")).thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertEquals(Optional.empty(), cache.get("recent_alert_1"));
    }

    @Test
    void shouldBuildRecentAlertKey() {
        assertEquals("recent_alert_42", AlertCache.recentAlertKey(42));
    }
}
