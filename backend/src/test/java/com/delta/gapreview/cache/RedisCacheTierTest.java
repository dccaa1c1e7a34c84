package com.delta.gapreview.cache;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheTierTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCacheTier tier;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        tier = new RedisCacheTier(redisTemplate, objectMapper, clock, new ReviewProperties());
    }

    @Test
    void writesPrefixedJsonWithRemainingTtl() throws Exception {
        CacheEntry entry = CacheEntry.of("[1]", clock.instant(), Duration.ofMinutes(30));

        tier.put("search:docker", entry);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("gapreview:cache:search:docker"), json.capture(), eq(Duration.ofMinutes(30)));
        assertThat(objectMapper.readValue(json.getValue(), CacheEntry.class)).isEqualTo(entry);
    }

    @Test
    void readsStoredEntry() throws Exception {
        CacheEntry entry = CacheEntry.of("[1]", clock.instant(), Duration.ofMinutes(30));
        when(valueOperations.get("gapreview:cache:search:docker")).thenReturn(objectMapper.writeValueAsString(entry));

        Optional<CacheEntry> found = tier.get("search:docker");

        assertThat(found).contains(entry);
    }

    @Test
    void missingKeyIsEmpty() {
        when(valueOperations.get(anyString())).thenReturn(null);
        assertThat(tier.get("search:none")).isEmpty();
    }

    @Test
    void clearDeletesOnlyPrefixedKeys() {
        Set<String> keys = Set.of("gapreview:cache:a", "gapreview:cache:b");
        when(redisTemplate.keys("gapreview:cache:*")).thenReturn(keys);

        tier.clear();

        verify(redisTemplate).delete(keys);
    }
}
