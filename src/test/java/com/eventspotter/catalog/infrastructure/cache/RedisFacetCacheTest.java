package com.eventspotter.catalog.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisFacetCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private FacetCacheConfig config;
    private RedisFacetCache cache;

    @BeforeEach
    void setUp() {
        config = new FacetCacheConfig();
        cache = new RedisFacetCache(redisTemplate, new ObjectMapper(), config);
    }

    @Test
    void shouldReadCachedFacetFromJson() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("eventspotter:facets:categories")).thenReturn("[\"Art\",\"Music\"]");

        // When
        Optional<List<String>> result = cache.get(FacetType.CATEGORIES);

        // Then
        assertThat(result).contains(List.of("Art", "Music"));
    }

    @Test
    void shouldReportMissForAbsentKey() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("eventspotter:facets:raw-tags")).thenReturn(null);

        // When & Then
        assertThat(cache.get(FacetType.RAW_TAGS)).isEmpty();
    }

    @Test
    void shouldTreatRedisFailureAsMiss() {
        // Given
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("refused"));

        // When & Then
        assertThat(cache.get(FacetType.CATEGORIES)).isEmpty();
    }

    @Test
    void shouldTreatCorruptEntryAsMiss() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("eventspotter:facets:categories")).thenReturn("{not json");

        // When & Then
        assertThat(cache.get(FacetType.CATEGORIES)).isEmpty();
    }

    @Test
    void shouldWriteFacetWithConfiguredTtl() {
        // Given
        config.setTtlMinutes(7);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        // When
        cache.put(FacetType.CATEGORIES, List.of("Art"));

        // Then
        verify(valueOperations).set("eventspotter:facets:categories", "[\"Art\"]", 7L, TimeUnit.MINUTES);
    }

    @Test
    void shouldDeleteEveryFacetKeyOnInvalidation() {
        // When
        cache.invalidateAll();

        // Then
        verify(redisTemplate).delete(List.of("eventspotter:facets:categories", "eventspotter:facets:raw-tags"));
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        // Given
        config.setEnabled(false);

        // When
        Optional<List<String>> result = cache.get(FacetType.CATEGORIES);
        cache.put(FacetType.CATEGORIES, List.of("Art"));
        cache.invalidateAll();

        // Then
        assertThat(result).isEmpty();
        verifyNoInteractions(redisTemplate);
    }

    @Test
    void shouldSwallowInvalidationFailure() {
        // Given
        when(redisTemplate.delete(anyList())).thenThrow(new RedisConnectionFailureException("refused"));

        // When
        cache.invalidateAll();

        // Then
        verify(redisTemplate).delete(anyList());
    }
}
