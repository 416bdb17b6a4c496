package com.eventspotter.catalog.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Facet values cached as JSON arrays in Redis.
 * Every failure is logged and reported as a miss so that callers fall back to the database.
 */
@Component
public class RedisFacetCache implements FacetCacheStrategy {

    private static final Logger logger = LoggerFactory.getLogger(RedisFacetCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final FacetCacheConfig config;

    public RedisFacetCache(StringRedisTemplate redisTemplate,
                           ObjectMapper objectMapper,
                           FacetCacheConfig config) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public Optional<List<String>> get(FacetType facet) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }

        try {
            String cachedJson = redisTemplate.opsForValue().get(cacheKey(facet));
            if (cachedJson == null || cachedJson.isEmpty()) {
                logger.debug("Cache miss for facet {}", facet);
                return Optional.empty();
            }

            List<String> values = objectMapper.readValue(cachedJson, new TypeReference<>() {});
            logger.debug("Cache hit for facet {}: {} values", facet, values.size());
            return Optional.of(values);

        } catch (Exception e) {
            logger.warn("Failed to read facet {} from cache: {}", facet, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(FacetType facet, List<String> values) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(values);
            redisTemplate.opsForValue().set(cacheKey(facet), json, config.getTtlMinutes(), TimeUnit.MINUTES);
            logger.debug("Cached facet {} with {} values (TTL: {}m)", facet, values.size(), config.getTtlMinutes());

        } catch (Exception e) {
            logger.warn("Failed to cache facet {}: {}", facet, e.getMessage());
        }
    }

    @Override
    public void invalidateAll() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            List<String> keys = Arrays.stream(FacetType.values()).map(this::cacheKey).toList();
            Long deleted = redisTemplate.delete(keys);
            logger.debug("Invalidated {} cached facets", deleted);

        } catch (Exception e) {
            logger.warn("Failed to invalidate cached facets: {}", e.getMessage());
        }
    }

    private String cacheKey(FacetType facet) {
        return config.getKeyPrefix() + facet.keySuffix(); // e.g. "eventspotter:facets:categories"
    }
}
