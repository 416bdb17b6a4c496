package com.eventspotter.catalog.infrastructure.cache;

import java.util.List;
import java.util.Optional;

/**
 * Cache strategy abstraction for facet values
 * Allows different caching implementations without changing business logic
 */
public interface FacetCacheStrategy {

    /**
     * Try to get the cached values of a facet
     * @return Optional.empty() if cache miss, otherwise cached values
     */
    Optional<List<String>> get(FacetType facet);

    /**
     * Store facet values in cache
     */
    void put(FacetType facet, List<String> values);

    /**
     * Drop every cached facet; called before any event write
     */
    void invalidateAll();
}
