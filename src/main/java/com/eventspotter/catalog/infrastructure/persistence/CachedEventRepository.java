package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventFilter;
import com.eventspotter.catalog.domain.port.out.EventRepository;
import com.eventspotter.catalog.infrastructure.cache.FacetCacheStrategy;
import com.eventspotter.catalog.infrastructure.cache.FacetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cached implementation of EventRepository using decorator pattern
 * Facet reads are served from the facet cache; every successful write invalidates it.
 * All other operations go straight to the wrapped repository.
 */
@Repository
@Primary
public class CachedEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(CachedEventRepository.class);

    private final EventRepository databaseRepository;
    private final FacetCacheStrategy cacheStrategy;

    public CachedEventRepository(
            @Qualifier("databaseEventRepository") EventRepository databaseRepository,
            FacetCacheStrategy cacheStrategy) {
        this.databaseRepository = databaseRepository;
        this.cacheStrategy = cacheStrategy;
    }

    @Override
    public List<Event> findPage(EventFilter filter) {
        return databaseRepository.findPage(filter);
    }

    @Override
    public long countMatching(EventFilter filter) {
        return databaseRepository.countMatching(filter);
    }

    @Override
    public Optional<Event> findById(UUID id) {
        return databaseRepository.findById(id);
    }

    @Override
    public List<Event> findByIds(Collection<UUID> ids) {
        return databaseRepository.findByIds(ids);
    }

    @Override
    public boolean existsById(UUID id) {
        return databaseRepository.existsById(id);
    }

    @Override
    public long countAll() {
        return databaseRepository.countAll();
    }

    @Override
    public Optional<Event> findAtOffset(long offset) {
        return databaseRepository.findAtOffset(offset);
    }

    @Override
    public Optional<Event> findFirst() {
        return databaseRepository.findFirst();
    }

    @Override
    public List<String> findDistinctCategories() {
        return cachedFacet(FacetType.CATEGORIES, databaseRepository::findDistinctCategories);
    }

    @Override
    public List<String> findDistinctRawTags() {
        return cachedFacet(FacetType.RAW_TAGS, databaseRepository::findDistinctRawTags);
    }

    @Override
    public Event insert(Event event) {
        Event inserted = databaseRepository.insert(event);
        invalidateCache();
        return inserted;
    }

    @Override
    public Event update(Event event) {
        Event updated = databaseRepository.update(event);
        invalidateCache();
        return updated;
    }

    @Override
    public void deleteById(UUID id) {
        databaseRepository.deleteById(id);
        invalidateCache();
    }

    private List<String> cachedFacet(FacetType facet, Supplier<List<String>> loader) {
        Optional<List<String>> cached = cacheStrategy.get(facet);
        if (cached.isPresent()) {
            return cached.get();
        }

        logger.debug("Cache miss for {} - fetching from database", facet);
        List<String> values = loader.get();
        cacheStrategy.put(facet, values);
        return values;
    }

    /**
     * Synchronous cache invalidation after database writes
     */
    private void invalidateCache() {
        try {
            cacheStrategy.invalidateAll();
        } catch (Exception e) {
            logger.warn("Cache invalidation failed after database write: {}", e.getMessage());
        }
    }
}
