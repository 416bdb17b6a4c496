package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.port.out.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Distinct categories and tags across the whole corpus, independent of any filter.
 *
 * <p>Tags are stored as entered and normalized here: trimmed and lowercased, empty values
 * dropped, then deduplicated. Categories are compared as exact strings.
 */
@Service
public class EventFacets {

    private static final Logger logger = LoggerFactory.getLogger(EventFacets.class);

    private final EventRepository eventRepository;

    public EventFacets(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    public List<String> categories() {
        List<String> categories = eventRepository.findDistinctCategories().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .toList();

        logger.debug("Aggregated {} categories", categories.size());
        return categories;
    }

    public List<String> tags() {
        List<String> tags = normalizeTags(eventRepository.findDistinctRawTags());

        logger.debug("Aggregated {} tags", tags.size());
        return tags;
    }

    static List<String> normalizeTags(List<String> rawTags) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String tag : rawTags) {
            if (tag == null) {
                continue;
            }
            String canonical = tag.trim().toLowerCase(Locale.ROOT);
            if (!canonical.isEmpty()) {
                normalized.add(canonical);
            }
        }
        return List.copyOf(normalized);
    }
}
