package com.eventspotter.catalog.infrastructure.web;

import com.eventspotter.catalog.application.EventFacets;
import com.eventspotter.catalog.application.FindEvents;
import com.eventspotter.catalog.application.ManageEvents;
import com.eventspotter.catalog.application.RandomEventPicker;
import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventFilter;
import com.eventspotter.catalog.domain.model.EventPage;
import com.eventspotter.catalog.domain.model.SortField;
import com.eventspotter.catalog.domain.model.SortOrder;
import com.eventspotter.catalog.infrastructure.web.dto.BatchGetRequest;
import com.eventspotter.catalog.infrastructure.web.dto.CategoriesResponse;
import com.eventspotter.catalog.infrastructure.web.dto.CreateEventRequest;
import com.eventspotter.catalog.infrastructure.web.dto.EventListResponse;
import com.eventspotter.catalog.infrastructure.web.dto.EventPageResponse;
import com.eventspotter.catalog.infrastructure.web.dto.EventResponse;
import com.eventspotter.catalog.infrastructure.web.dto.TagsResponse;
import com.eventspotter.catalog.infrastructure.web.dto.UpdateEventRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@Tag(name = "Events", description = "Event discovery, facets and owner-only writes")
@RequestMapping("/api/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final FindEvents findEvents;
    private final ManageEvents manageEvents;
    private final EventFacets eventFacets;
    private final RandomEventPicker randomEventPicker;

    public EventController(FindEvents findEvents,
                           ManageEvents manageEvents,
                           EventFacets eventFacets,
                           RandomEventPicker randomEventPicker) {
        this.findEvents = findEvents;
        this.manageEvents = manageEvents;
        this.eventFacets = eventFacets;
        this.randomEventPicker = randomEventPicker;
    }

    @Operation(summary = "List events with filters, sorting and pagination")
    @GetMapping
    public ResponseEntity<EventPageResponse> listEvents(
            @RequestParam(value = "page", required = false)
            @Min(value = 1, message = "page must be a positive integer")
            Integer page,

            @RequestParam(value = "limit", required = false)
            @Min(value = 1, message = "limit must be between 1 and 100")
            @Max(value = 100, message = "limit must be between 1 and 100")
            Integer limit,

            @RequestParam(value = "sortBy", defaultValue = "createdAt") String sortBy,
            @RequestParam(value = "sortOrder", defaultValue = "desc") String sortOrder,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "tags", required = false) String tags,

            @RequestParam(value = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate startDate,

            @RequestParam(value = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate endDate,

            @RequestParam(value = "search", required = false) String search
    ) {
        EventFilter filter = EventFilter.builder()
                .page(page)
                .limit(limit)
                .sortBy(SortField.fromParameter(sortBy))
                .sortOrder(SortOrder.fromParameter(sortOrder))
                .category(category)
                .tags(EventFilter.parseTags(tags))
                .startDate(startDate)
                .endDate(endDate)
                .search(search)
                .build();

        logger.info("Listing events with {}", filter);

        EventPage result = findEvents.list(filter);

        logger.info("Returning {} of {} matching events", result.events().size(), result.totalEvents());
        return ResponseEntity.ok(EventPageResponse.fromPage(result));
    }

    @Operation(summary = "Get a single event")
    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable UUID eventId) {
        return ResponseEntity.ok(EventResponse.fromEvent(findEvents.findById(eventId)));
    }

    @Operation(summary = "Create an event owned by the caller")
    @PostMapping
    public ResponseEntity<EventResponse> createEvent(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @Valid @RequestBody CreateEventRequest request
    ) {
        Event created = manageEvents.create(userId, request.toNewEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEvent(created));
    }

    @Operation(summary = "Partially update an event the caller owns")
    @PatchMapping("/{eventId}")
    public ResponseEntity<EventResponse> updateEvent(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @PathVariable UUID eventId,
            @Valid @RequestBody UpdateEventRequest request
    ) {
        Event updated = manageEvents.update(userId, eventId, request.toUpdate());
        return ResponseEntity.ok(EventResponse.fromEvent(updated));
    }

    @Operation(summary = "Delete an event the caller owns")
    @DeleteMapping("/{eventId}")
    public ResponseEntity<Void> deleteEvent(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @PathVariable UUID eventId
    ) {
        manageEvents.delete(userId, eventId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Distinct categories in use")
    @GetMapping("/categories")
    public ResponseEntity<CategoriesResponse> categories() {
        return ResponseEntity.ok(new CategoriesResponse(eventFacets.categories()));
    }

    @Operation(summary = "Distinct tags in use, lowercased")
    @GetMapping("/tags")
    public ResponseEntity<TagsResponse> tags() {
        return ResponseEntity.ok(new TagsResponse(eventFacets.tags()));
    }

    @Operation(summary = "Pick a random event")
    @GetMapping("/random")
    public ResponseEntity<EventResponse> randomEvent() {
        return ResponseEntity.ok(EventResponse.fromEvent(randomEventPicker.pickRandom()));
    }

    @Operation(summary = "Fetch events by id in request order")
    @PostMapping("/batch-get")
    public ResponseEntity<EventListResponse> batchGet(@Valid @RequestBody BatchGetRequest request) {
        List<Event> events = findEvents.batchGet(request.eventIds());

        logger.info("Resolved {} of {} requested events", events.size(), request.eventIds().size());
        return ResponseEntity.ok(EventListResponse.fromEvents(events));
    }
}
