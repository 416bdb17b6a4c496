package com.eventspotter.catalog.infrastructure.web;

import com.eventspotter.catalog.application.SaveEvents;
import com.eventspotter.catalog.domain.model.SaveOutcome;
import com.eventspotter.catalog.infrastructure.web.dto.EventListResponse;
import com.eventspotter.catalog.infrastructure.web.dto.MessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Tag(name = "Saved events", description = "Per-user event bookmarks")
public class SavedEventController {

    private final SaveEvents saveEvents;

    public SavedEventController(SaveEvents saveEvents) {
        this.saveEvents = saveEvents;
    }

    @Operation(summary = "Save an event for the caller")
    @PostMapping("/api/events/{eventId}/save")
    public ResponseEntity<MessageResponse> saveEvent(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @PathVariable UUID eventId
    ) {
        SaveOutcome outcome = saveEvents.save(userId, eventId);

        if (outcome == SaveOutcome.CREATED) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(MessageResponse.of("Event saved successfully."));
        }
        return ResponseEntity.ok(MessageResponse.of("Event already saved."));
    }

    @Operation(summary = "Remove a saved event")
    @DeleteMapping("/api/events/{eventId}/save")
    public ResponseEntity<Void> unsaveEvent(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @PathVariable UUID eventId
    ) {
        saveEvents.unsave(userId, eventId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List the caller's saved events")
    @GetMapping("/api/users/me/saved-events")
    public ResponseEntity<EventListResponse> savedEvents(@RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(EventListResponse.fromEvents(saveEvents.listSaved(userId)));
    }
}
