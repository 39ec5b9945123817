package com.bbthechange.eventhub.controller;

import com.bbthechange.eventhub.dto.RegisteredEventDTO;
import com.bbthechange.eventhub.dto.RegistrationStatusDTO;
import com.bbthechange.eventhub.dto.RosterDTO;
import com.bbthechange.eventhub.service.RegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for event registration.
 * The registering user is always the authenticated caller.
 */
@RestController
@RequestMapping("/events")
@Validated
@Tag(name = "Registration", description = "Register for events and inspect rosters")
public class RegistrationController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationController.class);

    private final RegistrationService registrationService;

    @Autowired
    public RegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    /**
     * Register the caller for an event.
     * POST /events/{eventId}/registration
     *
     * @param eventId The event ID (must be valid UUID format)
     * @param httpRequest HTTP request for user extraction
     * @return 200 OK with the updated roster
     */
    @PostMapping("/{eventId}/registration")
    @Operation(summary = "Register the current user for an event")
    public ResponseEntity<RosterDTO> register(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} registering for event {}", userId, eventId);

        RosterDTO roster = registrationService.register(eventId, userId);

        logger.info("Successfully registered user {} for event {} ({} spots left)",
                userId, eventId, roster.getAvailableSpots());

        return ResponseEntity.ok(roster);
    }

    /**
     * Unregister the caller from an event.
     * DELETE /events/{eventId}/registration
     *
     * @param eventId The event ID (must be valid UUID format)
     * @param httpRequest HTTP request for user extraction
     * @return 200 OK with the updated roster
     */
    @DeleteMapping("/{eventId}/registration")
    @Operation(summary = "Unregister the current user from an event")
    public ResponseEntity<RosterDTO> unregister(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} unregistering from event {}", userId, eventId);

        RosterDTO roster = registrationService.unregister(eventId, userId);

        logger.info("Successfully unregistered user {} from event {}", userId, eventId);

        return ResponseEntity.ok(roster);
    }

    @GetMapping("/{eventId}/registration")
    @Operation(summary = "Get the current user's registration status and event capacity")
    public ResponseEntity<RegistrationStatusDTO> getRegistrationStatus(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);

        RegistrationStatusDTO status = registrationService.getRegistrationStatus(eventId, userId);
        logger.debug("Registration status for user {} on event {}: registered={}, availableSpots={}",
                userId, eventId, status.isRegistered(), status.getAvailableSpots());

        return ResponseEntity.ok(status);
    }

    @GetMapping("/{eventId}/attendees")
    @Operation(summary = "Get the roster of an event")
    public ResponseEntity<RosterDTO> getAttendees(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.debug("Retrieving roster for event {} (requested by user {})", eventId, userId);

        return ResponseEntity.ok(registrationService.getRoster(eventId));
    }

    @GetMapping("/registered")
    @Operation(summary = "List the events the current user is registered for")
    public ResponseEntity<List<RegisteredEventDTO>> getRegisteredEvents(HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);

        List<RegisteredEventDTO> events = registrationService.getRegisteredEvents(userId);
        logger.debug("User {} is registered for {} events", userId, events.size());

        return ResponseEntity.ok(events);
    }
}
