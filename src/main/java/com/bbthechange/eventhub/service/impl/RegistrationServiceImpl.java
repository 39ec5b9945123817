package com.bbthechange.eventhub.service.impl;

import com.bbthechange.eventhub.config.RegistrationProperties;
import com.bbthechange.eventhub.dto.RegisteredEventDTO;
import com.bbthechange.eventhub.dto.RegistrationStatusDTO;
import com.bbthechange.eventhub.dto.RosterDTO;
import com.bbthechange.eventhub.exception.*;
import com.bbthechange.eventhub.model.Attendee;
import com.bbthechange.eventhub.model.Event;
import com.bbthechange.eventhub.model.EventRegistration;
import com.bbthechange.eventhub.model.RosterChange;
import com.bbthechange.eventhub.repository.EventRosterRepository;
import com.bbthechange.eventhub.service.RegistrationService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Implementation of RegistrationService.
 *
 * Each roster change is validate-then-commit against one event snapshot. The commit only succeeds if
 * the event version is unchanged; on a version conflict the snapshot is re-read and every business
 * check runs again. Business-rule failures are never retried.
 */
@Service
public class RegistrationServiceImpl implements RegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationServiceImpl.class);

    static final String OUTCOME_METRIC = "registration_outcome_total";
    private static final String OP_REGISTER = "register";
    private static final String OP_UNREGISTER = "unregister";

    private final EventRosterRepository rosterRepository;
    private final RegistrationProperties properties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public RegistrationServiceImpl(EventRosterRepository rosterRepository,
                                   RegistrationProperties properties,
                                   MeterRegistry meterRegistry) {
        this.rosterRepository = rosterRepository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public RosterDTO register(String eventId, String userId) {
        logger.info("User {} registering for event {}", userId, eventId);

        return recordOutcome(OP_REGISTER, () -> commitWithRetry(OP_REGISTER, eventId, event -> {
            if (!event.getStatus().acceptsRegistrations()) {
                throw new EventNotAvailableException(
                        "Event is not available for registration (status " + event.getStatus() + ")");
            }
            if (event.hasAttendee(userId)) {
                throw new AlreadyRegisteredException("Already registered for this event");
            }
            if (event.hasReachedCapacity()) {
                throw new CapacityExceededException(
                        String.format("This event is full (%d/%d spots taken)",
                                event.getAttendees().size(), event.getMaxAttendees()));
            }
            return RosterChange.add(new Attendee(userId, Instant.now()));
        }));
    }

    @Override
    public RosterDTO unregister(String eventId, String userId) {
        logger.info("User {} unregistering from event {}", userId, eventId);

        return recordOutcome(OP_UNREGISTER, () -> commitWithRetry(OP_UNREGISTER, eventId, event -> {
            Attendee existing = event.getAttendees().stream()
                    .filter(a -> a.getUserId().equals(userId))
                    .findFirst()
                    .orElseThrow(() -> new NotRegisteredException("Not registered for this event"));
            return RosterChange.remove(existing);
        }));
    }

    @Override
    public RegistrationStatusDTO getRegistrationStatus(String eventId, String userId) {
        Event event = loadEvent(eventId);
        return new RegistrationStatusDTO(event, userId);
    }

    @Override
    public RosterDTO getRoster(String eventId) {
        return new RosterDTO(loadEvent(eventId));
    }

    @Override
    public List<RegisteredEventDTO> getRegisteredEvents(String userId) {
        List<EventRegistration> registrations = rosterRepository.findRegistrationsByUserId(userId);

        List<RegisteredEventDTO> result = new ArrayList<>();
        for (EventRegistration registration : registrations) {
            Optional<Event> event = rosterRepository.findById(registration.getEventId());
            // The pointer query is eventually consistent; the roster is the source of truth
            if (event.isEmpty() || !event.get().hasAttendee(userId)) {
                logger.debug("Skipping stale registration pointer {} for user {}", registration.getEventId(), userId);
                continue;
            }
            result.add(new RegisteredEventDTO(
                    registration.getEventId(),
                    event.get().getTitle(),
                    event.get().getStatus(),
                    registration.getRegisteredAt()));
        }

        return result.stream()
                .sorted(Comparator.comparing(RegisteredEventDTO::getRegisteredAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    /**
     * Load a fresh snapshot, let the planner validate it and pick the change, then commit
     * against the snapshot's version. Repeats on version conflicts up to maxRetries attempts.
     */
    private RosterDTO commitWithRetry(String operation, String eventId, Function<Event, RosterChange> planner) {
        int maxAttempts = Math.max(1, properties.getMaxRetries());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Event event = loadEvent(eventId);
            RosterChange change = planner.apply(event);

            if (event.getVersion() == null) {
                throw new RepositoryException("Event " + eventId + " has no version attribute");
            }
            long expectedVersion = event.getVersion();
            List<Attendee> newRoster = applyChange(event.getAttendees(), change);

            try {
                rosterRepository.persistRosterChange(eventId, expectedVersion, newRoster, change);
            } catch (VersionConflictException e) {
                if (attempt < maxAttempts) {
                    logger.debug("Retrying {} on event {} due to version conflict (attempt {}/{})",
                            operation, eventId, attempt, maxAttempts);
                    pauseBeforeRetry();
                    continue;
                }
                logger.warn("Max retries exceeded for {} on event {} after {} attempts",
                        operation, eventId, maxAttempts);
                throw new RegistrationBusyException(
                        "Event " + eventId + " is busy, please try again", e);
            }

            event.setAttendees(newRoster);
            event.setVersion(expectedVersion + 1);
            logger.info("Committed {} for user {} on event {} ({}/{} spots taken, attempt {})",
                    operation, change.getUserId(), eventId, newRoster.size(), event.getMaxAttendees(), attempt);
            return new RosterDTO(event);
        }

        // Loop always returns or throws
        throw new IllegalStateException("Unexpected exit from " + operation + " retry loop");
    }

    private List<Attendee> applyChange(List<Attendee> current, RosterChange change) {
        List<Attendee> roster = new ArrayList<>(current);
        if (change.getType() == RosterChange.Type.ADD) {
            roster.add(change.getAttendee());
        } else {
            roster.removeIf(a -> a.getUserId().equals(change.getUserId()));
        }
        return roster;
    }

    private Event loadEvent(String eventId) {
        return rosterRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException("Event not found: " + eventId));
    }

    private void pauseBeforeRetry() {
        long maxBackoffMs = properties.getRetryBackoff().toMillis();
        if (maxBackoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(maxBackoffMs + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistrationBusyException("Interrupted while waiting to retry", e);
        }
    }

    private <T> T recordOutcome(String operation, Supplier<T> action) {
        try {
            T result = action.get();
            meterRegistry.counter(OUTCOME_METRIC, "operation", operation, "outcome", "success").increment();
            return result;
        } catch (RuntimeException e) {
            String outcome = outcomeOf(e);
            meterRegistry.counter(OUTCOME_METRIC, "operation", operation, "outcome", outcome).increment();
            logger.info("{} rejected with outcome {}: {}", operation, outcome, e.getMessage());
            throw e;
        }
    }

    private static String outcomeOf(RuntimeException e) {
        if (e instanceof EventNotFoundException) {
            return "not_found";
        } else if (e instanceof EventNotAvailableException) {
            return "not_available";
        } else if (e instanceof AlreadyRegisteredException) {
            return "already_registered";
        } else if (e instanceof CapacityExceededException) {
            return "full";
        } else if (e instanceof NotRegisteredException) {
            return "not_registered";
        } else if (e instanceof RegistrationBusyException) {
            return "busy";
        } else if (e instanceof RepositoryTimeoutException) {
            return "timeout";
        }
        return "error";
    }
}
