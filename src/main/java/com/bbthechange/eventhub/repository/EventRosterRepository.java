package com.bbthechange.eventhub.repository;

import com.bbthechange.eventhub.model.Attendee;
import com.bbthechange.eventhub.model.Event;
import com.bbthechange.eventhub.model.EventRegistration;
import com.bbthechange.eventhub.model.RosterChange;

import java.util.List;
import java.util.Optional;

/**
 * Repository for event rosters.
 * Reads event snapshots and commits roster changes with an optimistic version check.
 */
public interface EventRosterRepository {

    /**
     * Save a whole event item (create or content update).
     * Used by the event-content side and test setup; registration never calls it.
     * @param event The event to save
     * @return The saved event with its version advanced
     * @throws com.bbthechange.eventhub.exception.VersionConflictException if the stored version differs
     */
    Event save(Event event);

    /**
     * Read the current event snapshot with a strongly consistent read.
     * @param eventId The event ID
     * @return Optional containing the event if found
     */
    Optional<Event> findById(String eventId);

    /**
     * Atomically replace the roster of an event, provided its version still equals expectedVersion.
     * The user's registration pointer is written or removed in the same transaction.
     *
     * @param eventId The event ID
     * @param expectedVersion The version of the snapshot the new roster was derived from
     * @param newRoster The complete roster to store
     * @param change The single-user delta between the snapshot roster and newRoster
     * @throws com.bbthechange.eventhub.exception.VersionConflictException if another commit won the race
     *         or the event no longer exists
     */
    void persistRosterChange(String eventId, long expectedVersion, List<Attendee> newRoster, RosterChange change);

    /**
     * Find the registration pointers of a user.
     * @param userId The user ID
     * @return Registration pointers, in sort-key order
     */
    List<EventRegistration> findRegistrationsByUserId(String userId);
}
