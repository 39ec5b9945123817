package com.bbthechange.eventhub.service;

import com.bbthechange.eventhub.dto.RegisteredEventDTO;
import com.bbthechange.eventhub.dto.RegistrationStatusDTO;
import com.bbthechange.eventhub.dto.RosterDTO;

import java.util.List;

/**
 * Service interface for capacity-bounded event registration.
 * All roster changes for one event are linearizable; different events never block each other.
 * The userId is the authenticated principal and is trusted as given.
 */
public interface RegistrationService {

    /**
     * Add the user to the event roster.
     * Checks, in order: event exists, event is PUBLISHED, user not yet registered, roster not full.
     *
     * @param eventId The event ID
     * @param userId The ID of the registering user
     * @return The roster after the registration
     * @throws com.bbthechange.eventhub.exception.EventNotFoundException if the event does not exist
     * @throws com.bbthechange.eventhub.exception.EventNotAvailableException if the event is not published
     * @throws com.bbthechange.eventhub.exception.AlreadyRegisteredException if the user is on the roster
     * @throws com.bbthechange.eventhub.exception.CapacityExceededException if the roster is full
     * @throws com.bbthechange.eventhub.exception.RegistrationBusyException if concurrent changes kept winning
     */
    RosterDTO register(String eventId, String userId);

    /**
     * Remove the user from the event roster. Allowed in every event status.
     *
     * @param eventId The event ID
     * @param userId The ID of the unregistering user
     * @return The roster after the removal
     * @throws com.bbthechange.eventhub.exception.EventNotFoundException if the event does not exist
     * @throws com.bbthechange.eventhub.exception.NotRegisteredException if the user is not on the roster
     * @throws com.bbthechange.eventhub.exception.RegistrationBusyException if concurrent changes kept winning
     */
    RosterDTO unregister(String eventId, String userId);

    /**
     * Capacity and membership view for one user, computed from a single snapshot.
     *
     * @param eventId The event ID
     * @param userId The ID of the requesting user
     * @return Registration status of the user plus availableSpots/full
     */
    RegistrationStatusDTO getRegistrationStatus(String eventId, String userId);

    /**
     * Current roster in registration order.
     *
     * @param eventId The event ID
     * @return The roster view
     */
    RosterDTO getRoster(String eventId);

    /**
     * Events the user is currently registered for, oldest registration first.
     *
     * @param userId The user ID
     * @return Registered events; events deleted since registration are left out
     */
    List<RegisteredEventDTO> getRegisteredEvents(String userId);
}
