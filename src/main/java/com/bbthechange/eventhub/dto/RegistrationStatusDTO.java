package com.bbthechange.eventhub.dto;

import com.bbthechange.eventhub.model.Event;
import com.bbthechange.eventhub.model.EventStatus;
import lombok.Data;

/**
 * What a client needs to render the register/unregister control for one user.
 */
@Data
public class RegistrationStatusDTO {

    private String eventId;
    private EventStatus status;
    private boolean registered;
    private boolean registrationOpen;
    private int attendeeCount;
    private int maxAttendees;
    private int availableSpots;
    private boolean full;

    public RegistrationStatusDTO() {}

    public RegistrationStatusDTO(Event event, String userId) {
        this.eventId = event.getEventId();
        this.status = event.getStatus();
        this.registered = event.hasAttendee(userId);
        this.registrationOpen = event.getStatus().acceptsRegistrations();
        this.attendeeCount = event.getAttendees().size();
        this.maxAttendees = event.getMaxAttendees();
        this.availableSpots = event.getAvailableSpots();
        this.full = event.hasReachedCapacity();
    }
}
