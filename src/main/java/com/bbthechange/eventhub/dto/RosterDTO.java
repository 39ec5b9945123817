package com.bbthechange.eventhub.dto;

import com.bbthechange.eventhub.model.Event;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Roster view of an event, returned by register, unregister and the attendee listing.
 * All counts come from the same snapshot as the attendee list.
 */
public class RosterDTO {

    private String eventId;
    private List<AttendeeDTO> attendees;
    private int attendeeCount;
    private int maxAttendees;
    private int availableSpots;              // Calculated: max(0, maxAttendees - attendeeCount)
    private boolean full;

    // Default constructor for JSON deserialization
    public RosterDTO() {
    }

    public RosterDTO(Event event) {
        this.eventId = event.getEventId();
        this.attendees = event.getAttendees().stream()
                .map(AttendeeDTO::new)
                .collect(Collectors.toList());
        this.attendeeCount = attendees.size();
        this.maxAttendees = event.getMaxAttendees();
        this.availableSpots = event.getAvailableSpots();
        this.full = event.hasReachedCapacity();
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public List<AttendeeDTO> getAttendees() {
        return attendees;
    }

    public void setAttendees(List<AttendeeDTO> attendees) {
        this.attendees = attendees;
    }

    public int getAttendeeCount() {
        return attendeeCount;
    }

    public void setAttendeeCount(int attendeeCount) {
        this.attendeeCount = attendeeCount;
    }

    public int getMaxAttendees() {
        return maxAttendees;
    }

    public void setMaxAttendees(int maxAttendees) {
        this.maxAttendees = maxAttendees;
    }

    public int getAvailableSpots() {
        return availableSpots;
    }

    public void setAvailableSpots(int availableSpots) {
        this.availableSpots = availableSpots;
    }

    public boolean isFull() {
        return full;
    }

    public void setFull(boolean full) {
        this.full = full;
    }
}
