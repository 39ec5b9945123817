package com.bbthechange.eventhub.model;

/**
 * Lifecycle status of an event.
 * Transitions (DRAFT -> PUBLISHED -> CANCELLED/COMPLETED) are owned by the event-content side;
 * registration only reads the value.
 */
public enum EventStatus {
    DRAFT,
    PUBLISHED,
    CANCELLED,
    COMPLETED;

    /**
     * Only published events take new registrations.
     */
    public boolean acceptsRegistrations() {
        return this == PUBLISHED;
    }
}
