package com.bbthechange.eventhub.model;

import java.util.Objects;

/**
 * The single-user delta behind a roster commit.
 * The repository uses it to keep the user's EventRegistration pointer in step with the roster.
 */
public final class RosterChange {

    public enum Type {
        ADD,
        REMOVE
    }

    private final Type type;
    private final Attendee attendee;

    private RosterChange(Type type, Attendee attendee) {
        this.type = type;
        this.attendee = Objects.requireNonNull(attendee, "attendee");
    }

    public static RosterChange add(Attendee attendee) {
        return new RosterChange(Type.ADD, attendee);
    }

    public static RosterChange remove(Attendee attendee) {
        return new RosterChange(Type.REMOVE, attendee);
    }

    public Type getType() {
        return type;
    }

    public Attendee getAttendee() {
        return attendee;
    }

    public String getUserId() {
        return attendee.getUserId();
    }

    @Override
    public String toString() {
        return type + "(" + attendee.getUserId() + ")";
    }
}
