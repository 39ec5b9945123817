package com.bbthechange.eventhub.model;

import com.bbthechange.eventhub.util.EventKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Event entity for the EventHubTable, reduced to what registration needs.
 * The roster is embedded in the event item so a single conditional write covers capacity and duplicates.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = METADATA
 */
@DynamoDbBean
public class Event extends BaseItem {

    private String eventId;
    private String title;                   // Owned by event content, read-only here
    private String organizerId;             // Owned by event content, read-only here
    private EventStatus status;             // DRAFT (default), PUBLISHED, CANCELLED, COMPLETED
    private Integer maxAttendees;           // Capacity, immutable for registration
    private List<Attendee> attendees;       // Registration order
    private Long version;                   // Optimistic locking

    // Default constructor for DynamoDB
    public Event() {
        super();
        setItemType(EventKeyFactory.EVENT_PREFIX);
        this.attendees = new ArrayList<>();
        // version is null for new items - DynamoDB Enhanced Client will set it to 1 on first save
        this.status = EventStatus.DRAFT;
    }

    public Event(String eventId, String title, String organizerId, int maxAttendees) {
        super();
        setItemType(EventKeyFactory.EVENT_PREFIX);
        this.eventId = eventId;
        this.title = title;
        this.organizerId = organizerId;
        this.maxAttendees = maxAttendees;
        this.attendees = new ArrayList<>();
        this.status = EventStatus.DRAFT;

        setPk(EventKeyFactory.getEventPk(eventId));
        setSk(EventKeyFactory.getMetadataSk());
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getOrganizerId() {
        return organizerId;
    }

    public void setOrganizerId(String organizerId) {
        this.organizerId = organizerId;
    }

    public EventStatus getStatus() {
        return status;
    }

    public void setStatus(EventStatus status) {
        this.status = status;
    }

    public Integer getMaxAttendees() {
        return maxAttendees;
    }

    public void setMaxAttendees(Integer maxAttendees) {
        this.maxAttendees = maxAttendees;
    }

    public List<Attendee> getAttendees() {
        return attendees != null ? attendees : new ArrayList<>();
    }

    public void setAttendees(List<Attendee> attendees) {
        this.attendees = attendees != null ? attendees : new ArrayList<>();
    }

    @DynamoDbVersionAttribute
    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    /**
     * Check whether the given user already has a roster entry.
     */
    public boolean hasAttendee(String userId) {
        return getAttendees().stream().anyMatch(a -> a.getUserId().equals(userId));
    }

    /**
     * Check if the roster has reached maxAttendees.
     */
    public boolean hasReachedCapacity() {
        return getAttendees().size() >= maxAttendees;
    }

    /**
     * Remaining spots, never negative.
     */
    @DynamoDbIgnore
    public int getAvailableSpots() {
        return Math.max(0, maxAttendees - getAttendees().size());
    }
}
