package com.bbthechange.eventhub.model;

import com.bbthechange.eventhub.util.EventKeyFactory;
import com.bbthechange.eventhub.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * Per-user pointer to an event roster entry, used to list a user's registered events.
 * Written and deleted in the same transaction as the roster entry it mirrors.
 *
 * Key Pattern: PK = USER#{userId}, SK = REGISTRATION#{eventId}
 */
@DynamoDbBean
public class EventRegistration extends BaseItem {

    private String eventId;
    private String userId;
    private Instant registeredAt;

    // Default constructor for DynamoDB
    public EventRegistration() {
        super();
        setItemType(EventKeyFactory.REGISTRATION_PREFIX);
    }

    public EventRegistration(String eventId, String userId, Instant registeredAt) {
        super();
        setItemType(EventKeyFactory.REGISTRATION_PREFIX);
        this.eventId = eventId;
        this.userId = userId;
        this.registeredAt = registeredAt;

        setPk(EventKeyFactory.getUserPk(userId));
        setSk(EventKeyFactory.getRegistrationSk(eventId));
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }
}
