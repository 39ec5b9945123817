package com.bbthechange.eventhub.model;

import com.bbthechange.eventhub.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * One entry in an event's roster. Stored as a map inside the Event item's attendees list.
 */
@DynamoDbBean
public class Attendee {

    private String userId;
    private Instant registeredAt;
    private AttendanceStatus attendanceStatus;

    // Default constructor for DynamoDB
    public Attendee() {
        this.attendanceStatus = AttendanceStatus.REGISTERED;
    }

    public Attendee(String userId, Instant registeredAt) {
        this.userId = userId;
        this.registeredAt = registeredAt;
        this.attendanceStatus = AttendanceStatus.REGISTERED;
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

    public AttendanceStatus getAttendanceStatus() {
        return attendanceStatus;
    }

    public void setAttendanceStatus(AttendanceStatus attendanceStatus) {
        this.attendanceStatus = attendanceStatus;
    }
}
