package com.bbthechange.eventhub.dto;

import com.bbthechange.eventhub.model.AttendanceStatus;
import com.bbthechange.eventhub.model.Attendee;
import lombok.Data;

import java.time.Instant;

/**
 * Roster entry as returned by the API.
 */
@Data
public class AttendeeDTO {

    private String userId;
    private Instant registeredAt;
    private AttendanceStatus attendanceStatus;

    public AttendeeDTO() {}

    public AttendeeDTO(Attendee attendee) {
        this.userId = attendee.getUserId();
        this.registeredAt = attendee.getRegisteredAt();
        this.attendanceStatus = attendee.getAttendanceStatus();
    }
}
