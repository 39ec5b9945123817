package com.bbthechange.eventhub.dto;

import com.bbthechange.eventhub.model.EventStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entry of a user's "registered events" list.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisteredEventDTO {

    private String eventId;
    private String title;
    private EventStatus status;
    private Instant registeredAt;
}
