package com.bbthechange.eventhub.util;

import com.bbthechange.eventhub.exception.InvalidKeyException;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for the EventHubTable single-table design.
 * Event items live under EVENT#{eventId}; per-user registration pointers under USER#{userId}.
 * Event ids must be UUIDs.
 */
public final class EventKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", 
        Pattern.CASE_INSENSITIVE
    );
    
    public static final String EVENT_PREFIX = "EVENT";
    public static final String USER_PREFIX = "USER";
    public static final String REGISTRATION_PREFIX = "REGISTRATION";
    public static final String METADATA_SUFFIX = "METADATA";
    
    private EventKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }
    
    private static void requireNonBlank(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
    }

    private static void validateId(String id, String type) {
        requireNonBlank(id, type);
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }
    
    public static String getEventPk(String eventId) {
        validateId(eventId, "Event");
        return EVENT_PREFIX + DELIMITER + eventId;
    }
    
    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }
    
    /**
     * User ids come from the token subject and are opaque here, so only blank ids are rejected.
     */
    public static String getUserPk(String userId) {
        requireNonBlank(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }
    
    public static String getRegistrationSk(String eventId) {
        validateId(eventId, "Event");
        return REGISTRATION_PREFIX + DELIMITER + eventId;
    }

    /**
     * Sort-key prefix matching every registration pointer in a user partition.
     */
    public static String getRegistrationSkPrefix() {
        return REGISTRATION_PREFIX + DELIMITER;
    }
}
