package com.bbthechange.eventhub.util;

import com.bbthechange.eventhub.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for EventKeyFactory.
 */
class EventKeyFactoryTest {

    private static final String EVENT_ID = "12345678-1234-1234-1234-123456789012";
    private static final String USER_ID = "87654321-4321-4321-4321-210987654321";

    @Test
    void getEventPk_WithValidId_ShouldReturnPrefixedKey() {
        assertThat(EventKeyFactory.getEventPk(EVENT_ID)).isEqualTo("EVENT#" + EVENT_ID);
        assertThat(EventKeyFactory.getMetadataSk()).isEqualTo("METADATA");
    }

    @Test
    void getUserPkAndRegistrationSk_ShouldBuildPointerKeys() {
        assertThat(EventKeyFactory.getUserPk(USER_ID)).isEqualTo("USER#" + USER_ID);
        assertThat(EventKeyFactory.getRegistrationSk(EVENT_ID)).isEqualTo("REGISTRATION#" + EVENT_ID);
        assertThat(EventKeyFactory.getRegistrationSk(EVENT_ID)).startsWith(EventKeyFactory.getRegistrationSkPrefix());
    }

    @Test
    void getEventPk_WithNullId_ShouldThrowException() {
        // When/Then
        assertThatThrownBy(() -> EventKeyFactory.getEventPk(null))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Event ID cannot be null or empty");
    }

    @Test
    void getUserPk_WithNonUuidSubject_ShouldReturnPrefixedKey() {
        // Given
        String objectIdStyleUser = "64b7f0c2a1e4c3d2b1a09f87";

        // When/Then
        assertThat(EventKeyFactory.getUserPk(objectIdStyleUser)).isEqualTo("USER#" + objectIdStyleUser);
    }

    @Test
    void getUserPk_WithBlankId_ShouldThrowException() {
        // When/Then
        assertThatThrownBy(() -> EventKeyFactory.getUserPk("  "))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("User ID cannot be null or empty");
    }

    @Test
    void getRegistrationSk_WithMalformedEventId_ShouldThrowException() {
        // When/Then
        assertThatThrownBy(() -> EventKeyFactory.getRegistrationSk("event-1"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Event ID format");
    }
}
