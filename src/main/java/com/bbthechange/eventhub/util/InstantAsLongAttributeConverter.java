package com.bbthechange.eventhub.util;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;

/**
 * Stores Instants as epoch-millisecond Numbers, the same encoding the roster
 * update expressions write for updatedAt.
 */
public class InstantAsLongAttributeConverter implements AttributeConverter<Instant> {

    @Override
    public AttributeValue transformFrom(Instant instant) {
        if (instant == null) {
            return AttributeValue.builder().nul(true).build();
        }
        return toEpochMillis(instant);
    }

    @Override
    public Instant transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || Boolean.TRUE.equals(attributeValue.nul())) {
            return null;
        }
        if (attributeValue.n() == null) {
            throw new IllegalArgumentException("Expected a numeric epoch-millis attribute but got: " + attributeValue);
        }
        return Instant.ofEpochMilli(Long.parseLong(attributeValue.n()));
    }

    @Override
    public EnhancedType<Instant> type() {
        return EnhancedType.of(Instant.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.N;
    }

    /**
     * Number attribute for an Instant, for hand-built update expressions.
     */
    public static AttributeValue toEpochMillis(Instant instant) {
        return AttributeValue.builder().n(String.valueOf(instant.toEpochMilli())).build();
    }
}
