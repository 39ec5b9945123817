package com.bbthechange.eventhub.repository.impl;

import com.bbthechange.eventhub.exception.RepositoryException;
import com.bbthechange.eventhub.exception.RepositoryTimeoutException;
import com.bbthechange.eventhub.exception.VersionConflictException;
import com.bbthechange.eventhub.model.Attendee;
import com.bbthechange.eventhub.model.Event;
import com.bbthechange.eventhub.model.EventRegistration;
import com.bbthechange.eventhub.model.RosterChange;
import com.bbthechange.eventhub.repository.EventRosterRepository;
import com.bbthechange.eventhub.util.EventKeyFactory;
import com.bbthechange.eventhub.util.InstantAsLongAttributeConverter;
import com.bbthechange.eventhub.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of EventRosterRepository.
 * Roster commits are a TransactWriteItems call: a version-conditioned update of the event item
 * plus a put or delete of the user's registration pointer.
 */
@Repository
public class EventRosterRepositoryImpl implements EventRosterRepository {

    private static final Logger logger = LoggerFactory.getLogger(EventRosterRepositoryImpl.class);
    static final String TABLE_NAME = "EventHubTable";

    // Cancellation reason codes that mean another writer got there first
    private static final Set<String> CONFLICT_REASON_CODES = Set.of("ConditionalCheckFailed", "TransactionConflict");

    private static final TableSchema<Attendee> ATTENDEE_SCHEMA = TableSchema.fromBean(Attendee.class);
    private static final TableSchema<EventRegistration> REGISTRATION_SCHEMA = TableSchema.fromBean(EventRegistration.class);

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<Event> eventTable;
    private final DynamoDbTable<EventRegistration> registrationTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public EventRosterRepositoryImpl(DynamoDbClient dynamoDbClient,
                                     DynamoDbEnhancedClient enhancedClient,
                                     QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.eventTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Event.class));
        this.registrationTable = enhancedClient.table(TABLE_NAME, REGISTRATION_SCHEMA);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Event save(Event event) {
        return track("saveEvent", () -> {
            try {
                event.touch();
                eventTable.putItem(event);
                // Mirror the version the versioned-record extension wrote
                event.setVersion(event.getVersion() == null ? 1L : event.getVersion() + 1);
                logger.debug("Saved event: {} (version {})", event.getEventId(), event.getVersion());
                return event;
            } catch (ConditionalCheckFailedException e) {
                throw new VersionConflictException("Event " + event.getEventId() + " was modified concurrently", e);
            }
        });
    }

    @Override
    public Optional<Event> findById(String eventId) {
        return track("findEventById", () -> {
            Key key = Key.builder()
                    .partitionValue(EventKeyFactory.getEventPk(eventId))
                    .sortValue(EventKeyFactory.getMetadataSk())
                    .build();

            Event event = eventTable.getItem(GetItemEnhancedRequest.builder()
                    .key(key)
                    .consistentRead(true)
                    .build());
            logger.debug("Loaded event {} (found: {})", eventId, event != null);
            return Optional.ofNullable(event);
        });
    }

    @Override
    public void persistRosterChange(String eventId, long expectedVersion, List<Attendee> newRoster, RosterChange change) {
        track("persistRosterChange", () -> {
            List<TransactWriteItem> items = new ArrayList<>();
            items.add(buildRosterUpdate(eventId, expectedVersion, newRoster));
            items.add(buildPointerWrite(eventId, change));

            try {
                // One token per commit attempt: an SDK retry of an already applied transaction succeeds
                // instead of failing the version check
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                        .transactItems(items)
                        .clientRequestToken(UUID.randomUUID().toString())
                        .build());
            } catch (TransactionCanceledException e) {
                if (isConflict(e)) {
                    logger.debug("Roster commit for event {} lost version check at {}: {}",
                            eventId, expectedVersion, e.cancellationReasons());
                    throw new VersionConflictException(
                            "Event " + eventId + " changed since version " + expectedVersion, e);
                }
                logger.error("Roster transaction cancelled for event {}: {}", eventId, e.cancellationReasons());
                throw new RepositoryException("Failed to update roster atomically - transaction cancelled", e);
            }

            logger.debug("Committed {} on event {} (version {} -> {}, {} attendees)",
                    change, eventId, expectedVersion, expectedVersion + 1, newRoster.size());
            return null;
        });
    }

    @Override
    public List<EventRegistration> findRegistrationsByUserId(String userId) {
        return track("findRegistrationsByUserId", () -> {
            QueryConditional conditional = QueryConditional.sortBeginsWith(
                    Key.builder()
                            .partitionValue(EventKeyFactory.getUserPk(userId))
                            .sortValue(EventKeyFactory.getRegistrationSkPrefix())
                            .build()
            );

            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(conditional)
                    .build();

            List<EventRegistration> registrations = new ArrayList<>();
            registrationTable.query(request).items().forEach(registrations::add);

            logger.debug("Found {} registrations for user: {}", registrations.size(), userId);
            return registrations;
        });
    }

    private TransactWriteItem buildRosterUpdate(String eventId, long expectedVersion, List<Attendee> newRoster) {
        List<AttributeValue> roster = newRoster.stream()
                .map(attendee -> AttributeValue.builder().m(ATTENDEE_SCHEMA.itemToMap(attendee, true)).build())
                .collect(Collectors.toList());

        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":attendees", AttributeValue.builder().l(roster).build());
        values.put(":one", AttributeValue.builder().n("1").build());
        values.put(":expectedVersion", AttributeValue.builder().n(String.valueOf(expectedVersion)).build());
        values.put(":now", InstantAsLongAttributeConverter.toEpochMillis(Instant.now()));

        return TransactWriteItem.builder()
                .update(Update.builder()
                        .tableName(TABLE_NAME)
                        .key(eventKey(eventId))
                        .updateExpression("SET attendees = :attendees, #ver = #ver + :one, updatedAt = :now")
                        .conditionExpression("attribute_exists(pk) AND #ver = :expectedVersion")
                        .expressionAttributeNames(Map.of("#ver", "version"))
                        .expressionAttributeValues(values)
                        .build())
                .build();
    }

    private TransactWriteItem buildPointerWrite(String eventId, RosterChange change) {
        if (change.getType() == RosterChange.Type.ADD) {
            EventRegistration pointer = new EventRegistration(
                    eventId, change.getUserId(), change.getAttendee().getRegisteredAt());
            return TransactWriteItem.builder()
                    .put(Put.builder()
                            .tableName(TABLE_NAME)
                            .item(REGISTRATION_SCHEMA.itemToMap(pointer, true))
                            .build())
                    .build();
        }

        Map<String, AttributeValue> pointerKey = new HashMap<>();
        pointerKey.put("pk", AttributeValue.builder().s(EventKeyFactory.getUserPk(change.getUserId())).build());
        pointerKey.put("sk", AttributeValue.builder().s(EventKeyFactory.getRegistrationSk(eventId)).build());

        return TransactWriteItem.builder()
                .delete(Delete.builder()
                        .tableName(TABLE_NAME)
                        .key(pointerKey)
                        .build())
                .build();
    }

    private Map<String, AttributeValue> eventKey(String eventId) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("pk", AttributeValue.builder().s(EventKeyFactory.getEventPk(eventId)).build());
        key.put("sk", AttributeValue.builder().s(EventKeyFactory.getMetadataSk()).build());
        return key;
    }

    private boolean isConflict(TransactionCanceledException e) {
        if (!e.hasCancellationReasons()) {
            return false;
        }
        return e.cancellationReasons().stream()
                .map(CancellationReason::code)
                .anyMatch(CONFLICT_REASON_CODES::contains);
    }

    /**
     * Run an operation under the performance tracker and translate SDK failures
     * into repository exceptions.
     */
    private <T> T track(String operation, Supplier<T> call) {
        try {
            return performanceTracker.trackQuery(operation, TABLE_NAME, call);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            logger.warn("DynamoDB {} timed out: {}", operation, e.getMessage());
            throw new RepositoryTimeoutException("Storage did not respond in time for " + operation, e);
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error during {}", operation, e);
            throw new RepositoryException("Database operation failed: " + operation, e);
        }
    }
}
