package com.bbthechange.eventhub.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for DynamoDB connectivity and EventHubTable status.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {
    
    private final DynamoDbClient dynamoDbClient;

    @Value("${aws.region:us-east-1}")
    private String region;
    
    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }
    
    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(DynamoDBTableInitializer.TABLE_NAME).build()
            );
            
            TableStatus status = response.table().tableStatus();
            
            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("eventHubTable", status.toString())
                    .withDetail("itemCount", response.table().itemCount())
                    .withDetail("region", region)
                    .build();
            }
            return Health.down()
                .withDetail("eventHubTable", status.toString())
                .build();
            
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
