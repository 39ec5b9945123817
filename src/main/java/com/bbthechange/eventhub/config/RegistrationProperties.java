package com.bbthechange.eventhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "registration")
public class RegistrationProperties {

    // Commit attempts per request before giving up with REGISTRATION_BUSY
    private int maxRetries = 5;

    // Upper bound of the random pause between attempts
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration retryBackoff = Duration.ofMillis(25);

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }
}
