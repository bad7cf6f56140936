package com.phillippitts.callagent.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for caller inactivity timeouts.
 */
@Validated
@ConfigurationProperties(prefix = "call.timeout")
public class TimeoutProperties {

    /** Inactivity that ends a normal call. */
    @Min(10)
    @Max(3_600)
    private final int callTimeoutSeconds;

    /** Inactivity that ends a call while a payment link is outstanding. */
    @Min(10)
    @Max(7_200)
    private final int paymentTimeoutSeconds;

    @ConstructorBinding
    public TimeoutProperties(Integer callTimeoutSeconds, Integer paymentTimeoutSeconds) {
        this.callTimeoutSeconds = callTimeoutSeconds == null ? 300 : callTimeoutSeconds;
        this.paymentTimeoutSeconds = paymentTimeoutSeconds == null ? 600 : paymentTimeoutSeconds;
    }

    public static TimeoutProperties defaults() {
        return new TimeoutProperties(null, null);
    }

    public int getCallTimeoutSeconds() { return callTimeoutSeconds; }
    public int getPaymentTimeoutSeconds() { return paymentTimeoutSeconds; }

    public Duration callTimeout() { return Duration.ofSeconds(callTimeoutSeconds); }
    public Duration paymentTimeout() { return Duration.ofSeconds(paymentTimeoutSeconds); }
}
