package com.portos.core.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Availability of one provider as persisted in the status file.
 *
 * @param available         whether tasks may be routed to the provider
 * @param reason            why it is (un)available
 * @param message           human-readable status
 * @param waitTime          wait time as reported by the provider, e.g. "1 day 1 hour 33 minutes"
 * @param unavailableSince  when the provider went down
 * @param estimatedRecovery when the provider is expected back
 * @param failureCount      consecutive failures, reset on recovery
 * @param lastChecked       last time this status was written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderStatus(
    boolean available,
    ProviderStatusReason reason,
    String message,
    String waitTime,
    Instant unavailableSince,
    Instant estimatedRecovery,
    int failureCount,
    Instant lastChecked
) {

    public static final String AVAILABLE_MESSAGE = "Provider available";

    /**
     * Lenient factory for persisted snapshots; absent fields fall back to an available provider.
     * An available provider never carries an outage window.
     */
    @JsonCreator
    public static ProviderStatus fromJson(@JsonProperty("available") Boolean available,
                                          @JsonProperty("reason") ProviderStatusReason reason,
                                          @JsonProperty("message") String message,
                                          @JsonProperty("waitTime") String waitTime,
                                          @JsonProperty("unavailableSince") Instant unavailableSince,
                                          @JsonProperty("estimatedRecovery") Instant estimatedRecovery,
                                          @JsonProperty("failureCount") Integer failureCount,
                                          @JsonProperty("lastChecked") Instant lastChecked) {
        boolean up = available == null || available;
        return new ProviderStatus(
                up,
                reason != null ? reason : ProviderStatusReason.OK,
                message,
                waitTime,
                up ? null : unavailableSince,
                up ? null : estimatedRecovery,
                failureCount != null ? failureCount : 0,
                lastChecked);
    }

    /** Status reported for a provider that has never failed. */
    public static ProviderStatus ok(Instant now) {
        return new ProviderStatus(true, ProviderStatusReason.OK, AVAILABLE_MESSAGE, null, null, null, 0, now);
    }

    public static ProviderStatus unavailable(ProviderStatusReason reason, String message, String waitTime,
                                             Instant now, Instant estimatedRecovery, int failureCount) {
        return new ProviderStatus(false, reason, message, waitTime, now, estimatedRecovery, failureCount, now);
    }

    /** True when the provider is down but its estimated recovery time has passed. */
    public boolean recoveryDue(Instant now) {
        return !available && estimatedRecovery != null && now.isAfter(estimatedRecovery);
    }
}
