package com.portos.core.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.regex.Pattern;

import static com.portos.core.recovery.RecoveryStrategy.*;

/**
 * Failure categories in match priority order: {@link ErrorClassifier} tests them top to
 * bottom and the first category with a matching pattern wins. {@link #UNKNOWN} has no
 * patterns and is the fallback when nothing matches.
 */
public enum ErrorCategory {

    RATE_LIMIT("rateLimit", Severity.MEDIUM, 60_000,
            List.of(DEFER, FALLBACK),
            ci("rate.?limit"), ci("too many requests"), cs("429"), ci("quota exceeded"), ci("throttl")),

    AUTH("auth", Severity.HIGH, 0,
            List.of(FALLBACK, MANUAL),
            ci("unauthorized"), ci("authentication"), ci("invalid.*key"), cs("403"), cs("401"), ci("api.?key")),

    MODEL_UNAVAILABLE("modelUnavailable", Severity.MEDIUM, 30_000,
            List.of(FALLBACK, DEFER),
            ci("model.*not.*found"), ci("model.*unavailable"), ci("model.*overloaded"), cs("503"), ci("capacity")),

    CONTEXT_LENGTH("contextLength", Severity.LOW, 0,
            List.of(DECOMPOSE),
            ci("context.*length"), ci("token.*limit"), ci("maximum.*tokens"), ci("too.*long"),
            ci("input.*too.*large")),

    NETWORK("network", Severity.MEDIUM, 5_000,
            List.of(RETRY, DEFER),
            ci("network"), ci("timeout"), ci("timed out"), cs("ECONNREFUSED"), cs("ETIMEDOUT"), cs("ENOTFOUND"),
            ci("connection.*refused"), ci("connection.*reset"), ci("socket.*hang.*up")),

    CONTENT_FILTER("contentFilter", Severity.LOW, 0,
            List.of(INVESTIGATE, SKIP),
            ci("content.*filter"), ci("safety"), ci("refus"), ci("cannot.*help"), ci("inappropriate")),

    RESOURCE("resource", Severity.HIGH, 300_000,
            List.of(DEFER, MANUAL),
            ci("out of memory"), ci("memory.*limit"), ci("disk.*space"), ci("no.*space")),

    PROCESS("process", Severity.MEDIUM, 10_000,
            List.of(RETRY, INVESTIGATE),
            ci("process.*exit"), ci("killed"), ci("signal"), ci("zombie")),

    UNKNOWN("unknown", Severity.MEDIUM, 0,
            List.of(RETRY));

    private final String value;
    private final Severity severity;
    private final long cooldownMs;
    private final List<RecoveryStrategy> strategies;
    private final List<Pattern> patterns;

    ErrorCategory(String value, Severity severity, long cooldownMs,
                  List<RecoveryStrategy> strategies, Pattern... patterns) {
        this.value = value;
        this.severity = severity;
        this.cooldownMs = cooldownMs;
        this.strategies = strategies;
        this.patterns = List.of(patterns);
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Severity severity() {
        return severity;
    }

    public long cooldownMs() {
        return cooldownMs;
    }

    /** Default candidate strategies, most preferred first. */
    public List<RecoveryStrategy> strategies() {
        return strategies;
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    /**
     * Whether any of this category's patterns matches the message or the code.
     */
    public boolean matches(String message, String code) {
        for (Pattern pattern : patterns) {
            if (message != null && pattern.matcher(message).find()) {
                return true;
            }
            if (code != null && !code.isEmpty() && pattern.matcher(code).find()) {
                return true;
            }
        }
        return false;
    }

    public static ErrorCategory fromValue(String value) {
        for (ErrorCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown error category: " + value);
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static Pattern cs(String regex) {
        return Pattern.compile(regex);
    }
}
