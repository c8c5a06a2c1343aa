package com.portos.core.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses provider wait times such as "1 day 1 hour 33 minutes" or "45 sec".
 * Any subset of days, hours, minutes and seconds is accepted, in any case.
 */
final class WaitTimeParser {

    private static final Logger log = LoggerFactory.getLogger(WaitTimeParser.class);

    private static final Pattern DAYS = Pattern.compile("(\\d+)\\s*day", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOURS = Pattern.compile("(\\d+)\\s*hour", Pattern.CASE_INSENSITIVE);
    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*min", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECONDS = Pattern.compile("(\\d+)\\s*sec", Pattern.CASE_INSENSITIVE);

    private WaitTimeParser() {}

    /**
     * @return the wait, or empty when nothing parseable (or only zeros) was found
     */
    static Optional<Duration> parse(String waitTime) {
        if (waitTime == null || waitTime.isBlank()) {
            return Optional.empty();
        }
        try {
            Duration total = Duration.ofDays(amount(DAYS, waitTime))
                    .plusHours(amount(HOURS, waitTime))
                    .plusMinutes(amount(MINUTES, waitTime))
                    .plusSeconds(amount(SECONDS, waitTime));
            return total.isZero() ? Optional.empty() : Optional.of(total);
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Wait time '{}' out of range: {}", waitTime, e.getMessage());
            return Optional.empty();
        }
    }

    private static long amount(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? Long.parseLong(m.group(1)) : 0;
    }
}
