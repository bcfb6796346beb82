package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Slack message timestamp in {@code seconds.micros} form.
 *
 * <p>The textual value is the message's identity within a channel. Ordering is numeric, never
 * lexical, so {@code "99.000000"} sorts before {@code "100.000000"}.</p>
 */
public final class SlackTimestamp implements Comparable<SlackTimestamp> {
    private static final Pattern FORMAT = Pattern.compile("\\d+(\\.\\d{1,9})?");
    private static final int MICRO_DIGITS = 6;

    private final String value;
    private final BigDecimal numeric;

    private SlackTimestamp(String value) {
        this.value = value;
        this.numeric = new BigDecimal(value);
    }

    /**
     * Parses a Slack timestamp.
     *
     * @param value timestamp text such as {@code 1712345678.000100}
     * @return parsed timestamp
     * @throws IllegalArgumentException when the text is not a decimal seconds value
     */
    @JsonCreator
    public static SlackTimestamp parse(String value) {
        if (value == null || !FORMAT.matcher(value.trim()).matches()) {
            throw new IllegalArgumentException("Invalid Slack timestamp: " + value);
        }
        return new SlackTimestamp(value.trim());
    }

    /**
     * Formats an instant with microsecond precision, truncating anything finer.
     */
    public static SlackTimestamp of(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        long micros = instant.getNano() / 1_000L;
        return new SlackTimestamp(String.format(Locale.ROOT, "%d.%06d", instant.getEpochSecond(), micros));
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Instant toInstant() {
        int dot = value.indexOf('.');
        if (dot < 0) {
            return Instant.ofEpochSecond(Long.parseLong(value));
        }
        long seconds = Long.parseLong(value.substring(0, dot));
        String fraction = value.substring(dot + 1);
        if (fraction.length() > MICRO_DIGITS) {
            fraction = fraction.substring(0, MICRO_DIGITS);
        }
        StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < MICRO_DIGITS) {
            padded.append('0');
        }
        long micros = Long.parseLong(padded.toString());
        return Instant.ofEpochSecond(seconds, micros * 1_000L);
    }

    public BigDecimal numericValue() {
        return numeric;
    }

    public boolean isAfter(SlackTimestamp other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(SlackTimestamp other) {
        return numeric.compareTo(other.numeric);
    }

    /** Equality is numeric: {@code 1.5} and {@code 1.500000} name the same instant. */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SlackTimestamp that)) {
            return false;
        }
        return numeric.compareTo(that.numeric) == 0;
    }

    @Override
    public int hashCode() {
        return numeric.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
