package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads durations written by classifiers in any of three shapes: integral nanoseconds,
 * ISO-8601 ({@code PT1H30M}), or unit-suffixed text ({@code 1h30m}, {@code 250ms}).
 */
class FlexibleDurationDeserializer extends StdDeserializer<Duration> {
    private static final Pattern UNIT_SEGMENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

    FlexibleDurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return Duration.ofNanos(parser.getLongValue());
        }
        if (token != JsonToken.VALUE_STRING) {
            return (Duration) context.handleUnexpectedToken(Duration.class, parser);
        }
        String text = parser.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return parseText(text);
        } catch (IllegalArgumentException | DateTimeParseException parseFailure) {
            return (Duration) context.handleWeirdStringValue(Duration.class, text, parseFailure.getMessage());
        }
    }

    static Duration parseText(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P")) {
            return Duration.parse(upper);
        }
        Matcher matcher = UNIT_SEGMENT.matcher(text);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw new IllegalArgumentException("Unparseable duration: " + text);
            }
            total = total.plus(segment(Double.parseDouble(matcher.group(1)), matcher.group(2)));
            consumed = matcher.end();
        }
        if (consumed == 0 || consumed != text.length()) {
            throw new IllegalArgumentException("Unparseable duration: " + text);
        }
        return total;
    }

    private static Duration segment(double amount, String unit) {
        double nanosPerUnit = switch (unit) {
            case "ns" -> 1d;
            case "us", "µs" -> 1_000d;
            case "ms" -> 1_000_000d;
            case "s" -> 1_000_000_000d;
            case "m" -> 60d * 1_000_000_000d;
            case "h" -> 3_600d * 1_000_000_000d;
            default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
        return Duration.ofNanos(Math.round(amount * nanosPerUnit));
    }
}
