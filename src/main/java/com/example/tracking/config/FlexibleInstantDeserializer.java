package com.example.tracking.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Jackson {@link JsonDeserializer} for carrier event times.
 *
 * Carriers are not consistent about time formats. Accepted inputs:
 * <pre>
 * "2024-05-01T10:15:30Z"        -> as is
 * "2024-05-01T18:15:30+08:00"   -> converted to UTC
 * "2024-05-01T10:15:30"         -> local time read as UTC
 * "2024-05-01 10:15:30"         -> local time read as UTC
 * "2024-05-01 10:15"            -> local time read as UTC
 * "2024-05-01"                  -> start of day UTC
 * 1714558530                    -> epoch seconds
 * 1714558530000                 -> epoch millis (values of 10^11 and above)
 * null / ""                     -> null
 * </pre>
 * Anything else is rejected with a mapping error.
 */
public final class FlexibleInstantDeserializer extends JsonDeserializer<Instant> {

    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm")
    );

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            long value = node.asLong();
            return value >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        }

        String s = node.asText("").trim();
        if (s.isEmpty()) {
            return null;
        }

        Instant parsed = parse(s);
        if (parsed == null) {
            return (Instant) ctxt.handleWeirdStringValue(Instant.class, s, "unrecognised event time");
        }
        return parsed;
    }

    static Instant parse(String s) {
        Instant parsed = tryParse(() -> OffsetDateTime.parse(s).toInstant());
        for (int i = 0; parsed == null && i < LOCAL_FORMATS.size(); i++) {
            DateTimeFormatter format = LOCAL_FORMATS.get(i);
            parsed = tryParse(() -> LocalDateTime.parse(s, format).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(() -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return parsed;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
