package com.jirasync.webhooks.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

/**
 * Parses the timestamp shapes found in Jira payloads:
 * <ul>
 *   <li>epoch milliseconds, as a JSON number or a string of digits ({@code 1525698237764})</li>
 *   <li>ISO-8601 with a {@code Z} or {@code +HH:MM} offset ({@code 2025-01-01T00:00:00Z})</li>
 *   <li>Jira's compact offset form ({@code 2018-05-07T12:24:01.760+0100})</li>
 * </ul>
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private Timestamps() {}

    /**
     * @param value a {@link Number} or {@link String} timestamp
     * @return the parsed instant
     * @throws IllegalArgumentException if the value has none of the supported shapes
     */
    public static Instant parse(Object value) {
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("Unsupported timestamp value: " + value);
        }
        String text = ((String) value).trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Empty timestamp");
        }
        if (text.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        try {
            return OffsetDateTime.parse(text, FORMAT).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognised timestamp: '" + text + "'", e);
        }
    }
}
