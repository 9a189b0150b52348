package com.medconsult.utils;

import com.medconsult.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parsing of the wire formats used by scheduling commands. Every failure is a
 * {@link ValidationException} naming the offending field.
 */
public final class TimeFormats {

    public static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    public static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");
    public static final DateTimeFormatter SLOT_START = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private TimeFormats() {
    }

    public static LocalDate parseDate(String field, String raw) {
        if (StringUtils.isBlank(raw)) throw new ValidationException(field + " is required.");
        try {
            return LocalDate.parse(raw.trim(), DATE);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + ": " + raw);
        }
    }

    public static LocalTime parseTime(String field, String raw) {
        if (StringUtils.isBlank(raw)) throw new ValidationException(field + " is required.");
        try {
            return LocalTime.parse(raw.trim(), TIME);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + ": " + raw);
        }
    }

    public static LocalDateTime parseSlotStart(String field, String raw) {
        if (StringUtils.isBlank(raw)) throw new ValidationException(field + " is required.");
        try {
            return LocalDateTime.parse(raw.trim(), SLOT_START);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + ": " + raw);
        }
    }

    /**
     * Returns the zone named by {@code raw}, or {@code fallback} when it is blank or unknown.
     */
    public static ZoneId zoneOrDefault(String raw, ZoneId fallback) {
        if (StringUtils.isBlank(raw)) return fallback;
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            return fallback;
        }
    }
}
