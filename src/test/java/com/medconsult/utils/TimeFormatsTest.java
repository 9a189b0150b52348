package com.medconsult.utils;

import com.medconsult.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeFormatsTest {

    @Test
    void shouldParseWireFormats() {
        assertThat(TimeFormats.parseDate("date", "2026-01-05")).isEqualTo(LocalDate.of(2026, 1, 5));
        assertThat(TimeFormats.parseTime("start", "09:30")).isEqualTo(LocalTime.of(9, 30));
        assertThat(TimeFormats.parseSlotStart("slot", "2026-01-05T09:30"))
                .isEqualTo(LocalDateTime.of(2026, 1, 5, 9, 30));
    }

    @Test
    void shouldReportFieldOfMalformedValue() {
        assertThatThrownBy(() -> TimeFormats.parseDate("date", "05/01/2026"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("date");
        assertThatThrownBy(() -> TimeFormats.parseTime("end", "9am"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("end");
        assertThatThrownBy(() -> TimeFormats.parseSlotStart("newSlotStart", " "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("newSlotStart is required.");
    }

    @Test
    void shouldFallBackOnUnknownZone() {
        ZoneId fallback = ZoneId.of("UTC");

        assertThat(TimeFormats.zoneOrDefault("Asia/Kolkata", fallback)).isEqualTo(ZoneId.of("Asia/Kolkata"));
        assertThat(TimeFormats.zoneOrDefault("Mars/Olympus", fallback)).isEqualTo(fallback);
        assertThat(TimeFormats.zoneOrDefault(null, fallback)).isEqualTo(fallback);
    }
}
