package com.medconsult.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of booking a block of slots. Starts that were not open or were taken
 * by a concurrent booking are listed in {@code rejectedStarts}.
 */
public record BookingResult(int requested, int created, List<Long> appointmentIds, List<LocalDateTime> rejectedStarts) {

    public BookingResult {
        appointmentIds = List.copyOf(appointmentIds);
        rejectedStarts = List.copyOf(rejectedStarts);
    }

    public boolean isTotalFailure() {
        return created == 0;
    }

    public boolean isPartial() {
        return created > 0 && created < requested;
    }
}
