package com.medconsult.service;

import com.medconsult.dto.TimeSlot;
import com.medconsult.entity.AvailabilityWindow;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Cuts availability windows into 30-minute slots. No side effects: the same
 * inputs always give the same slots.
 */
@Component
public class SlotGenerator {

    public static final int SLOT_DURATION_MINUTES = 30;
    public static final Duration SLOT_DURATION = Duration.ofMinutes(SLOT_DURATION_MINUTES);

    /**
     * Returns the slots of {@code windows} on {@code date} that start strictly after
     * {@code now} and are not in {@code booked}, ordered by window then time.
     * A tail shorter than 30 minutes never becomes a slot.
     */
    public List<TimeSlot> generate(LocalDate date, ZoneId zone, Instant now,
                                   Collection<AvailabilityWindow> windows, Set<Instant> booked) {
        List<AvailabilityWindow> ordered = windows.stream()
                .sorted(Comparator.comparing(AvailabilityWindow::getStartTime))
                .toList();

        List<TimeSlot> slots = new ArrayList<>();
        for (AvailabilityWindow window : ordered) {
            ZonedDateTime windowEnd = date.atTime(window.getEndTime()).atZone(zone);
            for (ZonedDateTime start = date.atTime(window.getStartTime()).atZone(zone);
                 !start.plus(SLOT_DURATION).isAfter(windowEnd);
                 start = start.plus(SLOT_DURATION)) {
                Instant startInstant = start.toInstant();
                if (startInstant.isAfter(now) && !booked.contains(startInstant)) {
                    slots.add(new TimeSlot(start, start.plus(SLOT_DURATION)));
                }
            }
        }
        return slots;
    }
}
