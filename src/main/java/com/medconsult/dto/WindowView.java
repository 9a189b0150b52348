package com.medconsult.dto;

import com.medconsult.entity.AvailabilityWindow;

import java.time.LocalDate;
import java.time.LocalTime;

public record WindowView(Long id, Long doctorId, LocalDate date, LocalTime startTime, LocalTime endTime) {

    public static WindowView of(AvailabilityWindow window) {
        return new WindowView(window.getId(), window.getDoctor().getId(), window.getDate(),
                window.getStartTime(), window.getEndTime());
    }
}
