package com.medconsult.dto;

import com.medconsult.entity.Appointment;

import java.time.ZoneId;
import java.time.ZonedDateTime;

public record AppointmentView(Long id, Long patientId, Long doctorId, ZonedDateTime scheduledFor,
                              String reason, Appointment.Status status, Long rescheduledFromId, boolean paid) {

    public static AppointmentView of(Appointment a, ZoneId zone) {
        return new AppointmentView(a.getId(), a.getPatient().getId(), a.getDoctor().getId(),
                a.getScheduledFor().atZone(zone), a.getReason(), a.getStatus(),
                a.getRescheduledFromId(), a.isPaid());
    }
}
