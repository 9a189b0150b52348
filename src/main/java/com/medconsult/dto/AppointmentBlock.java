package com.medconsult.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.medconsult.entity.Appointment;
import com.medconsult.service.SlotGenerator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A run of contiguous 30-minute appointments that share doctor, patient, date,
 * status, reason, payment and reschedule link. Built for display only, never stored.
 */
@Getter
@ToString(exclude = "appointments")
@EqualsAndHashCode(exclude = "appointments")
public class AppointmentBlock {

    public record SlotRange(Long id, ZonedDateTime start, ZonedDateTime end) {
    }

    private final Long doctorId;
    private final String doctorName;
    private final Long patientId;
    private final String patientName;
    private final LocalDate date;
    private final ZonedDateTime start;
    private ZonedDateTime end;
    private final Appointment.Status status;
    private final String reason;
    private final Long paymentId;
    private final boolean paid;
    private final Long rescheduledFromId;
    private final List<Long> slotIds = new ArrayList<>();
    private final List<SlotRange> slotRanges = new ArrayList<>();

    @JsonIgnore
    private final List<Appointment> appointments = new ArrayList<>();

    private AppointmentBlock(Appointment first, ZonedDateTime start) {
        this.doctorId = first.getDoctor().getId();
        this.doctorName = first.getDoctor().getName();
        this.patientId = first.getPatient().getId();
        this.patientName = first.getPatient().getName();
        this.date = start.toLocalDate();
        this.start = start;
        this.end = start.plus(SlotGenerator.SLOT_DURATION);
        this.status = first.getStatus();
        this.reason = first.getReason();
        this.paymentId = first.getPaymentId();
        this.paid = first.isPaid();
        this.rescheduledFromId = first.getRescheduledFromId();
        add(first, start);
    }

    public static AppointmentBlock open(Appointment first, ZoneId zone) {
        return new AppointmentBlock(first, first.getScheduledFor().atZone(zone));
    }

    public void append(Appointment next, ZoneId zone) {
        ZonedDateTime slotStart = next.getScheduledFor().atZone(zone);
        add(next, slotStart);
        end = slotStart.plus(SlotGenerator.SLOT_DURATION);
    }

    private void add(Appointment appointment, ZonedDateTime slotStart) {
        appointments.add(appointment);
        slotIds.add(appointment.getId());
        slotRanges.add(new SlotRange(appointment.getId(), slotStart, slotStart.plus(SlotGenerator.SLOT_DURATION)));
    }

    @JsonIgnore
    public ZonedDateTime getLastSlotStart() {
        return slotRanges.get(slotRanges.size() - 1).start();
    }

    public List<Long> getSlotIds() {
        return Collections.unmodifiableList(slotIds);
    }

    public List<SlotRange> getSlotRanges() {
        return Collections.unmodifiableList(slotRanges);
    }

    public List<Appointment> getAppointments() {
        return Collections.unmodifiableList(appointments);
    }
}
