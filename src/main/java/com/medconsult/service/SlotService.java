package com.medconsult.service;

import com.medconsult.dto.TimeSlot;
import com.medconsult.entity.Appointment;
import com.medconsult.entity.AvailabilityWindow;
import com.medconsult.entity.Doctor;
import com.medconsult.exception.NotFoundException;
import com.medconsult.repository.AppointmentRepository;
import com.medconsult.repository.AvailabilityWindowRepository;
import com.medconsult.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Open slots of a doctor on a date. The database is the only source of truth:
 * windows and booked times are read fresh on every call.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);

    private final DoctorRepository doctorRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final AppointmentRepository appointmentRepository;
    private final SlotGenerator slotGenerator;
    private final Clock clock;

    public SlotService(DoctorRepository doctorRepository,
                       AvailabilityWindowRepository windowRepository,
                       AppointmentRepository appointmentRepository,
                       SlotGenerator slotGenerator,
                       Clock clock) {
        this.doctorRepository = doctorRepository;
        this.windowRepository = windowRepository;
        this.appointmentRepository = appointmentRepository;
        this.slotGenerator = slotGenerator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TimeSlot> listSlots(Long doctorId, LocalDate date, ZoneId zone) {
        Doctor doctor = doctorRepository.findByIdAndActiveTrue(doctorId)
                .orElseThrow(() -> new NotFoundException("Doctor not found: " + doctorId));
        return openSlots(doctor.getId(), date, zone);
    }

    /**
     * Start instants of the open slots; what booking and rescheduling validate against.
     */
    @Transactional(readOnly = true)
    public Set<Instant> openSlotStarts(Long doctorId, LocalDate date, ZoneId zone) {
        return openSlots(doctorId, date, zone).stream()
                .map(s -> s.start().toInstant())
                .collect(Collectors.toCollection(HashSet::new));
    }

    @Transactional(readOnly = true)
    public boolean isOpenSlot(Long doctorId, LocalDateTime start, ZoneId zone) {
        return openSlotStarts(doctorId, start.toLocalDate(), zone)
                .contains(start.atZone(zone).toInstant());
    }

    @Transactional(readOnly = true)
    public boolean isOccupied(Long doctorId, Instant start) {
        return appointmentRepository.existsByDoctorIdAndScheduledForAndStatusIn(
                doctorId, start, Appointment.Status.ACTIVE);
    }

    private List<TimeSlot> openSlots(Long doctorId, LocalDate date, ZoneId zone) {
        List<AvailabilityWindow> windows = windowRepository.findByDoctorIdAndDateOrderByStartTimeAsc(doctorId, date);
        if (windows.isEmpty()) return List.of();

        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();
        Set<Instant> booked = new HashSet<>(appointmentRepository.findBookedTimes(
                doctorId, dayStart, dayEnd, Appointment.Status.ACTIVE));

        List<TimeSlot> slots = slotGenerator.generate(date, zone, clock.instant(), windows, booked);
        log.debug("Doctor {} on {}: {} windows, {} booked, {} open slots",
                doctorId, date, windows.size(), booked.size(), slots.size());
        return slots;
    }
}
