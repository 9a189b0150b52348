package com.medconsult.service;

import com.medconsult.entity.AvailabilityWindow;
import com.medconsult.entity.Doctor;
import com.medconsult.exception.ConflictException;
import com.medconsult.exception.NotFoundException;
import com.medconsult.exception.StateException;
import com.medconsult.exception.ValidationException;
import com.medconsult.repository.AvailabilityWindowRepository;
import com.medconsult.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Doctor-side edits of availability windows. Every edit runs in one transaction
 * holding a write lock on the doctor row, so two edits of the same doctor's
 * windows never interleave.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final DoctorRepository doctorRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final SlotService slotService;
    private final Clock clock;

    public AvailabilityService(DoctorRepository doctorRepository,
                               AvailabilityWindowRepository windowRepository,
                               SlotService slotService,
                               Clock clock) {
        this.doctorRepository = doctorRepository;
        this.windowRepository = windowRepository;
        this.slotService = slotService;
        this.clock = clock;
    }

    public record UpsertResult(AvailabilityWindow window, boolean created) {
    }

    @Transactional(readOnly = true)
    public List<AvailabilityWindow> listWindows(Long doctorId) {
        if (!doctorRepository.existsById(doctorId)) {
            throw new NotFoundException("Doctor not found: " + doctorId);
        }
        return windowRepository.findByDoctorIdOrderByDateAscStartTimeAsc(doctorId);
    }

    /**
     * Sets the open window of a doctor on a date. Windows left on that date by
     * earlier slot deletions are replaced by the single new one.
     */
    @Transactional
    public UpsertResult upsertWindow(Long doctorId, LocalDate date, LocalTime start, LocalTime end) {
        if (!start.isBefore(end)) {
            throw new ValidationException("Start must be before end.");
        }
        Doctor doctor = lockDoctor(doctorId);

        List<AvailabilityWindow> existing = windowRepository.findByDoctorIdAndDateOrderByStartTimeAsc(doctorId, date);
        AvailabilityWindow window;
        boolean created = existing.isEmpty();
        if (created) {
            window = AvailabilityWindow.builder().doctor(doctor).date(date).startTime(start).endTime(end).build();
        } else {
            window = existing.get(0);
            window.setStartTime(start);
            window.setEndTime(end);
            if (existing.size() > 1) {
                windowRepository.deleteAll(existing.subList(1, existing.size()));
            }
        }
        window = windowRepository.save(window);

        log.info("Availability {} for doctor {} on {}: {}-{}", created ? "created" : "updated", doctorId, date, start, end);
        return new UpsertResult(window, created);
    }

    /**
     * Withdraws one future, unbooked 30-minute slot from the window containing it,
     * deleting, shrinking or splitting that window.
     */
    @Transactional
    public void deleteSlot(Long doctorId, LocalDateTime slotStart, ZoneId zone) {
        Doctor doctor = lockDoctor(doctorId);

        var startInstant = slotStart.atZone(zone).toInstant();
        if (!startInstant.isAfter(clock.instant())) {
            throw new StateException("Cannot delete past slot.");
        }
        if (slotService.isOccupied(doctorId, startInstant)) {
            throw new ConflictException("Cannot delete a booked slot.");
        }

        LocalDate date = slotStart.toLocalDate();
        LocalDateTime slotEnd = slotStart.plus(SlotGenerator.SLOT_DURATION);
        AvailabilityWindow window = windowRepository.findByDoctorIdAndDateOrderByStartTimeAsc(doctorId, date).stream()
                .filter(w -> !date.atTime(w.getStartTime()).isAfter(slotStart)
                        && !slotEnd.isAfter(date.atTime(w.getEndTime())))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("No availability window for this slot."));

        LocalTime s = window.getStartTime();
        LocalTime e = window.getEndTime();
        LocalTime slotStartTime = slotStart.toLocalTime();
        LocalTime slotEndTime = slotEnd.toLocalTime();

        if (s.equals(slotStartTime) && e.equals(slotEndTime)) {
            windowRepository.delete(window);
            log.info("Doctor {} {}: removed whole window {}-{}", doctorId, date, s, e);
        } else if (s.equals(slotStartTime)) {
            window.setStartTime(slotEndTime);
            windowRepository.save(window);
            log.info("Doctor {} {}: window {}-{} now starts at {}", doctorId, date, s, e, slotEndTime);
        } else if (e.equals(slotEndTime)) {
            window.setEndTime(slotStartTime);
            windowRepository.save(window);
            log.info("Doctor {} {}: window {}-{} now ends at {}", doctorId, date, s, e, slotStartTime);
        } else {
            windowRepository.save(AvailabilityWindow.builder()
                    .doctor(doctor)
                    .date(date)
                    .startTime(slotEndTime)
                    .endTime(e)
                    .build());
            window.setEndTime(slotStartTime);
            windowRepository.save(window);
            log.info("Doctor {} {}: split window {}-{} around {}", doctorId, date, s, e, slotStartTime);
        }
    }

    private Doctor lockDoctor(Long doctorId) {
        return doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> new NotFoundException("Doctor not found: " + doctorId));
    }
}
