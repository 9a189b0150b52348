package com.medconsult.service;

import com.medconsult.entity.Appointment;
import com.medconsult.entity.Doctor;
import com.medconsult.entity.Patient;
import com.medconsult.exception.ConflictException;
import com.medconsult.exception.NotFoundException;
import com.medconsult.exception.StateException;
import com.medconsult.exception.ValidationException;
import com.medconsult.repository.AppointmentRepository;
import com.medconsult.repository.DoctorRepository;
import com.medconsult.repository.PatientRepository;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reschedule protocol. A patient asks to move a block: a RESCHEDULE_REQUESTED
 * appointment is created next to the untouched original and linked to it by id.
 * The doctor then approves (original deleted, replacement APPROVED) or rejects
 * (replacement deleted, original unchanged).
 */
@Service
public class RescheduleService {

    private static final Logger log = LoggerFactory.getLogger(RescheduleService.class);

    /** Blocks in these states cannot be moved. */
    private static final Set<Appointment.Status> NOT_RESCHEDULABLE =
            EnumSet.of(Appointment.Status.CANCELLED, Appointment.Status.COMPLETED, Appointment.Status.RESCHEDULED);

    public enum Decision {
        APPROVE, REJECT, CANCEL;

        public static Decision parse(String raw) {
            if (raw != null) {
                for (Decision d : values()) {
                    if (d.name().equalsIgnoreCase(raw.trim())) return d;
                }
            }
            throw new ValidationException("Unknown decision: " + raw);
        }
    }

    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;
    private final SlotService slotService;
    private final Clock clock;

    public RescheduleService(AppointmentRepository appointmentRepository,
                             DoctorRepository doctorRepository,
                             PatientRepository patientRepository,
                             SlotService slotService,
                             Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.patientRepository = patientRepository;
        this.slotService = slotService;
        this.clock = clock;
    }

    @Transactional
    public Appointment requestReschedule(Long patientId, Long doctorId,
                                         LocalDateTime originalStart, LocalDateTime originalEnd,
                                         LocalDateTime newStart, ZoneId zone) {
        if (!originalStart.isBefore(originalEnd)) {
            throw new ValidationException("Original block start must be before its end.");
        }
        Patient patient = patientRepository.findById(patientId)
                .orElseThrow(() -> new NotFoundException("Patient not found: " + patientId));
        Doctor doctor = doctorRepository.findById(doctorId)
                .orElseThrow(() -> new NotFoundException("Doctor not found: " + doctorId));

        Instant blockStart = originalStart.atZone(zone).toInstant();
        Instant blockEnd = originalEnd.atZone(zone).toInstant();
        List<Appointment> block = appointmentRepository
                .findByPatientIdAndDoctorIdAndScheduledForGreaterThanEqualAndScheduledForLessThanOrderByScheduledForAsc(
                        patientId, doctorId, blockStart, blockEnd);
        if (block.isEmpty()) {
            throw new NotFoundException("No appointment block found in that range.");
        }
        Appointment root = block.stream()
                .filter(a -> !NOT_RESCHEDULABLE.contains(a.getStatus()))
                .findFirst()
                .orElseThrow(() -> new StateException("Appointment block is " + block.get(0).getStatus()
                        + " and cannot be rescheduled."));

        if (appointmentRepository.existsByRescheduledFromIdAndStatus(root.getId(), Appointment.Status.RESCHEDULE_REQUESTED)) {
            throw new StateException("A reschedule of this appointment is already pending.");
        }

        Instant now = clock.instant();
        if (!blockStart.isAfter(now)) {
            throw new StateException("Cannot reschedule past appointments.");
        }
        Instant newInstant = newStart.atZone(zone).toInstant();
        if (!newInstant.isAfter(now)) {
            throw new StateException("Cannot reschedule to the past.");
        }
        if (slotService.isOccupied(doctorId, newInstant)) {
            throw new ConflictException("Slot just taken. Pick another.");
        }
        if (!slotService.isOpenSlot(doctorId, newStart, zone)) {
            throw new ConflictException("Requested time is not an open slot of this doctor.");
        }

        Appointment replacement = Appointment.builder()
                .patient(patient)
                .doctor(doctor)
                .scheduledFor(newInstant)
                .reason(root.getReason())
                .status(Appointment.Status.RESCHEDULE_REQUESTED)
                .rescheduledFromId(root.getId())
                .build();
        try {
            replacement = appointmentRepository.saveAndFlush(replacement);
        } catch (DataIntegrityViolationException e) {
            log.info("Reschedule target {} for doctor {} was taken concurrently", newStart, doctorId);
            throw new ConflictException("Slot just taken. Pick another.");
        }

        log.info("Reschedule requested: appointment {} -> {} (new id {}) patient={} doctor={}",
                root.getId(), newStart, replacement.getId(), patientId, doctorId);
        return replacement;
    }

    /**
     * Resolves a pending reschedule. Returns the promoted appointment on approval,
     * null when the replacement was removed.
     */
    @Transactional
    public Appointment decide(Long appointmentId, Decision decision) {
        Appointment replacement = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new NotFoundException("Appointment not found: " + appointmentId));
        if (replacement.getRescheduledFromId() == null
                || replacement.getStatus() != Appointment.Status.RESCHEDULE_REQUESTED) {
            throw new StateException("Appointment " + appointmentId + " has no pending reschedule.");
        }
        return apply(replacement, decision);
    }

    /**
     * Applies a decision to an appointment linked to an original. Runs inside the
     * caller's transaction; bulk status updates use it for every linked appointment.
     */
    @Transactional
    public Appointment apply(Appointment replacement, Decision decision) {
        Long originalId = replacement.getRescheduledFromId();
        if (decision == Decision.APPROVE) {
            replacement.setRescheduledFromId(null);
            replacement.setStatus(Appointment.Status.APPROVED);
            replacement = appointmentRepository.saveAndFlush(replacement);
            Hibernate.initialize(replacement.getPayment());
            if (originalId != null) {
                appointmentRepository.findById(originalId).ifPresent(appointmentRepository::delete);
                appointmentRepository.detachSuccessors(originalId);
            }
            log.info("Reschedule approved: appointment {} replaces {}", replacement.getId(), originalId);
            return replacement;
        }

        appointmentRepository.delete(replacement);
        appointmentRepository.flush();
        appointmentRepository.detachSuccessors(replacement.getId());
        log.info("Reschedule {}: appointment {} removed, original {} unchanged",
                decision.name().toLowerCase(), replacement.getId(), originalId);
        return null;
    }
}
