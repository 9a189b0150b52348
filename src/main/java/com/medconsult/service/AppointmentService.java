package com.medconsult.service;

import com.medconsult.auth.ActingPrincipal;
import com.medconsult.dto.AppointmentBlock;
import com.medconsult.dto.BookingResult;
import com.medconsult.dto.BulkUpdateResult;
import com.medconsult.entity.Appointment;
import com.medconsult.entity.Doctor;
import com.medconsult.entity.Patient;
import com.medconsult.entity.Payment;
import com.medconsult.exception.ConflictException;
import com.medconsult.exception.ForbiddenException;
import com.medconsult.exception.NotFoundException;
import com.medconsult.exception.StateException;
import com.medconsult.exception.ValidationException;
import com.medconsult.repository.AppointmentRepository;
import com.medconsult.repository.DoctorRepository;
import com.medconsult.repository.PatientRepository;
import com.medconsult.repository.PaymentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Booking and bulk status changes. The unique key on (doctor, active slot) is
 * the final word on double booking; every insert runs in its own transaction so
 * a lost race only costs that one slot.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    /** Targets a doctor may set through a bulk status change. */
    public static final Set<Appointment.Status> SETTABLE_STATUSES = EnumSet.of(
            Appointment.Status.REQUESTED,
            Appointment.Status.APPROVED,
            Appointment.Status.REJECTED,
            Appointment.Status.COMPLETED,
            Appointment.Status.CANCELLED,
            Appointment.Status.RESCHEDULE_REQUESTED);

    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;
    private final PaymentRepository paymentRepository;
    private final SlotService slotService;
    private final RescheduleService rescheduleService;
    private final BlockGrouper blockGrouper;
    private final TransactionTemplate slotInsertTx;

    public AppointmentService(AppointmentRepository appointmentRepository,
                              DoctorRepository doctorRepository,
                              PatientRepository patientRepository,
                              PaymentRepository paymentRepository,
                              SlotService slotService,
                              RescheduleService rescheduleService,
                              BlockGrouper blockGrouper,
                              PlatformTransactionManager transactionManager) {
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.patientRepository = patientRepository;
        this.paymentRepository = paymentRepository;
        this.slotService = slotService;
        this.rescheduleService = rescheduleService;
        this.blockGrouper = blockGrouper;
        this.slotInsertTx = new TransactionTemplate(transactionManager);
        this.slotInsertTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional(readOnly = true)
    public List<Doctor> getActiveDoctors() {
        return doctorRepository.findByActiveTrueOrderByName();
    }

    // =========================================================
    // BOOK A BLOCK OF SLOTS
    // =========================================================

    /**
     * Books each requested start independently. A start is rejected when it is not
     * on {@code date}, is not an open slot, or loses the insert race.
     */
    public BookingResult createBlock(Long patientId, Long doctorId, LocalDate date,
                                     List<LocalDateTime> slotStarts, String reason, ZoneId zone) {
        if (slotStarts == null || slotStarts.isEmpty()) {
            throw new ValidationException("Select at least one time slot.");
        }
        Patient patient = patientRepository.findById(patientId)
                .orElseThrow(() -> new NotFoundException("Patient not found: " + patientId));
        Doctor doctor = doctorRepository.findByIdAndActiveTrue(doctorId)
                .orElseThrow(() -> new NotFoundException("Doctor not found: " + doctorId));

        Set<LocalDateTime> requested = new LinkedHashSet<>(slotStarts);
        Set<Instant> open = slotService.openSlotStarts(doctorId, date, zone);
        String normalizedReason = StringUtils.trimToNull(reason);

        List<Long> createdIds = new ArrayList<>();
        List<LocalDateTime> rejected = new ArrayList<>();
        for (LocalDateTime start : requested) {
            Instant instant = start.atZone(zone).toInstant();
            if (!start.toLocalDate().equals(date) || !open.contains(instant)) {
                rejected.add(start);
                continue;
            }
            Appointment appointment = Appointment.builder()
                    .patient(patient)
                    .doctor(doctor)
                    .scheduledFor(instant)
                    .reason(normalizedReason)
                    .status(Appointment.Status.REQUESTED)
                    .build();
            try {
                Appointment saved = slotInsertTx.execute(tx -> appointmentRepository.saveAndFlush(appointment));
                createdIds.add(saved.getId());
            } catch (DataIntegrityViolationException e) {
                log.info("Slot {} of doctor {} was just taken, skipping", start, doctorId);
                rejected.add(start);
            }
        }

        BookingResult result = new BookingResult(requested.size(), createdIds.size(), createdIds, rejected);
        log.info("Booked {} of {} slot(s): patient={} doctor={} date={}",
                result.created(), result.requested(), patientId, doctorId, date);
        return result;
    }

    // =========================================================
    // LIST BLOCKS
    // =========================================================

    @Transactional(readOnly = true)
    public List<AppointmentBlock> listBlocksForPatient(Long patientId, ZoneId zone) {
        return blockGrouper.group(appointmentRepository.findByPatientId(patientId),
                BlockGrouper.Perspective.PATIENT, zone);
    }

    @Transactional(readOnly = true)
    public List<AppointmentBlock> listBlocksForDoctor(Long doctorId, ZoneId zone) {
        return blockGrouper.group(appointmentRepository.findByDoctorId(doctorId),
                BlockGrouper.Perspective.DOCTOR, zone);
    }

    // =========================================================
    // BULK STATUS / CANCEL
    // =========================================================

    /**
     * Doctor decision over a selection of slots. Appointments linked to an original
     * go through the reschedule protocol; everything else changes status in place.
     */
    @Transactional
    public BulkUpdateResult setStatus(ActingPrincipal principal, List<Long> slotIds, Appointment.Status newStatus) {
        if (!SETTABLE_STATUSES.contains(newStatus)) {
            throw new ValidationException("Invalid status: " + newStatus);
        }
        Selection selection = select(principal, slotIds);

        Set<Long> removed = new HashSet<>();
        int updated = 0;
        for (Appointment appt : selection.accessible()) {
            if (removed.contains(appt.getId())) continue;
            Long originalId = appt.getRescheduledFromId();

            if (originalId != null && newStatus == Appointment.Status.APPROVED) {
                rescheduleService.apply(appt, RescheduleService.Decision.APPROVE);
                removed.add(originalId);
            } else if (originalId != null
                    && (newStatus == Appointment.Status.REJECTED || newStatus == Appointment.Status.CANCELLED)) {
                rescheduleService.apply(appt, newStatus == Appointment.Status.REJECTED
                        ? RescheduleService.Decision.REJECT
                        : RescheduleService.Decision.CANCEL);
                removed.add(appt.getId());
            } else {
                appt.setStatus(newStatus);
                appointmentRepository.save(appt);
            }
            updated++;
        }
        flushOrConflict();

        log.info("Status set to {} on {} appointment(s) by {} {}", newStatus, updated, principal.role(), principal.id());
        return new BulkUpdateResult(updated, selection.rejectedIds());
    }

    @Transactional
    public BulkUpdateResult cancelSlots(ActingPrincipal principal, List<Long> slotIds) {
        Selection selection = select(principal, slotIds);
        int count = 0;
        for (Appointment appt : selection.accessible()) {
            if (appt.getStatus() != Appointment.Status.CANCELLED) {
                appt.setStatus(Appointment.Status.CANCELLED);
                appointmentRepository.save(appt);
                count++;
            }
        }
        log.info("Cancelled {} slot(s) by {} {}", count, principal.role(), principal.id());
        return new BulkUpdateResult(count, selection.rejectedIds());
    }

    // =========================================================
    // PAYMENT LINK
    // =========================================================

    @Transactional
    public BulkUpdateResult attachPayment(ActingPrincipal principal, List<Long> slotIds, Long paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + paymentId));
        if (!principal.isAdmin() && !payment.getPatient().getId().equals(principal.id())) {
            throw new ForbiddenException("Payment " + paymentId + " belongs to another patient.");
        }
        Selection selection = select(principal, slotIds);
        int count = 0;
        for (Appointment appt : selection.accessible()) {
            if (!appt.getPatient().getId().equals(payment.getPatient().getId())) {
                throw new StateException("Appointment " + appt.getId() + " is not booked by the paying patient.");
            }
            appt.setPayment(payment);
            appointmentRepository.save(appt);
            count++;
        }
        log.info("Payment {} attached to {} appointment(s)", paymentId, count);
        return new BulkUpdateResult(count, selection.rejectedIds());
    }

    private record Selection(List<Appointment> accessible, List<Long> rejectedIds) {
    }

    /** Splits requested ids into appointments the principal may act on and ids refused. */
    private Selection select(ActingPrincipal principal, List<Long> slotIds) {
        if (slotIds == null || slotIds.isEmpty()) {
            throw new ValidationException("No slots selected.");
        }
        Set<Long> requested = new LinkedHashSet<>(slotIds);
        List<Appointment> accessible = appointmentRepository.findByIdInOrderByScheduledForAsc(requested).stream()
                .filter(principal::mayAccess)
                .toList();
        if (accessible.isEmpty()) {
            throw new NotFoundException("No matching appointments.");
        }
        Set<Long> found = new HashSet<>();
        accessible.forEach(a -> found.add(a.getId()));
        List<Long> rejected = requested.stream().filter(id -> !found.contains(id)).toList();
        return new Selection(accessible, rejected);
    }

    private void flushOrConflict() {
        try {
            appointmentRepository.flush();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(
                    "Another active appointment already holds one of the selected slots.");
        }
    }
}
