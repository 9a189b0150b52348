package com.medconsult.controller;

import com.medconsult.auth.ActingPrincipal;
import com.medconsult.auth.Role;
import com.medconsult.config.ZoneResolver;
import com.medconsult.dto.AppointmentBlock;
import com.medconsult.dto.AppointmentView;
import com.medconsult.dto.AttachPaymentRequest;
import com.medconsult.dto.BookingResult;
import com.medconsult.dto.BulkUpdateResult;
import com.medconsult.dto.CommandResult;
import com.medconsult.dto.CreateBlockRequest;
import com.medconsult.dto.DecisionRequest;
import com.medconsult.dto.RescheduleRequest;
import com.medconsult.dto.SetStatusRequest;
import com.medconsult.dto.SlotIdsRequest;
import com.medconsult.entity.Appointment;
import com.medconsult.exception.ForbiddenException;
import com.medconsult.exception.NotFoundException;
import com.medconsult.exception.ValidationException;
import com.medconsult.repository.AppointmentRepository;
import com.medconsult.service.AppointmentService;
import com.medconsult.service.RescheduleService;
import com.medconsult.utils.TimeFormats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Booking, listing, status decisions and rescheduling of appointments.
 */
@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final RescheduleService rescheduleService;
    private final AppointmentRepository appointmentRepository;
    private final ZoneResolver zoneResolver;

    public AppointmentController(AppointmentService appointmentService,
                                 RescheduleService rescheduleService,
                                 AppointmentRepository appointmentRepository,
                                 ZoneResolver zoneResolver) {
        this.appointmentService = appointmentService;
        this.rescheduleService = rescheduleService;
        this.appointmentRepository = appointmentRepository;
        this.zoneResolver = zoneResolver;
    }

    @PostMapping("/blocks")
    public ResponseEntity<CommandResult> createBlock(ActingPrincipal principal,
                                                     @RequestBody CreateBlockRequest request,
                                                     @RequestHeader(value = ZoneResolver.TIMEZONE_HEADER, required = false) String timezone) {
        principal.requireRole(Role.PATIENT);
        Long patientId = actingPatient(principal, request.patientId());
        if (request.doctorId() == null) throw new ValidationException("Select doctor and date.");
        LocalDate date = TimeFormats.parseDate("date", request.date());
        if (request.slotStarts() == null || request.slotStarts().isEmpty()) {
            throw new ValidationException("Select at least one time slot.");
        }
        List<LocalDateTime> starts = request.slotStarts().stream()
                .map(s -> TimeFormats.parseSlotStart("slotStarts", s))
                .toList();

        ZoneId zone = zoneResolver.resolve(timezone);
        BookingResult result = appointmentService.createBlock(patientId, request.doctorId(), date, starts,
                request.reason(), zone);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requested", result.requested());
        payload.put("created", result.created());
        payload.put("appointmentIds", result.appointmentIds());
        payload.put("rejectedStarts", result.rejectedStarts().stream().map(TimeFormats.SLOT_START::format).toList());

        if (result.isTotalFailure()) {
            return ApiExceptionHandler.respond(CommandResult.of(CommandResult.Type.CONFLICT,
                    "Selected slots unavailable.", payload));
        }
        if (result.isPartial()) {
            return ApiExceptionHandler.respond(CommandResult.of(CommandResult.Type.PARTIAL,
                    result.created() + " of " + result.requested() + " booked.", payload));
        }
        return ApiExceptionHandler.respond(CommandResult.of(CommandResult.Type.CREATED,
                "Appointment requested for " + result.created() + " slot(s).", payload));
    }

    @GetMapping("/blocks")
    public ResponseEntity<CommandResult> blocks(ActingPrincipal principal,
                                                @RequestParam(value = "patientId", required = false) Long patientId,
                                                @RequestParam(value = "doctorId", required = false) Long doctorId,
                                                @RequestHeader(value = ZoneResolver.TIMEZONE_HEADER, required = false) String timezone) {
        ZoneId zone = zoneResolver.resolve(timezone);
        List<AppointmentBlock> blocks = switch (principal.role()) {
            case PATIENT -> appointmentService.listBlocksForPatient(principal.id(), zone);
            case DOCTOR -> appointmentService.listBlocksForDoctor(principal.id(), zone);
            case ADMIN -> {
                if (doctorId != null) yield appointmentService.listBlocksForDoctor(doctorId, zone);
                if (patientId != null) yield appointmentService.listBlocksForPatient(patientId, zone);
                throw new ValidationException("patientId or doctorId is required.");
            }
        };
        return ResponseEntity.ok(CommandResult.data("blocks", blocks));
    }

    @PostMapping("/status")
    public ResponseEntity<CommandResult> setStatus(ActingPrincipal principal, @RequestBody SetStatusRequest request) {
        principal.requireRole(Role.DOCTOR);
        Appointment.Status status = parseStatus(request.newStatus());
        BulkUpdateResult result = appointmentService.setStatus(principal, request.slotIds(), status);
        return ApiExceptionHandler.respond(bulkResult(result,
                "Status updated to '" + status.name().toLowerCase() + "' for selected block."));
    }

    @PostMapping("/cancel")
    public ResponseEntity<CommandResult> cancel(ActingPrincipal principal, @RequestBody SlotIdsRequest request) {
        BulkUpdateResult result = appointmentService.cancelSlots(principal, request.slotIds());
        String message = result.updated() == 0 ? "No slots were cancelled." : "Cancelled " + result.updated() + " slot(s).";
        return ApiExceptionHandler.respond(bulkResult(result, message));
    }

    @PostMapping("/payment")
    public ResponseEntity<CommandResult> attachPayment(ActingPrincipal principal, @RequestBody AttachPaymentRequest request) {
        principal.requireRole(Role.PATIENT);
        if (request.paymentId() == null) throw new ValidationException("paymentId is required.");
        BulkUpdateResult result = appointmentService.attachPayment(principal, request.slotIds(), request.paymentId());
        return ApiExceptionHandler.respond(bulkResult(result, "Payment attached to " + result.updated() + " slot(s)."));
    }

    @PostMapping("/reschedule")
    public ResponseEntity<CommandResult> reschedule(ActingPrincipal principal,
                                                    @RequestBody RescheduleRequest request,
                                                    @RequestHeader(value = ZoneResolver.TIMEZONE_HEADER, required = false) String timezone) {
        principal.requireRole(Role.PATIENT);
        Long patientId = actingPatient(principal, request.patientId());
        if (request.doctorId() == null) throw new ValidationException("Missing appointment information.");
        LocalDateTime originalStart = TimeFormats.parseSlotStart("originalStart", request.originalStart());
        LocalDateTime originalEnd = TimeFormats.parseSlotStart("originalEnd", request.originalEnd());
        LocalDateTime newStart = TimeFormats.parseSlotStart("newSlotStart", request.newSlotStart());

        ZoneId zone = zoneResolver.resolve(timezone);
        Appointment replacement = rescheduleService.requestReschedule(patientId, request.doctorId(),
                originalStart, originalEnd, newStart, zone);
        return ApiExceptionHandler.respond(CommandResult.of(CommandResult.Type.CREATED,
                "Reschedule requested.", Map.of("appointment", AppointmentView.of(replacement, zone))));
    }

    @PostMapping("/{appointmentId}/reschedule-decision")
    public ResponseEntity<CommandResult> decide(ActingPrincipal principal,
                                                @PathVariable Long appointmentId,
                                                @RequestBody DecisionRequest request,
                                                @RequestHeader(value = ZoneResolver.TIMEZONE_HEADER, required = false) String timezone) {
        principal.requireRole(Role.DOCTOR);
        RescheduleService.Decision decision = RescheduleService.Decision.parse(request.decision());
        Appointment target = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new NotFoundException("Appointment not found: " + appointmentId));
        if (!principal.mayAccess(target)) {
            throw new ForbiddenException("Appointment " + appointmentId + " belongs to another doctor.");
        }

        Appointment promoted = rescheduleService.decide(appointmentId, decision);
        if (promoted == null) {
            return ResponseEntity.ok(CommandResult.ok("Reschedule request withdrawn; original appointment kept."));
        }
        ZoneId zone = zoneResolver.resolve(timezone);
        return ResponseEntity.ok(CommandResult.ok("Reschedule approved.",
                Map.of("appointment", AppointmentView.of(promoted, zone))));
    }

    private static Long actingPatient(ActingPrincipal principal, Long requestedPatientId) {
        if (!principal.isAdmin()) return principal.id();
        if (requestedPatientId == null) throw new ValidationException("patientId is required.");
        return requestedPatientId;
    }

    private static Appointment.Status parseStatus(String raw) {
        if (raw != null) {
            for (Appointment.Status s : Appointment.Status.values()) {
                if (s.name().equalsIgnoreCase(raw.trim())) return s;
            }
        }
        throw new ValidationException("Invalid status: " + raw);
    }

    private static CommandResult bulkResult(BulkUpdateResult result, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("updated", result.updated());
        payload.put("rejectedIds", result.rejectedIds());
        CommandResult.Type type = result.rejectedIds().isEmpty() ? CommandResult.Type.OK : CommandResult.Type.PARTIAL;
        return CommandResult.of(type, message, payload);
    }
}
