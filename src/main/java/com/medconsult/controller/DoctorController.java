package com.medconsult.controller;

import com.medconsult.auth.ActingPrincipal;
import com.medconsult.config.ZoneResolver;
import com.medconsult.dto.CommandResult;
import com.medconsult.dto.DoctorView;
import com.medconsult.dto.TimeSlot;
import com.medconsult.dto.WindowRequest;
import com.medconsult.dto.WindowView;
import com.medconsult.service.AppointmentService;
import com.medconsult.service.AvailabilityService;
import com.medconsult.service.SlotService;
import com.medconsult.utils.TimeFormats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Doctors, their open slots and their availability windows.
 */
@RestController
@RequestMapping("/api/doctors")
public class DoctorController {

    private final AppointmentService appointmentService;
    private final SlotService slotService;
    private final AvailabilityService availabilityService;
    private final ZoneResolver zoneResolver;

    public DoctorController(AppointmentService appointmentService,
                            SlotService slotService,
                            AvailabilityService availabilityService,
                            ZoneResolver zoneResolver) {
        this.appointmentService = appointmentService;
        this.slotService = slotService;
        this.availabilityService = availabilityService;
        this.zoneResolver = zoneResolver;
    }

    @GetMapping
    public ResponseEntity<CommandResult> doctors(ActingPrincipal principal) {
        List<DoctorView> doctors = appointmentService.getActiveDoctors().stream().map(DoctorView::of).toList();
        return ResponseEntity.ok(CommandResult.data("doctors", doctors));
    }

    @GetMapping("/{doctorId}/slots")
    public ResponseEntity<CommandResult> slots(ActingPrincipal principal,
                                               @PathVariable Long doctorId,
                                               @RequestParam("date") String date,
                                               @RequestHeader(value = ZoneResolver.TIMEZONE_HEADER, required = false) String timezone) {
        LocalDate day = TimeFormats.parseDate("date", date);
        ZoneId zone = zoneResolver.resolve(timezone);
        List<TimeSlot> slots = slotService.listSlots(doctorId, day, zone);
        return ResponseEntity.ok(CommandResult.ok(null, Map.of("date", day, "zone", zone.getId(), "slots", slots)));
    }

    @GetMapping("/{doctorId}/availability")
    public ResponseEntity<CommandResult> windows(ActingPrincipal principal, @PathVariable Long doctorId) {
        principal.requireDoctor(doctorId);
        List<WindowView> windows = availabilityService.listWindows(doctorId).stream().map(WindowView::of).toList();
        return ResponseEntity.ok(CommandResult.data("windows", windows));
    }

    @PutMapping("/{doctorId}/availability")
    public ResponseEntity<CommandResult> upsertWindow(ActingPrincipal principal,
                                                      @PathVariable Long doctorId,
                                                      @RequestBody WindowRequest request) {
        principal.requireDoctor(doctorId);
        LocalDate date = TimeFormats.parseDate("date", request.date());
        LocalTime start = TimeFormats.parseTime("startTime", request.startTime());
        LocalTime end = TimeFormats.parseTime("endTime", request.endTime());

        AvailabilityService.UpsertResult result = availabilityService.upsertWindow(doctorId, date, start, end);
        String message = "Availability " + (result.created() ? "created" : "updated") + " for " + date + ".";
        CommandResult.Type type = result.created() ? CommandResult.Type.CREATED : CommandResult.Type.OK;
        return ApiExceptionHandler.respond(CommandResult.of(type, message, Map.of("window", WindowView.of(result.window()))));
    }

    @DeleteMapping("/{doctorId}/availability/slots")
    public ResponseEntity<CommandResult> deleteSlot(ActingPrincipal principal,
                                                    @PathVariable Long doctorId,
                                                    @RequestParam("slotStart") String slotStart,
                                                    @RequestHeader(value = ZoneResolver.TIMEZONE_HEADER, required = false) String timezone) {
        principal.requireDoctor(doctorId);
        LocalDateTime start = TimeFormats.parseSlotStart("slotStart", slotStart);
        availabilityService.deleteSlot(doctorId, start, zoneResolver.resolve(timezone));
        return ResponseEntity.ok(CommandResult.ok("Slot removed."));
    }
}
