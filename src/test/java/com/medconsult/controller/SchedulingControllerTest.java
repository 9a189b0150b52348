package com.medconsult.controller;

import com.medconsult.auth.ActingPrincipal;
import com.medconsult.auth.ActingPrincipalResolver;
import com.medconsult.auth.Role;
import com.medconsult.config.ZoneResolver;
import com.medconsult.dto.BookingResult;
import com.medconsult.dto.BulkUpdateResult;
import com.medconsult.dto.TimeSlot;
import com.medconsult.entity.Appointment;
import com.medconsult.entity.Doctor;
import com.medconsult.entity.Patient;
import com.medconsult.exception.ConflictException;
import com.medconsult.repository.AppointmentRepository;
import com.medconsult.service.AppointmentService;
import com.medconsult.service.AvailabilityService;
import com.medconsult.service.PaymentService;
import com.medconsult.service.RescheduleService;
import com.medconsult.service.SlotService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({AppointmentController.class, DoctorController.class, PaymentController.class})
@Import(ZoneResolver.class)
class SchedulingControllerTest {

    private static final ZoneId KOLKATA = ZoneId.of("Asia/Kolkata");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private AppointmentService appointmentService;

    @MockBean
    private SlotService slotService;

    @MockBean
    private AvailabilityService availabilityService;

    @MockBean
    private RescheduleService rescheduleService;

    @MockBean
    private AppointmentRepository appointmentRepository;

    @MockBean
    private PaymentService paymentService;

    @Test
    void shouldRequireIdentityHeaders() throws Exception {
        mvc.perform(get("/api/doctors"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.type").value("UNAUTHORIZED"));
    }

    @Test
    void shouldListSlotsInRequestZone() throws Exception {
        ZonedDateTime start = ZonedDateTime.of(2026, 1, 5, 9, 0, 0, 0, KOLKATA);
        when(slotService.listSlots(7L, LocalDate.of(2026, 1, 5), KOLKATA))
                .thenReturn(List.of(new TimeSlot(start, start.plusMinutes(30))));

        mvc.perform(get("/api/doctors/7/slots").param("date", "2026-01-05")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "patient")
                        .header(ZoneResolver.TIMEZONE_HEADER, "Asia/Kolkata"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("OK"))
                .andExpect(jsonPath("$.payload.zone").value("Asia/Kolkata"))
                .andExpect(jsonPath("$.payload.slots", hasSize(1)));
    }

    @Test
    void shouldRejectMalformedDate() throws Exception {
        mvc.perform(get("/api/doctors/7/slots").param("date", "05-01-2026")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"));
        verifyNoInteractions(slotService);
    }

    @Test
    void shouldReportPartialBooking() throws Exception {
        when(appointmentService.createBlock(eq(10L), eq(7L), eq(LocalDate.of(2026, 1, 5)), anyList(), any(), any()))
                .thenReturn(new BookingResult(2, 1, List.of(100L), List.of(LocalDateTime.parse("2026-01-05T09:30"))));

        mvc.perform(post("/api/appointments/blocks")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"doctorId": 7, "date": "2026-01-05",
                                 "slotStarts": ["2026-01-05T09:00", "2026-01-05T09:30"], "reason": "Checkup"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("PARTIAL"))
                .andExpect(jsonPath("$.payload.created").value(1))
                .andExpect(jsonPath("$.payload.rejectedStarts[0]").value("2026-01-05T09:30"));
    }

    @Test
    void shouldAnswerConflictWhenNothingBooked() throws Exception {
        when(appointmentService.createBlock(any(), any(), any(), anyList(), any(), any()))
                .thenReturn(new BookingResult(1, 0, List.of(), List.of(LocalDateTime.parse("2026-01-05T09:00"))));

        mvc.perform(post("/api/appointments/blocks")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"doctorId\": 7, \"date\": \"2026-01-05\", \"slotStarts\": [\"2026-01-05T09:00\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Selected slots unavailable."));
    }

    @Test
    void shouldKeepPatientsOffDoctorCommands() throws Exception {
        mvc.perform(post("/api/appointments/status")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotIds\": [1], \"newStatus\": \"approved\"}"))
                .andExpect(status().isForbidden());

        mvc.perform(delete("/api/doctors/7/availability/slots").param("slotStart", "2026-01-05T09:00")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "8")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "DOCTOR"))
                .andExpect(status().isForbidden());
        verifyNoInteractions(appointmentService, availabilityService);
    }

    @Test
    void shouldRejectUnknownStatus() throws Exception {
        mvc.perform(post("/api/appointments/status")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "7")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "DOCTOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotIds\": [1], \"newStatus\": \"postponed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldMapServiceConflict() throws Exception {
        when(rescheduleService.requestReschedule(eq(10L), eq(7L), any(), any(), any(), any()))
                .thenThrow(new ConflictException("Slot just taken. Pick another."));

        mvc.perform(post("/api/appointments/reschedule")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"doctorId": 7, "originalStart": "2026-01-05T09:00",
                                 "originalEnd": "2026-01-05T10:00", "newSlotStart": "2026-01-05T11:00"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("CONFLICT"))
                .andExpect(jsonPath("$.message").value("Slot just taken. Pick another."));
    }

    @Test
    void shouldLetOwningDoctorApproveReschedule() throws Exception {
        Appointment replacement = Appointment.builder()
                .id(55L)
                .doctor(Doctor.builder().id(7L).key("house").name("Dr. House").build())
                .patient(Patient.builder().id(10L).name("Alice").build())
                .scheduledFor(Instant.parse("2026-01-05T11:00:00Z"))
                .status(Appointment.Status.RESCHEDULE_REQUESTED)
                .rescheduledFromId(40L)
                .build();
        when(appointmentRepository.findById(55L)).thenReturn(Optional.of(replacement));
        when(rescheduleService.decide(55L, RescheduleService.Decision.APPROVE)).thenAnswer(invocation -> {
            replacement.setRescheduledFromId(null);
            replacement.setStatus(Appointment.Status.APPROVED);
            return replacement;
        });

        mvc.perform(post("/api/appointments/55/reschedule-decision")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "7")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "DOCTOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"approve\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.appointment.status").value("APPROVED"));

        mvc.perform(post("/api/appointments/55/reschedule-decision")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "8")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "DOCTOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"approve\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void shouldListOwnBlocksForDoctor() throws Exception {
        when(appointmentService.listBlocksForDoctor(7L, ZoneId.of("UTC"))).thenReturn(List.of());

        mvc.perform(get("/api/appointments/blocks")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "7")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "DOCTOR"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.blocks").isEmpty());
        verify(appointmentService).listBlocksForDoctor(7L, ZoneId.of("UTC"));
    }

    @Test
    void shouldRequireFilterForAdminListing() throws Exception {
        mvc.perform(get("/api/appointments/blocks")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "1")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "ADMIN"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldDescribeDoctorsToAnyCaller() throws Exception {
        when(appointmentService.getActiveDoctors())
                .thenReturn(List.of(Doctor.builder().id(7L).key("house").name("Dr. House").build()));

        mvc.perform(get("/api/doctors")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.doctors[0].key").value("house"));
    }

    @Test
    void principalShouldReachServiceUnchanged() throws Exception {
        when(appointmentService.cancelSlots(any(ActingPrincipal.class), anyList()))
                .thenReturn(new BulkUpdateResult(1, List.of()));

        mvc.perform(post("/api/appointments/cancel")
                        .header(ActingPrincipalResolver.USER_ID_HEADER, "10")
                        .header(ActingPrincipalResolver.USER_ROLE_HEADER, "PATIENT")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotIds\": [3]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.updated").value(1));
        verify(appointmentService).cancelSlots(new ActingPrincipal(10L, Role.PATIENT), List.of(3L));
    }
}
