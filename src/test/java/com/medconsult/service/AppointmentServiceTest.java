package com.medconsult.service;

import com.medconsult.FixedClockConfig;
import com.medconsult.SchedulingFixtures;
import com.medconsult.auth.ActingPrincipal;
import com.medconsult.auth.Role;
import com.medconsult.dto.AppointmentBlock;
import com.medconsult.dto.BookingResult;
import com.medconsult.dto.BulkUpdateResult;
import com.medconsult.entity.Appointment;
import com.medconsult.entity.Doctor;
import com.medconsult.entity.Patient;
import com.medconsult.entity.Payment;
import com.medconsult.exception.ForbiddenException;
import com.medconsult.exception.NotFoundException;
import com.medconsult.exception.StateException;
import com.medconsult.exception.ValidationException;
import com.medconsult.repository.AppointmentRepository;
import com.medconsult.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(FixedClockConfig.class)
class AppointmentServiceTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final LocalDate DATE = LocalDate.of(2026, 1, 5);

    @Autowired
    private AppointmentService appointmentService;

    @Autowired
    private SlotService slotService;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private SchedulingFixtures fixtures;

    private Doctor doctor;
    private Patient alice;
    private Patient bob;

    @BeforeEach
    void setUp() {
        fixtures.clear();
        doctor = fixtures.doctor("house");
        alice = fixtures.patient("Alice");
        bob = fixtures.patient("Bob");
        fixtures.window(doctor, DATE, "09:00", "11:00");
    }

    private static LocalDateTime at(String time) {
        return LocalDateTime.parse("2026-01-05T" + time);
    }

    private BookingResult book(Patient patient, String... times) {
        List<LocalDateTime> starts = Arrays.stream(times).map(AppointmentServiceTest::at).toList();
        return appointmentService.createBlock(patient.getId(), doctor.getId(), DATE, starts, "Checkup", UTC);
    }

    @Test
    void shouldBookContiguousSlotsAsOneBlock() {
        BookingResult result = book(alice, "09:00", "09:30", "10:00");

        assertThat(result.created()).isEqualTo(3);
        assertThat(result.rejectedStarts()).isEmpty();

        List<AppointmentBlock> blocks = appointmentService.listBlocksForPatient(alice.getId(), UTC);
        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0).getSlotIds()).containsExactlyElementsOf(result.appointmentIds());
        assertThat(blocks.get(0).getStatus()).isEqualTo(Appointment.Status.REQUESTED);
        assertThat(slotService.listSlots(doctor.getId(), DATE, UTC)).hasSize(1);
    }

    @Test
    void shouldNeverDoubleBookASlot() {
        book(alice, "09:00");

        BookingResult result = book(bob, "09:00", "10:30");

        assertThat(result.isPartial()).isTrue();
        assertThat(result.created()).isEqualTo(1);
        assertThat(result.rejectedStarts()).containsExactly(at("09:00"));
        assertThat(appointmentRepository.findAll()).hasSize(2);
    }

    @Test
    void shouldRejectEverythingWhenNoRequestedSlotIsOpen() {
        book(alice, "09:00", "09:30");

        BookingResult result = book(bob, "09:00", "09:30", "12:00");

        assertThat(result.isTotalFailure()).isTrue();
        assertThat(result.rejectedStarts()).hasSize(3);
    }

    @Test
    void shouldCollapseDuplicateStartsAndRejectOtherDates() {
        List<LocalDateTime> starts = List.of(at("09:00"), at("09:00"), LocalDateTime.parse("2026-01-06T09:00"));

        BookingResult result = appointmentService.createBlock(alice.getId(), doctor.getId(), DATE, starts, null, UTC);

        assertThat(result.requested()).isEqualTo(2);
        assertThat(result.created()).isEqualTo(1);
        assertThat(result.rejectedStarts()).containsExactly(LocalDateTime.parse("2026-01-06T09:00"));
    }

    @Test
    void shouldFailForUnknownDoctorOrEmptySelection() {
        assertThatThrownBy(() -> appointmentService.createBlock(alice.getId(), -1L, DATE, List.of(at("09:00")), null, UTC))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> appointmentService.createBlock(alice.getId(), doctor.getId(), DATE, List.of(), null, UTC))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldFreeSlotOnCancel() {
        BookingResult booked = book(alice, "09:00");

        BulkUpdateResult cancelled = appointmentService.cancelSlots(
                new ActingPrincipal(alice.getId(), Role.PATIENT), booked.appointmentIds());

        assertThat(cancelled.updated()).isEqualTo(1);
        assertThat(slotService.isOccupied(doctor.getId(), at("09:00").atZone(UTC).toInstant())).isFalse();
        assertThat(book(bob, "09:00").created()).isEqualTo(1);
    }

    @Test
    void shouldApplyDoctorDecisionToAccessibleSlotsOnly() {
        BookingResult booked = book(alice, "09:00", "09:30");
        Doctor other = fixtures.doctor("wilson");
        fixtures.window(other, DATE, "09:00", "10:00");
        Long foreign = appointmentService.createBlock(bob.getId(), other.getId(), DATE, List.of(at("09:00")), null, UTC)
                .appointmentIds().get(0);

        List<Long> selection = new ArrayList<>(booked.appointmentIds());
        selection.add(foreign);
        BulkUpdateResult result = appointmentService.setStatus(
                new ActingPrincipal(doctor.getId(), Role.DOCTOR), selection, Appointment.Status.APPROVED);

        assertThat(result.updated()).isEqualTo(2);
        assertThat(result.rejectedIds()).containsExactly(foreign);
        assertThat(appointmentRepository.findAllById(booked.appointmentIds()))
                .extracting(Appointment::getStatus)
                .containsOnly(Appointment.Status.APPROVED);
        assertThat(appointmentRepository.findById(foreign).orElseThrow().getStatus())
                .isEqualTo(Appointment.Status.REQUESTED);
    }

    @Test
    void shouldFailWhenNothingSelectedIsAccessible() {
        BookingResult booked = book(alice, "09:00");

        assertThatThrownBy(() -> appointmentService.setStatus(
                new ActingPrincipal(bob.getId(), Role.PATIENT), booked.appointmentIds(), Appointment.Status.CANCELLED))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldKeepRejectedSlotsFree() {
        BookingResult booked = book(alice, "09:00");

        appointmentService.setStatus(new ActingPrincipal(doctor.getId(), Role.DOCTOR),
                booked.appointmentIds(), Appointment.Status.REJECTED);

        assertThat(slotService.openSlotStarts(doctor.getId(), DATE, UTC))
                .contains(at("09:00").atZone(UTC).toInstant());
    }

    @Test
    void shouldAttachOwnPaymentOnly() {
        BookingResult booked = book(alice, "09:00", "09:30");
        Payment payment = paymentRepository.save(Payment.builder()
                .patient(alice).amountCents(5000).providerSessionId("cs_test_1").status(Payment.Status.PENDING).build());
        Payment bobsPayment = paymentRepository.save(Payment.builder()
                .patient(bob).amountCents(5000).providerSessionId("cs_test_2").status(Payment.Status.PENDING).build());

        BulkUpdateResult result = appointmentService.attachPayment(
                new ActingPrincipal(alice.getId(), Role.PATIENT), booked.appointmentIds(), payment.getId());

        assertThat(result.updated()).isEqualTo(2);
        List<AppointmentBlock> blocks = appointmentService.listBlocksForPatient(alice.getId(), UTC);
        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0).getPaymentId()).isEqualTo(payment.getId());
        assertThat(blocks.get(0).isPaid()).isFalse();

        assertThatThrownBy(() -> appointmentService.attachPayment(
                new ActingPrincipal(alice.getId(), Role.PATIENT), booked.appointmentIds(), bobsPayment.getId()))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> appointmentService.attachPayment(
                new ActingPrincipal(1L, Role.ADMIN), booked.appointmentIds(), bobsPayment.getId()))
                .isInstanceOf(StateException.class);
    }

    @Test
    void shouldListDoctorBlocksPerPatient() {
        book(alice, "09:00", "09:30");
        book(bob, "10:00");

        List<AppointmentBlock> blocks = appointmentService.listBlocksForDoctor(doctor.getId(), UTC);

        assertThat(blocks).hasSize(2);
        assertThat(blocks).extracting(AppointmentBlock::getPatientName).containsExactlyInAnyOrder("Alice", "Bob");
    }
}
