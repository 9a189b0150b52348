package com.medconsult.auth;

import com.medconsult.entity.Appointment;
import com.medconsult.entity.Doctor;
import com.medconsult.entity.Patient;
import com.medconsult.exception.ForbiddenException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActingPrincipalTest {

    private final Appointment appointment = Appointment.builder()
            .id(5L)
            .doctor(Doctor.builder().id(1L).key("house").name("Dr. House").build())
            .patient(Patient.builder().id(10L).name("Alice").build())
            .build();

    @Test
    void shouldGrantAccessToOwnPatientAndDoctorOnly() {
        assertThat(new ActingPrincipal(10L, Role.PATIENT).mayAccess(appointment)).isTrue();
        assertThat(new ActingPrincipal(11L, Role.PATIENT).mayAccess(appointment)).isFalse();
        assertThat(new ActingPrincipal(1L, Role.DOCTOR).mayAccess(appointment)).isTrue();
        assertThat(new ActingPrincipal(10L, Role.DOCTOR).mayAccess(appointment)).isFalse();
        assertThat(new ActingPrincipal(999L, Role.ADMIN).mayAccess(appointment)).isTrue();
    }

    @Test
    void shouldRejectWrongRole() {
        ActingPrincipal patient = new ActingPrincipal(10L, Role.PATIENT);

        assertThatThrownBy(() -> patient.requireRole(Role.DOCTOR)).isInstanceOf(ForbiddenException.class);
        assertThatCode(() -> patient.requireRole(Role.PATIENT)).doesNotThrowAnyException();
        assertThatCode(() -> new ActingPrincipal(1L, Role.ADMIN).requireRole(Role.DOCTOR)).doesNotThrowAnyException();
    }

    @Test
    void shouldLimitDoctorsToOwnSchedule() {
        ActingPrincipal doctor = new ActingPrincipal(1L, Role.DOCTOR);

        assertThatCode(() -> doctor.requireDoctor(1L)).doesNotThrowAnyException();
        assertThatThrownBy(() -> doctor.requireDoctor(2L)).isInstanceOf(ForbiddenException.class);
        assertThatCode(() -> new ActingPrincipal(7L, Role.ADMIN).requireDoctor(2L)).doesNotThrowAnyException();
    }

    @Test
    void shouldParseRoleIgnoringCase() {
        assertThat(Role.parse(" doctor ")).contains(Role.DOCTOR);
        assertThat(Role.parse("nurse")).isEmpty();
        assertThat(Role.parse(null)).isEmpty();
    }
}
