package com.medconsult.auth;

import com.medconsult.entity.Appointment;
import com.medconsult.exception.ForbiddenException;

import java.util.Arrays;

/**
 * The caller of a command, {@code id} being a patient id or a doctor id depending on the role.
 */
public record ActingPrincipal(Long id, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean mayAccess(Appointment appointment) {
        return role.mayAccess(id, appointment.getPatient().getId(), appointment.getDoctor().getId());
    }

    /** Fails unless the principal holds one of {@code allowed}; admins always pass. */
    public void requireRole(Role... allowed) {
        if (isAdmin()) return;
        if (Arrays.asList(allowed).contains(role)) return;
        throw new ForbiddenException("Role " + role + " may not perform this action.");
    }

    /** Fails unless a doctor acts on their own schedule; admins always pass. */
    public void requireDoctor(Long doctorId) {
        requireRole(Role.DOCTOR);
        if (!isAdmin() && !id.equals(doctorId)) {
            throw new ForbiddenException("Doctors may only manage their own schedule.");
        }
    }
}
