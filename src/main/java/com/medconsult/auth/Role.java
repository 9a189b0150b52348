package com.medconsult.auth;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Role of the acting principal as supplied by the identity provider. Each role
 * decides for itself whether a booking between a patient and a doctor is its business.
 */
public enum Role {

    PATIENT {
        @Override
        public boolean mayAccess(Long principalId, Long patientId, Long doctorId) {
            return principalId != null && principalId.equals(patientId);
        }
    },

    DOCTOR {
        @Override
        public boolean mayAccess(Long principalId, Long patientId, Long doctorId) {
            return principalId != null && principalId.equals(doctorId);
        }
    },

    ADMIN {
        @Override
        public boolean mayAccess(Long principalId, Long patientId, Long doctorId) {
            return true;
        }
    };

    public abstract boolean mayAccess(Long principalId, Long patientId, Long doctorId);

    public static Optional<Role> parse(String raw) {
        if (StringUtils.isBlank(raw)) return Optional.empty();
        for (Role role : values()) {
            if (role.name().equalsIgnoreCase(raw.trim())) return Optional.of(role);
        }
        return Optional.empty();
    }
}
