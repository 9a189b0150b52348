package com.medconsult.dto;

import com.medconsult.entity.Doctor;

public record DoctorView(Long id, String key, String name, String specialization) {

    public static DoctorView of(Doctor d) {
        return new DoctorView(d.getId(), d.getKey(), d.getName(), d.getSpecialization());
    }
}
