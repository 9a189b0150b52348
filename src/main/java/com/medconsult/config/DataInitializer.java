package com.medconsult.config;

import com.medconsult.entity.AvailabilityWindow;
import com.medconsult.entity.Doctor;
import com.medconsult.entity.Patient;
import com.medconsult.repository.AvailabilityWindowRepository;
import com.medconsult.repository.DoctorRepository;
import com.medconsult.repository.PatientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent seeder for local runs: doctors, a couple of patients and
 * availability for the next 7 days. Safe to re-run.
 */
@Component
@ConditionalOnProperty(name = "medconsult.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);
    private static final int SEED_DAYS = 7;

    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final ZoneResolver zoneResolver;
    private final Clock clock;

    public DataInitializer(DoctorRepository doctorRepository,
                           PatientRepository patientRepository,
                           AvailabilityWindowRepository windowRepository,
                           ZoneResolver zoneResolver,
                           Clock clock) {
        this.doctorRepository = doctorRepository;
        this.patientRepository = patientRepository;
        this.windowRepository = windowRepository;
        this.zoneResolver = zoneResolver;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        List<Doctor> doctors = new ArrayList<>();
        doctors.add(doctor("johnson", "Dr. Sarah Johnson", "General Practice"));
        doctors.add(doctor("chen", "Dr. Michael Chen", "Cardiology"));
        doctors.add(doctor("davis", "Dr. Emily Davis", "Pediatrics"));

        patient("Alice Walker", "+15550100", "alice@example.com");
        patient("Bob Martin", "+15550101", "bob@example.com");

        LocalDate today = LocalDate.now(clock.withZone(zoneResolver.getDefaultZone()));
        int added = 0;
        for (Doctor d : doctors) {
            for (int i = 0; i < SEED_DAYS; i++) {
                LocalDate date = today.plusDays(i);
                if (date.getDayOfWeek() == DayOfWeek.SUNDAY) continue;
                if (!windowRepository.findByDoctorIdAndDateOrderByStartTimeAsc(d.getId(), date).isEmpty()) continue;
                windowRepository.save(AvailabilityWindow.builder()
                        .doctor(d).date(date).startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(13, 0)).build());
                added++;
            }
        }
        log.info("DataInitializer: doctors={}, windows added={}", doctors.size(), added);
    }

    private Doctor doctor(String key, String name, String specialization) {
        return doctorRepository.findByKeyIgnoreCase(key).orElseGet(() -> {
            log.info("Seeding doctor {}", name);
            return doctorRepository.save(Doctor.builder().key(key).name(name).specialization(specialization).build());
        });
    }

    private void patient(String name, String phone, String email) {
        if (patientRepository.findByEmailIgnoreCase(email).isPresent()) return;
        patientRepository.save(Patient.builder().name(name).phone(phone).email(email).build());
        log.info("Seeding patient {}", name);
    }
}
