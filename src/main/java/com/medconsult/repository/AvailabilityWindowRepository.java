package com.medconsult.repository;

import com.medconsult.entity.AvailabilityWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AvailabilityWindowRepository extends JpaRepository<AvailabilityWindow, Long> {

    List<AvailabilityWindow> findByDoctorIdAndDateOrderByStartTimeAsc(Long doctorId, LocalDate date);

    List<AvailabilityWindow> findByDoctorIdOrderByDateAscStartTimeAsc(Long doctorId);
}
