package com.medconsult.repository;

import com.medconsult.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    boolean existsByDoctorIdAndScheduledForAndStatusIn(Long doctorId, Instant scheduledFor,
                                                       Collection<Appointment.Status> statuses);

    @Query("SELECT a.scheduledFor FROM Appointment a "
            + "WHERE a.doctor.id = :doctorId AND a.scheduledFor >= :from AND a.scheduledFor < :to "
            + "AND a.status IN :statuses")
    List<Instant> findBookedTimes(@Param("doctorId") Long doctorId,
                                  @Param("from") Instant from,
                                  @Param("to") Instant to,
                                  @Param("statuses") Collection<Appointment.Status> statuses);

    List<Appointment> findByPatientIdAndDoctorIdAndScheduledForGreaterThanEqualAndScheduledForLessThanOrderByScheduledForAsc(
            Long patientId, Long doctorId, Instant from, Instant to);

    List<Appointment> findByPatientId(Long patientId);

    List<Appointment> findByDoctorId(Long doctorId);

    boolean existsByRescheduledFromIdAndStatus(Long rescheduledFromId, Appointment.Status status);

    List<Appointment> findByIdInOrderByScheduledForAsc(Collection<Long> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    /** Clears the reschedule link of every appointment pointing at a deleted original. */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Appointment a SET a.rescheduledFromId = NULL WHERE a.rescheduledFromId = :id")
    int detachSuccessors(@Param("id") Long id);
}
