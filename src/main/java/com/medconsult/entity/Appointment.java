package com.medconsult.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * One booked 30-minute slot. A consultation longer than one slot is stored as
 * several records and shown as a block.
 */
@Entity
@Table(name = "appointment", uniqueConstraints = {
    @UniqueConstraint(name = "uk_appointment_doctor_active_slot", columnNames = {"doctor_id", "active_slot"})
}, indexes = {
    @Index(name = "idx_appointment_doctor_time", columnList = "doctor_id, scheduled_for"),
    @Index(name = "idx_appointment_patient", columnList = "patient_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status {
        REQUESTED, APPROVED, REJECTED, COMPLETED, CANCELLED, RESCHEDULE_REQUESTED, RESCHEDULED;

        /** Statuses that occupy the slot for conflict checks. */
        public static final Set<Status> ACTIVE =
                EnumSet.of(REQUESTED, APPROVED, RESCHEDULE_REQUESTED, RESCHEDULED, COMPLETED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", nullable = false)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    @Column(name = "scheduled_for", nullable = false)
    private Instant scheduledFor;

    /**
     * Mirrors scheduledFor while the status is active, null otherwise.
     * The unique key on (doctor_id, active_slot) rejects a second active booking.
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "active_slot")
    private Instant activeSlot;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private Status status = Status.REQUESTED;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_id")
    private Payment payment;

    /** Id of the appointment this one replaces, set while a reschedule is pending. */
    @Column(name = "rescheduled_from_id")
    private Long rescheduledFromId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void setStatus(Status status) {
        this.status = status;
        syncActiveSlot();
    }

    public void setScheduledFor(Instant scheduledFor) {
        this.scheduledFor = scheduledFor;
        syncActiveSlot();
    }

    public boolean isPaid() {
        return payment != null && payment.getStatus() == Payment.Status.PAID;
    }

    public Long getPaymentId() {
        return payment != null ? payment.getId() : null;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
        syncActiveSlot();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        syncActiveSlot();
    }

    private void syncActiveSlot() {
        activeSlot = status != null && status.isActive() ? scheduledFor : null;
    }
}
