package com.medconsult.service;

import com.medconsult.dto.AppointmentBlock;
import com.medconsult.entity.Appointment;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Collapses contiguous 30-minute appointments into blocks for display.
 */
@Component
public class BlockGrouper {

    /** Whose list is being built; the other party is the primary sort key. */
    public enum Perspective {
        PATIENT(Comparator.comparing((Appointment a) -> a.getDoctor().getId())),
        DOCTOR(Comparator.comparing((Appointment a) -> a.getPatient().getId()));

        private final Comparator<Appointment> counterpart;

        Perspective(Comparator<Appointment> counterpart) {
            this.counterpart = counterpart;
        }

        public Comparator<Appointment> order() {
            return counterpart.thenComparing(Appointment::getScheduledFor);
        }
    }

    /** Sorts {@code appointments} in the order of {@code perspective}, then groups them. */
    public List<AppointmentBlock> group(Collection<Appointment> appointments, Perspective perspective, ZoneId zone) {
        List<Appointment> sorted = new ArrayList<>(appointments);
        sorted.sort(perspective.order());
        return group(sorted, zone);
    }

    /** Groups appointments already sorted with {@link Perspective#order()}. */
    public List<AppointmentBlock> group(List<Appointment> sorted, ZoneId zone) {
        List<AppointmentBlock> blocks = new ArrayList<>();
        AppointmentBlock current = null;

        for (Appointment appt : sorted) {
            if (current != null && continues(current, appt, zone)) {
                current.append(appt, zone);
                continue;
            }
            if (current != null) blocks.add(current);
            current = AppointmentBlock.open(appt, zone);
        }
        if (current != null) blocks.add(current);
        return blocks;
    }

    public List<Appointment> ungroup(AppointmentBlock block) {
        return new ArrayList<>(block.getAppointments());
    }

    private static boolean continues(AppointmentBlock block, Appointment appt, ZoneId zone) {
        var slotStart = appt.getScheduledFor().atZone(zone);
        return Objects.equals(appt.getDoctor().getId(), block.getDoctorId())
                && Objects.equals(appt.getPatient().getId(), block.getPatientId())
                && slotStart.toLocalDate().equals(block.getDate())
                && appt.getStatus() == block.getStatus()
                && Objects.equals(appt.getReason(), block.getReason())
                && Objects.equals(appt.getPaymentId(), block.getPaymentId())
                && Objects.equals(appt.getRescheduledFromId(), block.getRescheduledFromId())
                && slotStart.toInstant().equals(block.getLastSlotStart().toInstant().plus(SlotGenerator.SLOT_DURATION));
    }
}
