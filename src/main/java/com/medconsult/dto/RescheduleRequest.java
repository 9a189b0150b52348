package com.medconsult.dto;

/**
 * Moves the block [originalStart, originalEnd) with a doctor to a new slot.
 * All times are local date-times in the caller's timezone. {@code patientId} is only honoured for admins.
 */
public record RescheduleRequest(Long doctorId, Long patientId, String originalStart, String originalEnd, String newSlotStart) {
}
