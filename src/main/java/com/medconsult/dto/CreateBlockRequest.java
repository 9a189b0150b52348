package com.medconsult.dto;

import java.util.List;

/**
 * Booking request: slot starts are local date-times ({@code yyyy-MM-dd'T'HH:mm})
 * in the caller's timezone. {@code patientId} is only honoured for admins.
 */
public record CreateBlockRequest(Long doctorId, Long patientId, String date, List<String> slotStarts, String reason) {
}
