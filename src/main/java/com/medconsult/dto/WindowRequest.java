package com.medconsult.dto;

/** Date as {@code yyyy-MM-dd}, times as {@code HH:mm}. */
public record WindowRequest(String date, String startTime, String endTime) {
}
