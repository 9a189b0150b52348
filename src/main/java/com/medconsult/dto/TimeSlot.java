package com.medconsult.dto;

import java.time.ZonedDateTime;

/** A bookable 30-minute unit cut from an availability window. */
public record TimeSlot(ZonedDateTime start, ZonedDateTime end) {
}
