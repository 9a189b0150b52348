package com.medconsult.dto;

import java.util.List;

public record SetStatusRequest(List<Long> slotIds, String newStatus) {
}
