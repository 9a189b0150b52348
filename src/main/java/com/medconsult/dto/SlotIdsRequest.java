package com.medconsult.dto;

import java.util.List;

public record SlotIdsRequest(List<Long> slotIds) {
}
