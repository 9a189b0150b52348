package com.medconsult.dto;

import java.util.List;

public record AttachPaymentRequest(List<Long> slotIds, Long paymentId) {
}
