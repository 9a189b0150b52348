package com.medconsult.dto;

public record CheckoutRequest(Long patientId, Integer amountCents, String currency, String providerSessionId, String description) {
}
