package com.medconsult.dto;

import com.medconsult.entity.Payment;

public record PaymentView(Long id, Long patientId, int amountCents, String currency,
                          String providerSessionId, Payment.Status status) {

    public static PaymentView of(Payment p) {
        return new PaymentView(p.getId(), p.getPatient().getId(), p.getAmountCents(), p.getCurrency(),
                p.getProviderSessionId(), p.getStatus());
    }
}
