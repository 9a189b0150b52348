package com.medconsult.service;

import com.medconsult.entity.Patient;
import com.medconsult.entity.Payment;
import com.medconsult.exception.ConflictException;
import com.medconsult.exception.ExternalServiceException;
import com.medconsult.exception.NotFoundException;
import com.medconsult.exception.ValidationException;
import com.medconsult.repository.PatientRepository;
import com.medconsult.repository.PaymentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps payment records in step with the provider. Provider failures end up as
 * a FAILED payment, never as an error of the command.
 */
@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentRepository paymentRepository;
    private final PatientRepository patientRepository;
    private final PaymentProviderClient providerClient;

    public PaymentService(PaymentRepository paymentRepository,
                          PatientRepository patientRepository,
                          PaymentProviderClient providerClient) {
        this.paymentRepository = paymentRepository;
        this.patientRepository = patientRepository;
        this.providerClient = providerClient;
    }

    @Transactional
    public Payment recordCheckout(Long patientId, int amountCents, String currency,
                                  String providerSessionId, String description) {
        if (amountCents <= 0) {
            throw new ValidationException("Amount must be positive.");
        }
        if (StringUtils.isBlank(providerSessionId)) {
            throw new ValidationException("providerSessionId is required.");
        }
        Patient patient = patientRepository.findById(patientId)
                .orElseThrow(() -> new NotFoundException("Patient not found: " + patientId));

        Payment existing = paymentRepository.findByProviderSessionId(providerSessionId.trim()).orElse(null);
        if (existing != null) {
            if (!existing.getPatient().getId().equals(patientId)) {
                throw new ConflictException("Checkout session already recorded for another patient.");
            }
            log.info("Checkout session {} already recorded as payment {}", providerSessionId, existing.getId());
            return existing;
        }

        Payment payment = paymentRepository.save(Payment.builder()
                .patient(patient)
                .amountCents(amountCents)
                .currency(StringUtils.defaultIfBlank(currency, "usd").toLowerCase())
                .providerSessionId(providerSessionId.trim())
                .status(Payment.Status.PENDING)
                .description(StringUtils.defaultIfBlank(description, "Consultation fee"))
                .build());
        log.info("Recorded checkout: payment={} patient={} session={}", payment.getId(), patientId, providerSessionId);
        return payment;
    }

    @Transactional(readOnly = true)
    public Payment getPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + paymentId));
    }

    /**
     * Asks the provider for the session status: "paid" makes the payment PAID,
     * "expired" or "canceled" make it FAILED, anything else leaves it as is.
     */
    @Transactional
    public Payment refreshStatus(Long paymentId) {
        Payment payment = getPayment(paymentId);
        if (payment.getStatus() == Payment.Status.PAID || payment.getStatus() == Payment.Status.FAILED) {
            return payment;
        }

        String providerStatus;
        try {
            providerStatus = providerClient.fetchSessionStatus(payment.getProviderSessionId());
        } catch (ExternalServiceException e) {
            log.warn("Payment {} marked FAILED: {}", paymentId, e.getMessage());
            payment.setStatus(Payment.Status.FAILED);
            return paymentRepository.save(payment);
        }

        switch (providerStatus.toLowerCase()) {
            case "paid" -> payment.setStatus(Payment.Status.PAID);
            case "expired", "canceled", "cancelled" -> payment.setStatus(Payment.Status.FAILED);
            default -> log.info("Payment {} still {} (provider status {})", paymentId, payment.getStatus(), providerStatus);
        }
        return paymentRepository.save(payment);
    }
}
