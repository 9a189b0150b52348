package com.medconsult.controller;

import com.medconsult.auth.ActingPrincipal;
import com.medconsult.auth.Role;
import com.medconsult.dto.CheckoutRequest;
import com.medconsult.dto.CommandResult;
import com.medconsult.dto.PaymentView;
import com.medconsult.entity.Payment;
import com.medconsult.exception.ForbiddenException;
import com.medconsult.exception.ValidationException;
import com.medconsult.service.PaymentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @PostMapping
    public ResponseEntity<CommandResult> recordCheckout(ActingPrincipal principal, @RequestBody CheckoutRequest request) {
        principal.requireRole(Role.PATIENT);
        Long patientId = principal.isAdmin() ? request.patientId() : principal.id();
        if (patientId == null) throw new ValidationException("patientId is required.");
        if (request.amountCents() == null) throw new ValidationException("amountCents is required.");

        Payment payment = paymentService.recordCheckout(patientId, request.amountCents(), request.currency(),
                request.providerSessionId(), request.description());
        return ApiExceptionHandler.respond(CommandResult.of(CommandResult.Type.CREATED,
                "Checkout recorded.", Map.of("payment", PaymentView.of(payment))));
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<CommandResult> get(ActingPrincipal principal, @PathVariable Long paymentId) {
        Payment payment = owned(principal, paymentId);
        return ResponseEntity.ok(CommandResult.data("payment", PaymentView.of(payment)));
    }

    @PostMapping("/{paymentId}/refresh")
    public ResponseEntity<CommandResult> refresh(ActingPrincipal principal, @PathVariable Long paymentId) {
        owned(principal, paymentId);
        Payment payment = paymentService.refreshStatus(paymentId);
        return ResponseEntity.ok(CommandResult.ok("Payment is " + payment.getStatus().name().toLowerCase() + ".",
                Map.of("payment", PaymentView.of(payment))));
    }

    private Payment owned(ActingPrincipal principal, Long paymentId) {
        principal.requireRole(Role.PATIENT);
        Payment payment = paymentService.getPayment(paymentId);
        if (!principal.isAdmin() && !payment.getPatient().getId().equals(principal.id())) {
            throw new ForbiddenException("Payment " + paymentId + " belongs to another patient.");
        }
        return payment;
    }
}
