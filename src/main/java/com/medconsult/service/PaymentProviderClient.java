package com.medconsult.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medconsult.exception.ExternalServiceException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Reads the status of a checkout session from the payment provider. Only the
 * status string is consumed; the checkout itself happens outside this service.
 */
@Service
public class PaymentProviderClient {

    private static final Logger log = LoggerFactory.getLogger(PaymentProviderClient.class);

    private static final String SESSION_PATH = "/v1/checkout/sessions/";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${medconsult.payment.base-url:https://api.stripe.com}")
    private String baseUrl;

    @Value("${medconsult.payment.api-key:}")
    private String apiKey;

    public PaymentProviderClient(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    /**
     * Returns the provider's {@code payment_status} of the session, e.g. "paid" or "unpaid".
     *
     * @throws ExternalServiceException when the provider is unreachable, answers
     *                                  with an error or with an unreadable body
     */
    public String fetchSessionStatus(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new ExternalServiceException("Payment has no provider session.");
        }
        String url = baseUrl.trim().replaceAll("/$", "") + SESSION_PATH + sessionId;

        HttpHeaders headers = new HttpHeaders();
        if (StringUtils.isNotBlank(apiKey)) headers.setBearerAuth(apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (RestClientException e) {
            log.warn("Payment provider call failed for session {}: {}", sessionId, e.getMessage());
            throw new ExternalServiceException("Payment provider unavailable.", e);
        }

        try {
            JsonNode root = mapper.readTree(response.getBody());
            String status = root.path("payment_status").asText(null);
            if (StringUtils.isBlank(status)) {
                throw new ExternalServiceException("Payment provider returned no payment_status.");
            }
            log.info("Payment session {} status={}", sessionId, status);
            return status;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable payment provider response for session {}", sessionId);
            throw new ExternalServiceException("Unreadable payment provider response.", e);
        }
    }
}
