package com.medconsult.dto;

public record DecisionRequest(String decision) {
}
