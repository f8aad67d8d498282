package com.example.eventrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookTestResult(boolean success, String message, Integer statusCode, long responseTime) {
}
