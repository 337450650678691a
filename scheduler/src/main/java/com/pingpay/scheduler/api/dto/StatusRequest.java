package com.pingpay.scheduler.api.dto;

/**
 * Request body for PATCH /jobs/{id}/status. Kept as a raw string so an
 * unknown value is reported as a validation error on "status".
 */
public record StatusRequest(String status) {
}
