package com.pingpay.scheduler.api.dto;

/** Plain acknowledgement body: {"message": "..."}. */
public record MessageResponse(String message) {
}
