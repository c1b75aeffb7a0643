package com.cfoPilot.aiCfo.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating request IDs for log correlation and audit.
 */
@Service
public class RequestIdService {

    public String generateRequestId() {
        return UUID.randomUUID().toString();
    }
}
