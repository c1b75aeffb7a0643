package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Connector {
    private String id;
    private String orgId;
    private String type; // quickbooks, xero, ...
    private String status; // connected, syncing, disconnected

    public boolean isLive() {
        return "connected".equalsIgnoreCase(status) || "syncing".equalsIgnoreCase(status);
    }
}
