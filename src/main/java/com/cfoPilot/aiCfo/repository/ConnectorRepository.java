package com.cfoPilot.aiCfo.repository;

public interface ConnectorRepository {

    /**
     * Connectors in status connected or syncing.
     */
    long countLive(String orgId);
}
