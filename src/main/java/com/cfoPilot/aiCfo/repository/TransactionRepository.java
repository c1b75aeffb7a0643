package com.cfoPilot.aiCfo.repository;

import com.cfoPilot.aiCfo.repository.model.TransactionAggregate;

import java.time.LocalDate;

public interface TransactionRepository {

    /**
     * Non-duplicate transactions for the org.
     */
    long count(String orgId);

    TransactionAggregate aggregateSince(String orgId, LocalDate since);
}
