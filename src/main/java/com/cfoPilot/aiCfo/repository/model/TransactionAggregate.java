package com.cfoPilot.aiCfo.repository.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class TransactionAggregate {
    long count;
    double totalInflow;
    double totalOutflow;
    LocalDate latestDate;
    String latestDescription;
    LocalDate since;

    public static TransactionAggregate empty(LocalDate since) {
        return TransactionAggregate.builder().since(since).build();
    }
}
