package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Imported ledger line. Positive amounts are inflows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Transaction {
    private String id;
    private String orgId;
    private LocalDate date;
    private Double amount;
    private String category;
    private String description;
    private boolean duplicate;
}
