package com.cfoPilot.aiCfo.repository;

import com.cfoPilot.aiCfo.repository.model.PromptRecord;

import java.util.Optional;

public interface PromptRepository {

    PromptRecord save(PromptRecord prompt);

    Optional<PromptRecord> findById(String promptId);
}
