package com.cfoPilot.aiCfo.repository.memory;

import com.cfoPilot.aiCfo.repository.PromptRepository;
import com.cfoPilot.aiCfo.repository.model.PromptRecord;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryPromptRepository implements PromptRepository {

    private final Clock clock;
    private final Map<String, PromptRecord> prompts = new ConcurrentHashMap<>();

    public InMemoryPromptRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public PromptRecord save(PromptRecord prompt) {
        if (prompt.getId() == null) {
            prompt.setId(UUID.randomUUID().toString());
        }
        if (prompt.getCreatedAt() == null) {
            prompt.setCreatedAt(clock.instant());
        }
        prompts.put(prompt.getId(), prompt);
        return prompt;
    }

    @Override
    public Optional<PromptRecord> findById(String promptId) {
        return Optional.ofNullable(prompts.get(promptId));
    }
}
