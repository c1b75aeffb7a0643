package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.prompt.MetaQueryReplies;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes UI suggestion chips that are not financial questions and answers them from a fixed table.
 */
@Component
public class MetaQueryRouter {

    public enum MetaQuery {
        CONNECT_ACCOUNTING,
        ASK_ANOTHER_QUESTION
    }

    /**
     * Fixed answer for a meta-query.
     *
     * @param intentLabel Label stored as the plan intent
     */
    public record MetaAnswer(MetaQuery query, String name, String description, String intentLabel, String text) {}

    public Optional<MetaQuery> detect(String query) {
        if (query == null) {
            return Optional.empty();
        }
        String lower = query.trim().toLowerCase(Locale.ROOT);
        if (lower.contains("connect accounting") || (lower.contains("connect") && lower.contains("accounting"))) {
            return Optional.of(MetaQuery.CONNECT_ACCOUNTING);
        }
        if (lower.equals("another financial question")
                || (lower.contains("ask another") && lower.contains("question"))
                || (lower.contains("another") && lower.contains("financial") && lower.contains("question"))) {
            return Optional.of(MetaQuery.ASK_ANOTHER_QUESTION);
        }
        return Optional.empty();
    }

    /**
     * @param liveConnectors Connectors in status connected or syncing
     */
    public MetaAnswer answer(MetaQuery query, long liveConnectors) {
        return switch (query) {
            case CONNECT_ACCOUNTING -> liveConnectors > 0
                    ? new MetaAnswer(query, "AI-CFO: Accounting System Status",
                            "User inquired about accounting system connection", "system_status",
                            MetaQueryReplies.connectorsLive(liveConnectors))
                    : new MetaAnswer(query, "AI-CFO: Connect Accounting System",
                            "User wants to connect accounting system", "system_guidance",
                            MetaQueryReplies.CONNECT_GUIDANCE);
            case ASK_ANOTHER_QUESTION -> new MetaAnswer(query, "AI-CFO: Ready for Your Question",
                    "User wants to ask another question", "conversation_prompt",
                    MetaQueryReplies.SAMPLE_QUESTIONS);
        };
    }
}
