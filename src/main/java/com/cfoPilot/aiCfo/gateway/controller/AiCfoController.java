package com.cfoPilot.aiCfo.gateway.controller;

import com.cfoPilot.aiCfo.gateway.dto.AgenticQueryRequest;
import com.cfoPilot.aiCfo.gateway.dto.AgenticQueryResponse;
import com.cfoPilot.aiCfo.gateway.dto.ApplyPlanRequest;
import com.cfoPilot.aiCfo.gateway.dto.ApplyPlanResponse;
import com.cfoPilot.aiCfo.gateway.dto.GeneratePlanRequest;
import com.cfoPilot.aiCfo.gateway.exception.NotFoundException;
import com.cfoPilot.aiCfo.gateway.service.AiCfoService;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.PromptRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * AI-CFO REST controller - thin HTTP layer over {@link AiCfoService}.
 * The acting user comes from the X-User-ID header.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AiCfoController {

    private static final String USER_ID_HEADER = "X-User-ID";

    private final AiCfoService aiCfoService;

    @PostMapping("/orgs/{orgId}/ai-cfo/plans")
    public ResponseEntity<AiCfoPlan> generatePlan(
            @PathVariable String orgId,
            @Valid @RequestBody GeneratePlanRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(aiCfoService.generatePlan(orgId, userIdHeader, request));
    }

    @PostMapping("/orgs/{orgId}/ai-cfo/query")
    public ResponseEntity<AgenticQueryResponse> query(
            @PathVariable String orgId,
            @Valid @RequestBody AgenticQueryRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {
        return ResponseEntity.ok(aiCfoService.processAgenticQuery(orgId, userIdHeader, request));
    }

    @GetMapping("/orgs/{orgId}/ai-cfo/plans")
    public ResponseEntity<List<AiCfoPlan>> listPlans(
            @PathVariable String orgId,
            @RequestParam(required = false) String status,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {
        return ResponseEntity.ok(aiCfoService.listPlans(orgId, userIdHeader, status));
    }

    @GetMapping("/ai-cfo/plans/{planId}")
    public ResponseEntity<AiCfoPlan> getPlan(
            @PathVariable String planId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {
        return ResponseEntity.ok(aiCfoService.getPlan(planId, userIdHeader));
    }

    @PostMapping("/ai-cfo/plans/{planId}/apply")
    public ResponseEntity<ApplyPlanResponse> applyPlan(
            @PathVariable String planId,
            @RequestBody(required = false) ApplyPlanRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {
        return ResponseEntity.ok(aiCfoService.applyPlan(planId, userIdHeader, request));
    }

    @GetMapping("/ai-cfo/prompts/{promptId}")
    public ResponseEntity<PromptRecord> getPrompt(
            @PathVariable String promptId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {
        return ResponseEntity.ok(aiCfoService.getPrompt(promptId, userIdHeader)
                .orElseThrow(() -> new NotFoundException("Prompt not found: " + promptId)));
    }
}
