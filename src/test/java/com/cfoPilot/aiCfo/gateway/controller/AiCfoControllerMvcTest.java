package com.cfoPilot.aiCfo.gateway.controller;

import com.cfoPilot.aiCfo.gateway.exception.ForbiddenException;
import com.cfoPilot.aiCfo.gateway.exception.InvalidInputException;
import com.cfoPilot.aiCfo.gateway.exception.NotFoundException;
import com.cfoPilot.aiCfo.gateway.service.AiCfoService;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AiCfoControllerMvcTest {

    private static final String ORG_ID = "3f2a9c1e-8b4d-4f6a-a1c2-9e7d5b3a1c90";
    private static final String USER_ID = "1c2d3e4f-5a6b-4c7d-8e9f-0a1b2c3d4e52";
    private static final String PLAN_ID = "aaaaaaaa-bbbb-4ccc-8ddd-eeeeeeeeeeee";

    private AiCfoService aiCfoService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        aiCfoService = mock(AiCfoService.class);
        mvc = MockMvcBuilders.standaloneSetup(new AiCfoController(aiCfoService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void generatePlanReturnsCreated() throws Exception {
        when(aiCfoService.generatePlan(eq(ORG_ID), eq(USER_ID), any())).thenReturn(AiCfoPlan.builder()
                .id(PLAN_ID)
                .orgId(ORG_ID)
                .status(PlanStatus.DRAFT)
                .payload(PlanPayload.builder().goal("Extend runway").naturalText("Runway is 15.0 months.").build())
                .build());

        mvc.perform(post("/api/v1/orgs/{orgId}/ai-cfo/plans", ORG_ID)
                        .header("X-User-ID", USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\":\"Extend runway\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(PLAN_ID))
                .andExpect(jsonPath("$.status").value("draft"))
                .andExpect(jsonPath("$.payload.naturalText").value("Runway is 15.0 months."));
    }

    @Test
    void blankGoalIsAValidationError() throws Exception {
        mvc.perform(post("/api/v1/orgs/{orgId}/ai-cfo/plans", ORG_ID)
                        .header("X-User-ID", USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("goal: goal cannot be blank"));
        verify(aiCfoService, never()).generatePlan(any(), any(), any());
    }

    @Test
    void missingUserHeaderIsInvalidInput() throws Exception {
        when(aiCfoService.listPlans(eq(ORG_ID), isNull(), isNull()))
                .thenThrow(new InvalidInputException("userId is required"));

        mvc.perform(get("/api/v1/orgs/{orgId}/ai-cfo/plans", ORG_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value("userId is required"));
    }

    @Test
    void forbiddenMapsTo403() throws Exception {
        when(aiCfoService.applyPlan(eq(PLAN_ID), eq(USER_ID), isNull()))
                .thenThrow(new ForbiddenException("Only admins and finance users can apply AI-CFO plans"));

        mvc.perform(post("/api/v1/ai-cfo/plans/{planId}/apply", PLAN_ID).header("X-User-ID", USER_ID))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void unknownPlanMapsTo404() throws Exception {
        when(aiCfoService.getPlan(PLAN_ID, USER_ID))
                .thenThrow(new NotFoundException("AI-CFO plan not found: " + PLAN_ID));

        mvc.perform(get("/api/v1/ai-cfo/plans/{planId}", PLAN_ID).header("X-User-ID", USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("AI-CFO plan not found: " + PLAN_ID));
    }

    @Test
    void missingPromptMapsTo404() throws Exception {
        when(aiCfoService.getPrompt("deterministic_audit_1_3f2a9c1e", USER_ID)).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/ai-cfo/prompts/{promptId}", "deterministic_audit_1_3f2a9c1e")
                        .header("X-User-ID", USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void promptOfAnotherOrgIsForbidden() throws Exception {
        when(aiCfoService.getPrompt(PLAN_ID, USER_ID)).thenThrow(new ForbiddenException("No access to this prompt"));

        mvc.perform(get("/api/v1/ai-cfo/prompts/{promptId}", PLAN_ID).header("X-User-ID", USER_ID))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.message").value("No access to this prompt"));
    }

    @Test
    void promptLookupPassesMissingUserToService() throws Exception {
        when(aiCfoService.getPrompt(eq(PLAN_ID), isNull()))
                .thenThrow(new InvalidInputException("userId is required"));

        mvc.perform(get("/api/v1/ai-cfo/prompts/{promptId}", PLAN_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    void unexpectedFailureIsHidden() throws Exception {
        when(aiCfoService.getPlan(PLAN_ID, USER_ID)).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/v1/ai-cfo/plans/{planId}", PLAN_ID).header("X-User-ID", USER_ID))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
