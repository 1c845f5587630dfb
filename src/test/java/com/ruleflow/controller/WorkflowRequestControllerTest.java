package com.ruleflow.controller;

import com.ruleflow.dto.StepDecisionRequest;
import com.ruleflow.dto.WorkflowRequestResponse;
import com.ruleflow.exception.AssignmentException;
import com.ruleflow.model.RequestStatus;
import com.ruleflow.service.WorkflowRequestService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkflowRequestController.class)
class WorkflowRequestControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private WorkflowRequestService requestService;

    @Test
    @DisplayName("Approve passes the acting user from X-User-Id")
    void approve_usesActingUser() throws Exception {
        UUID id = UUID.randomUUID();
        when(requestService.approve(eq("acme"), eq("alice"), eq(id), any(StepDecisionRequest.class)))
                .thenReturn(WorkflowRequestResponse.builder().id(id).status(RequestStatus.IN_REVIEW).currentStep(2).build());

        mockMvc.perform(post("/api/workflow-requests/" + id + "/approve")
                        .header("X-Tenant-Id", "acme").header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"step\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStep").value(2));
    }

    @Test
    @DisplayName("Approve without a step → 400")
    void approve_withoutStep_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/workflow-requests/" + UUID.randomUUID() + "/approve")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(requestService);
    }

    @Test
    @DisplayName("AssignmentException → 422")
    void unresolvableAssignee_isUnprocessable() throws Exception {
        UUID id = UUID.randomUUID();
        when(requestService.approve(eq("acme"), eq("anonymous"), eq(id), any(StepDecisionRequest.class)))
                .thenThrow(new AssignmentException("No users hold role 'compliance'"));

        mockMvc.perform(post("/api/workflow-requests/" + id + "/approve")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"step\":1}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    @DisplayName("Storage failure → 503")
    void storageFailure_isUnavailable() throws Exception {
        UUID id = UUID.randomUUID();
        when(requestService.get("acme", id)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/workflow-requests/" + id).header("X-Tenant-Id", "acme"))
                .andExpect(status().isServiceUnavailable());
    }
}
