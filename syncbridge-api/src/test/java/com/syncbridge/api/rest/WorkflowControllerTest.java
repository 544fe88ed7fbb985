package com.syncbridge.api.rest;

import com.syncbridge.engine.test.SyncTestHarness;
import com.syncbridge.workflows.TenantSyncWorkflows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkflowControllerTest {

    private static final String USER_SYNC = """
        {
          "workflowType": "user.sync",
          "tenantId": "T1",
          "requestId": "req-1",
          "input": {"users": [{"userId": "u1"}]}
        }
        """;

    private SyncTestHarness harness;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        harness = new SyncTestHarness();
        TenantSyncWorkflows.registerAll(harness.definitions);
        mockMvc = MockMvcBuilders.standaloneSetup(new WorkflowController(harness.workflowCoordinator))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Starting a workflow dispatches its first activity; repeating the requestId returns the same execution")
    void startIsIdempotentByRequestId() throws Exception {
        String workflowId = start();

        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON).content(USER_SYNC))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.workflowId").value(workflowId));

        mockMvc.perform(get("/api/v1/workflows/{workflowId}", workflowId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("RUNNING"))
            .andExpect(jsonPath("$.input.users", hasSize(1)));
        mockMvc.perform(get("/api/v1/workflows").param("tenantId", "T1"))
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    @DisplayName("Cancelling a running workflow succeeds once; a second cancel is a 409")
    void cancel() throws Exception {
        String workflowId = start();

        mockMvc.perform(post("/api/v1/workflows/{workflowId}/cancel", workflowId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"tenant removed\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("CANCELLED"));

        mockMvc.perform(post("/api/v1/workflows/{workflowId}/cancel", workflowId))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Unknown workflow types and ids are 404")
    void unknownWorkflow() throws Exception {
        mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(USER_SYNC.replace("user.sync", "tenant.offboarding")))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        mockMvc.perform(get("/api/v1/workflows/{workflowId}", "00000000-0000-0000-0000-000000000001"))
            .andExpect(status().isNotFound());
    }

    private String start() throws Exception {
        String body = mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(USER_SYNC))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return harness.objectMapper.readTree(body).get("workflowId").asText();
    }
}
