package com.syncbridge.workflows;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.core.model.ActivityDefinition;
import com.syncbridge.core.model.ActivityDefinition.IdempotencyKeyFunction;
import com.syncbridge.core.model.RetryPolicy;
import com.syncbridge.core.model.WorkflowDefinition;
import com.syncbridge.engine.coordinator.WorkflowDefinitionRegistry;

import java.time.Duration;
import java.util.List;

/**
 * Tenant synchronization workflows.
 *
 * Workflows:
 * 1. tenant.onboarding - create-organization, allocate-credits (only with initialCredits), sync-users
 * 2. credit.allocation - allocate-credits, notify-applications
 * 3. user.sync - sync-users
 *
 * Inputs:
 * <pre>
 * tenant.onboarding: {organizationId, name, parentOrganizationId?, initialCredits?: {allocationId?, amount, reason?}, users?: [...]}
 * credit.allocation: {organizationId, allocationId?, amount, reason?, applications?: [...]}
 * user.sync:         {organizationId?, users: [{userId, email?, name?}]}
 * </pre>
 */
public final class TenantSyncWorkflows {

    public static final String TENANT_ONBOARDING = "tenant.onboarding";
    public static final String CREDIT_ALLOCATION = "credit.allocation";
    public static final String USER_SYNC = "user.sync";

    // Activity names
    public static final String CREATE_ORGANIZATION = "create-organization";
    public static final String ALLOCATE_CREDITS = "allocate-credits";
    public static final String SYNC_USERS = "sync-users";
    public static final String NOTIFY_APPLICATIONS = "notify-applications";

    public static final String INITIAL_CREDITS = "initialCredits";

    private TenantSyncWorkflows() {
    }

    public static List<WorkflowDefinition> definitions() {
        return List.of(tenantOnboarding(), creditAllocation(), userSync());
    }

    public static void registerAll(WorkflowDefinitionRegistry registry) {
        definitions().forEach(registry::register);
    }

    public static WorkflowDefinition tenantOnboarding() {
        return WorkflowDefinition.builder(TENANT_ONBOARDING)
            .description("Announce a new organization, grant its initial credits and sync its users")
            .step(ActivityDefinition.builder(CREATE_ORGANIZATION)
                .retryPolicy(publishingRetries(5))
                .timeout(Duration.ofSeconds(30))
                // one organization.created per organization, however often onboarding is submitted
                .idempotencyKey(IdempotencyKeyFunction.byInputField("organizationId"))
                .build())
            .step(ActivityDefinition.builder(ALLOCATE_CREDITS)
                .retryPolicy(publishingRetries(5))
                .timeout(Duration.ofSeconds(30))
                .runIf((input, history) -> hasInitialCredits(input))
                .build())
            .step(ActivityDefinition.builder(SYNC_USERS)
                .retryPolicy(publishingRetries(5))
                .timeout(Duration.ofMinutes(2))
                .build())
            .build();
    }

    public static WorkflowDefinition creditAllocation() {
        return WorkflowDefinition.builder(CREDIT_ALLOCATION)
            .description("Grant credits to an organization and notify the applications that hold balances")
            .step(ActivityDefinition.builder(ALLOCATE_CREDITS)
                .retryPolicy(publishingRetries(5))
                .timeout(Duration.ofSeconds(30))
                .build())
            .step(ActivityDefinition.builder(NOTIFY_APPLICATIONS)
                .retryPolicy(publishingRetries(10))
                .timeout(Duration.ofMinutes(1))
                .build())
            .build();
    }

    public static WorkflowDefinition userSync() {
        return WorkflowDefinition.builder(USER_SYNC)
            .description("Publish user.created for every user in the input")
            .step(ActivityDefinition.builder(SYNC_USERS)
                .retryPolicy(publishingRetries(5))
                .timeout(Duration.ofMinutes(2))
                .build())
            .build();
    }

    static boolean hasInitialCredits(JsonNode input) {
        return input != null && input.hasNonNull(INITIAL_CREDITS);
    }

    private static RetryPolicy publishingRetries(int maxAttempts) {
        return RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .initialBackoff(Duration.ofSeconds(2))
            .maxBackoff(Duration.ofMinutes(1))
            .backoffMultiplier(2.0)
            .build();
    }
}
