package com.syncbridge.core.payload;

/**
 * {@code role.assigned} and {@code role.unassigned}.
 */
public record RoleAssignmentPayload(
    String userId,
    String roleId
) implements EventPayload {

    @Override
    public void validate() {
        EventPayload.require(EventPayload.present(userId), "role assignment requires userId");
        EventPayload.require(EventPayload.present(roleId), "role assignment requires roleId");
    }
}
