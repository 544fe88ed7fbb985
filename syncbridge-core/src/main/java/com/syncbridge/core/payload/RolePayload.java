package com.syncbridge.core.payload;

import java.util.List;

/**
 * {@code role.created}, {@code role.updated}, {@code role.deleted}, {@code role.permissions_changed}.
 */
public record RolePayload(
    String roleId,
    String roleName,
    List<String> permissions
) implements EventPayload {

    @Override
    public void validate() {
        EventPayload.require(EventPayload.present(roleId), "role event requires roleId");
    }
}
