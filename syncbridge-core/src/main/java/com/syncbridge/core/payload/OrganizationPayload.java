package com.syncbridge.core.payload;

/**
 * {@code organization.created}.
 */
public record OrganizationPayload(
    String organizationId,
    String name,
    String parentOrganizationId
) implements EventPayload {

    @Override
    public void validate() {
        EventPayload.require(EventPayload.present(organizationId), "organization event requires organizationId");
        EventPayload.require(EventPayload.present(name), "organization event requires name");
    }
}
