package com.syncbridge.core.payload;

/**
 * {@code user.created}, {@code user.deactivated}, {@code user.deleted}.
 */
public record UserPayload(
    String userId,
    String email,
    String name
) implements EventPayload {

    @Override
    public void validate() {
        EventPayload.require(EventPayload.present(userId), "user event requires userId");
    }
}
