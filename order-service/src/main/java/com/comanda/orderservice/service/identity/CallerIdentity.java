package com.comanda.orderservice.service.identity;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.orderservice.model.ActorRole;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Who is calling, as resolved from their token. The state machine only
 * looks at {@link #role}; the other fields drive ownership checks.
 */
@Value
@Builder
public class CallerIdentity {

    private static final CallerIdentity DISPATCH = CallerIdentity.builder().role(ActorRole.DISPATCH).build();

    UUID userId;
    ActorRole role;
    UUID restaurantId; // only for RESTAURANT callers carrying the claim

    /**
     * The engine acting on its own behalf when advancing a ready order.
     */
    public static CallerIdentity dispatch() {
        return DISPATCH;
    }

    public static CallerIdentity of(UUID userId, ActorRole role) {
        return CallerIdentity.builder().userId(userId).role(role).build();
    }

    public boolean isPrivileged() {
        return role == ActorRole.ADMIN || role == ActorRole.DISPATCH;
    }

    /**
     * @throws AccessDeniedException unless the caller holds {@code required}
     */
    public CallerIdentity requireRole(ActorRole required) {
        if (role != required) {
            throw new AccessDeniedException("ROLE_NOT_PERMITTED",
                    String.format("This operation requires role %s, caller has %s", required, role));
        }
        return this;
    }
}
