package com.comanda.orderservice.service.identity;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.orderservice.model.ActorRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads identity from a Keycloak access token: subject as user id, client
 * roles from {@code resource_access.<client>.roles}, and the optional
 * {@code restaurant_id} claim for restaurant staff.
 */
@Component
@Slf4j
public class JwtIdentityResolver implements IdentityResolver {

    // When a token carries several roles the strongest one wins
    private static final List<ActorRole> ROLE_PRIORITY =
            List.of(ActorRole.ADMIN, ActorRole.RESTAURANT, ActorRole.COURIER, ActorRole.CUSTOMER);

    private final String clientId;

    public JwtIdentityResolver(@Value("${comanda.identity.client-id:comanda-backend}") String clientId) {
        this.clientId = clientId;
    }

    @Override
    public CallerIdentity resolve(Jwt jwt) {
        UUID userId = parseUuid(jwt.getSubject())
                .orElseThrow(() -> new AccessDeniedException("INVALID_TOKEN", "Token subject is not a valid user id"));

        List<String> roles = extractClientRoles(jwt).stream()
                .map(role -> role.toUpperCase(Locale.ROOT))
                .toList();

        ActorRole role = ROLE_PRIORITY.stream()
                .filter(candidate -> roles.contains(candidate.name()))
                .findFirst()
                .orElseThrow(() -> {
                    log.warn("Token without marketplace role: userId={}, roles={}", userId, roles);
                    return new AccessDeniedException("ROLE_NOT_PERMITTED", "Token carries no marketplace role");
                });

        return CallerIdentity.builder()
                .userId(userId)
                .role(role)
                .restaurantId(role == ActorRole.RESTAURANT ? extractRestaurantId(jwt) : null)
                .build();
    }

    private List<String> extractClientRoles(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(clientId))
                .filter(Map.class::isInstance)
                .map(client -> (Map<?, ?>) client)
                .map(clientMap -> clientMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }

    private UUID extractRestaurantId(Jwt jwt) {
        Object claim = jwt.getClaims().get("restaurant_id");
        if (claim == null) {
            return null;
        }
        return parseUuid(claim.toString()).orElseGet(() -> {
            log.warn("Ignoring malformed restaurant_id claim: subject={}, value={}", jwt.getSubject(), claim);
            return null;
        });
    }

    private Optional<UUID> parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
