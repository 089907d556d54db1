package com.comanda.orderservice.service.identity;

import org.springframework.security.oauth2.jwt.Jwt;

public interface IdentityResolver {

    /**
     * Resolves an authenticated token to a user id and a single marketplace role.
     *
     * @throws com.comanda.common.exception.AccessDeniedException if the token
     *         carries no usable identity or role
     */
    CallerIdentity resolve(Jwt jwt);
}
