package com.comanda.orderservice.model;

/**
 * Who is asking for a transition. DISPATCH is the engine itself acting on
 * behalf of the courier dispatch flow; it never comes from a user token.
 */
public enum ActorRole {
    CUSTOMER,
    RESTAURANT,
    COURIER,
    ADMIN,
    DISPATCH
}
