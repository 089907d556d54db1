package com.comanda.orderservice.model;

public enum AssignmentReleaseReason {
    DELIVERED,
    CANCELLED,
    REASSIGNED
}
