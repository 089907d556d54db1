package com.comanda.orderservice.service.lifecycle;

import com.comanda.orderservice.dto.AssignmentResponse;
import com.comanda.orderservice.dto.CompletedOrderRecord;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.dto.OrderTrackingResponse;
import com.comanda.orderservice.dto.StatusHistoryResponse;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.service.identity.CallerIdentity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for everything that happens to an order. Each mutation is
 * atomic per order: it either commits completely and returns the new
 * snapshot, or throws and leaves the order, couriers and coupons untouched.
 */
public interface OrderLifecycleService {

    OrderResponse createOrder(CallerIdentity caller, OrderRequest request);

    /**
     * @param expectedVersion optional; a mismatch fails with CONCURRENT_MODIFICATION
     * @param note            optional free text recorded in the status history
     */
    OrderResponse transition(UUID orderId, OrderStatus target, CallerIdentity caller, Long expectedVersion, String note);

    OrderResponse cancel(UUID orderId, CallerIdentity caller, String reason, Long expectedVersion);

    OrderResponse getOrder(UUID orderId);

    OrderResponse getOrder(UUID orderId, CallerIdentity caller);

    /**
     * Single attempt to move a READY_FOR_PICKUP order out for delivery.
     */
    OrderResponse dispatch(UUID orderId);

    /**
     * Like {@link #dispatch} but retried with backoff while couriers are full
     * or the order is contended.
     */
    OrderResponse dispatchWithRetry(UUID orderId);

    OrderResponse reassignCourier(UUID orderId, CallerIdentity caller);

    /**
     * Orders the caller is party to, newest first.
     *
     * @param status optional; when given only orders currently in that status
     */
    List<OrderResponse> getOrdersFor(CallerIdentity caller, OrderStatus status);

    /**
     * Where the order is: its status plus the assigned courier's vehicle and
     * last reported position. Open to the ordering customer, the assigned
     * courier and administrators.
     */
    OrderTrackingResponse trackOrder(UUID orderId, CallerIdentity caller);

    /**
     * Every courier that has carried the order, oldest first.
     */
    List<AssignmentResponse> getAssignmentHistory(UUID orderId);

    List<StatusHistoryResponse> getStatusHistory(UUID orderId, CallerIdentity caller);

    /**
     * READY_FOR_PICKUP orders without a courier that became ready more than
     * {@code olderThan} ago, oldest first.
     */
    List<OrderResponse> findOrdersAwaitingDispatch(Duration olderThan);

    List<CompletedOrderRecord> getCompletedOrders(Instant since);
}
