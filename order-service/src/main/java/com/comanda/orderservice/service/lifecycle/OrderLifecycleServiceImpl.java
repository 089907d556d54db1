package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.dto.AssignmentResponse;
import com.comanda.orderservice.dto.CompletedOrderRecord;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.dto.OrderTrackingResponse;
import com.comanda.orderservice.dto.StatusHistoryResponse;
import com.comanda.orderservice.exception.ConcurrencyConflictException;
import com.comanda.orderservice.mapper.OrderMapper;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.repository.CourierAssignmentRepository;
import com.comanda.orderservice.repository.CourierRepository;
import com.comanda.orderservice.repository.OrderRepository;
import com.comanda.orderservice.repository.OrderStatusHistoryRepository;
import com.comanda.orderservice.service.catalog.CatalogClient;
import com.comanda.orderservice.service.dispatch.DispatchRetryPolicy;
import com.comanda.orderservice.service.identity.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mutations are not transactional here: each one delegates to
 * {@link OrderTransactionService}, so by the time a call returns (or throws)
 * its transaction has already committed or rolled back. That lets this class
 * translate commit-time concurrency failures, chain a dispatch attempt after
 * a committed READY_FOR_PICKUP move and wrap retries around whole
 * transactions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLifecycleServiceImpl implements OrderLifecycleService {

    private final OrderTransactionService transactionService;
    private final DispatchRetryPolicy dispatchRetryPolicy;
    private final OrderAccessPolicy accessPolicy;
    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final CourierAssignmentRepository assignmentRepository;
    private final CourierRepository courierRepository;
    private final CatalogClient catalogClient;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Override
    public OrderResponse createOrder(CallerIdentity caller, OrderRequest request) {
        return guarded(null, () -> transactionService.createOrder(caller, request));
    }

    @Override
    public OrderResponse transition(UUID orderId, OrderStatus target, CallerIdentity caller,
                                    Long expectedVersion, String note) {
        OrderResponse moved = guarded(orderId,
                () -> transactionService.applyTransition(orderId, target, caller, expectedVersion, note));

        if (moved.getStatus() != OrderStatus.READY_FOR_PICKUP) {
            return moved;
        }

        // READY_FOR_PICKUP is committed at this point; one immediate attempt, the sweep handles the rest
        try {
            return dispatch(orderId);
        } catch (ConcurrencyConflictException e) {
            log.info("Order changed while dispatching, returning current state: orderId={}", orderId);
            return transactionService.readOrder(orderId);
        } catch (EngineException e) {
            log.info("Immediate dispatch did not succeed, order waits for a courier: orderId={}, reason={}",
                    orderId, e.getErrorCode());
            return moved;
        } catch (RuntimeException e) {
            // the restaurant's transition stands; the sweep picks the order up again
            log.warn("Immediate dispatch failed, order waits for the sweep: orderId={}", orderId, e);
            return moved;
        }
    }

    @Override
    public OrderResponse cancel(UUID orderId, CallerIdentity caller, String reason, Long expectedVersion) {
        log.info("Cancel requested: orderId={}, role={}, userId={}", orderId, caller.getRole(), caller.getUserId());
        return guarded(orderId,
                () -> transactionService.applyTransition(orderId, OrderStatus.CANCELLED, caller, expectedVersion, reason));
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId) {
        return orderMapper.toOrderResponse(findOrder(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId, CallerIdentity caller) {
        Order order = findOrder(orderId);
        accessPolicy.checkCanView(order, caller);
        return orderMapper.toOrderResponse(order);
    }

    @Override
    public OrderResponse dispatch(UUID orderId) {
        return guarded(orderId, () -> transactionService.applyTransition(
                orderId, OrderStatus.OUT_FOR_DELIVERY, CallerIdentity.dispatch(), null, "Courier assigned"));
    }

    @Override
    public OrderResponse dispatchWithRetry(UUID orderId) {
        return dispatchRetryPolicy.execute(orderId, () -> dispatch(orderId));
    }

    @Override
    public OrderResponse reassignCourier(UUID orderId, CallerIdentity caller) {
        return guarded(orderId, () -> transactionService.reassignCourier(orderId, caller));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getOrdersFor(CallerIdentity caller, OrderStatus status) {
        List<Order> orders = switch (caller.getRole()) {
            case CUSTOMER -> status == null
                    ? orderRepository.findByCustomerIdOrderByCreatedAtDesc(caller.getUserId())
                    : orderRepository.findByCustomerIdAndStatusOrderByCreatedAtDesc(caller.getUserId(), status);
            case COURIER -> status == null
                    ? orderRepository.findByCourierIdOrderByCreatedAtDesc(caller.getUserId())
                    : orderRepository.findByCourierIdAndStatusOrderByCreatedAtDesc(caller.getUserId(), status);
            case RESTAURANT -> restaurantOrders(caller, status);
            case ADMIN -> status == null
                    ? orderRepository.findAllByOrderByCreatedAtDesc()
                    : orderRepository.findByStatusOrderByCreatedAtDesc(status);
            default -> throw new AccessDeniedException("ROLE_NOT_PERMITTED",
                    "Role " + caller.getRole() + " has no order list");
        };
        log.debug("Found {} orders for userId={}, role={}, status={}",
                orders.size(), caller.getUserId(), caller.getRole(), status);
        return orderMapper.toOrderResponses(orders);
    }

    private List<Order> restaurantOrders(CallerIdentity caller, OrderStatus status) {
        if (caller.getRestaurantId() != null) {
            return status == null
                    ? orderRepository.findByRestaurantIdOrderByCreatedAtDesc(caller.getRestaurantId())
                    : orderRepository.findByRestaurantIdAndStatusOrderByCreatedAtDesc(caller.getRestaurantId(), status);
        }
        List<UUID> owned = catalogClient.findRestaurantIdsOwnedBy(caller.getUserId());
        return status == null
                ? orderRepository.findByRestaurantIdInOrderByCreatedAtDesc(owned)
                : orderRepository.findByRestaurantIdInAndStatusOrderByCreatedAtDesc(owned, status);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderTrackingResponse trackOrder(UUID orderId, CallerIdentity caller) {
        Order order = findOrder(orderId);
        accessPolicy.checkCanTrack(order, caller);

        OrderTrackingResponse.OrderTrackingResponseBuilder tracking = OrderTrackingResponse.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus())
                .pickupLatitude(order.getPickupLatitude())
                .pickupLongitude(order.getPickupLongitude())
                .courierId(order.getCourierId())
                .outForDeliveryAt(order.getOutForDeliveryAt())
                .deliveredAt(order.getDeliveredAt());

        if (order.getCourierId() != null) {
            courierRepository.findById(order.getCourierId()).ifPresentOrElse(
                    courier -> tracking.vehiclePlate(courier.getVehiclePlate())
                            .courierLatitude(courier.getCurrentLatitude())
                            .courierLongitude(courier.getCurrentLongitude()),
                    () -> log.warn("Assigned courier has no profile, tracking without position: orderId={}, courierId={}",
                            orderId, order.getCourierId()));
        }
        return tracking.build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AssignmentResponse> getAssignmentHistory(UUID orderId) {
        findOrder(orderId);
        return orderMapper.toAssignmentResponses(assignmentRepository.findByOrderIdOrderByAssignedAtAsc(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StatusHistoryResponse> getStatusHistory(UUID orderId, CallerIdentity caller) {
        accessPolicy.checkCanView(findOrder(orderId), caller);
        return orderMapper.toStatusHistoryResponses(historyRepository.findByOrderIdOrderByIdAsc(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> findOrdersAwaitingDispatch(Duration olderThan) {
        List<Order> waiting = olderThan == null || olderThan.isZero()
                ? orderRepository.findByStatusAndCourierIdIsNullOrderByReadyAtAsc(OrderStatus.READY_FOR_PICKUP)
                : orderRepository.findByStatusAndCourierIdIsNullAndReadyAtBeforeOrderByReadyAtAsc(
                        OrderStatus.READY_FOR_PICKUP, Instant.now(clock).minus(olderThan));
        return orderMapper.toOrderResponses(waiting);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CompletedOrderRecord> getCompletedOrders(Instant since) {
        Instant from = since != null ? since : Instant.EPOCH;
        List<Order> delivered = orderRepository.findByStatusAndDeliveredAtAfterOrderByDeliveredAtAsc(
                OrderStatus.DELIVERED, from);
        log.info("Completed order feed: since={}, count={}", from, delivered.size());
        return orderMapper.toCompletedOrderRecords(delivered);
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
    }

    // Optimistic lock failures and lock timeouts both mean another writer got there first
    private <T> T guarded(UUID orderId, Supplier<T> mutation) {
        try {
            return mutation.get();
        } catch (ConcurrencyFailureException e) {
            log.info("Concurrent modification detected: orderId={}, error={}", orderId, e.getMessage());
            throw new ConcurrencyConflictException(orderId == null
                    ? "A concurrent update interfered, please retry"
                    : "Order " + orderId + " was modified concurrently, please retry", e);
        }
    }
}
