package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.dto.OrderItemRequest;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.event.CourierAssignedEvent;
import com.comanda.orderservice.event.OrderTransitionedEvent;
import com.comanda.orderservice.exception.ConcurrencyConflictException;
import com.comanda.orderservice.exception.CouponRejectedException;
import com.comanda.orderservice.exception.InvalidItemsException;
import com.comanda.orderservice.exception.InvalidTransitionException;
import com.comanda.orderservice.exception.OrderClosedException;
import com.comanda.orderservice.mapper.OrderMapper;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderItem;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.model.OrderStatusHistory;
import com.comanda.orderservice.repository.OrderRepository;
import com.comanda.orderservice.repository.OrderStatusHistoryRepository;
import com.comanda.orderservice.service.catalog.CatalogClient;
import com.comanda.orderservice.service.catalog.DishInfo;
import com.comanda.orderservice.service.catalog.RestaurantInfo;
import com.comanda.orderservice.service.coupon.CouponService;
import com.comanda.orderservice.service.coupon.CouponValidationResult;
import com.comanda.orderservice.service.dispatch.DispatchAssigner;
import com.comanda.orderservice.service.identity.CallerIdentity;
import com.comanda.orderservice.service.pricing.PriceBreakdown;
import com.comanda.orderservice.service.pricing.PricedItem;
import com.comanda.orderservice.service.pricing.PricingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One database transaction per order mutation. Everything a mutation
 * touches (order row, items, coupon counter, courier counter, assignment,
 * history) commits together or not at all.
 *
 * The order row's version is the compare-and-set: {@code saveAndFlush}
 * issues the versioned UPDATE before the method returns, so a concurrent
 * writer surfaces here as an optimistic locking failure and the whole
 * transaction rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderTransactionService {

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final CatalogClient catalogClient;
    private final PricingEngine pricingEngine;
    private final CouponService couponService;
    private final OrderStateMachine stateMachine;
    private final DispatchAssigner dispatchAssigner;
    private final OrderAccessPolicy accessPolicy;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderMapper orderMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public OrderResponse createOrder(CallerIdentity caller, OrderRequest request) {
        if (caller.getRole() != ActorRole.CUSTOMER) {
            throw new AccessDeniedException("ROLE_NOT_PERMITTED", "Only customers can place orders");
        }
        log.info("Order creation process started. restaurantId={}, customerId={}",
                request.getRestaurantId(), caller.getUserId());

        RestaurantInfo restaurant = catalogClient.getRestaurant(request.getRestaurantId());
        if (!restaurant.isAcceptingOrders()) {
            throw new InvalidItemsException("Restaurant is not accepting orders: " + restaurant.getName());
        }

        List<PricedItem> lines = snapshotItems(request);
        BigDecimal subtotal = pricingEngine.subtotal(lines);

        CouponValidationResult coupon = couponService.evaluate(request.getCouponCode(), subtotal,
                request.getRestaurantId(), caller.getUserId());
        if (coupon.isRejected()) {
            throw new CouponRejectedException(coupon.getCode(), coupon.getRejection());
        }
        PriceBreakdown price = pricingEngine.price(lines, coupon);
        log.info("Cart priced: subtotal={}, discount={}, total={}, coupon={}",
                price.getSubtotal(), price.getDiscount(), price.getTotal(), coupon.getCode());

        couponService.redeem(coupon);

        Order order = new Order();
        order.setOrderNumber(orderNumberGenerator.next());
        order.setCustomerId(caller.getUserId());
        order.setRestaurantId(restaurant.getRestaurantId());
        order.setPickupLatitude(restaurant.getLatitude());
        order.setPickupLongitude(restaurant.getLongitude());
        order.setDeliveryNote(request.getDeliveryNote());
        order.setSubtotal(price.getSubtotal());
        order.setDiscount(price.getDiscount());
        order.setTotal(price.getTotal());
        order.setCouponCode(coupon.isApplied() ? coupon.getCode() : null);
        for (PricedItem line : lines) {
            OrderItem item = new OrderItem();
            item.setDishId(line.getDishId());
            item.setDishName(line.getDishName());
            item.setQuantity(line.getQuantity());
            item.setUnitPrice(line.getUnitPrice());
            item.setLineTotal(line.lineTotal());
            order.addItem(item);
        }

        Order saved = orderRepository.saveAndFlush(order);
        log.info("Order saved to database. orderId={}, orderNumber={}", saved.getId(), saved.getOrderNumber());

        Instant now = Instant.now(clock);
        appendHistory(saved, null, caller, "Order placed", now);
        eventPublisher.publishEvent(transitionedEvent(saved, null, caller.getRole(), now)
                .restaurantOwnerId(restaurant.getOwnerId())
                .build());

        return orderMapper.toOrderResponse(saved);
    }

    /**
     * Loads the order, checks the caller's expected version and ownership,
     * applies the move through the state machine and writes it back.
     *
     * @param expectedVersion null to act on whatever version is current
     * @param note            stored on the history row; for cancellations also the reason
     */
    @Transactional
    public OrderResponse applyTransition(UUID orderId, OrderStatus target, CallerIdentity caller,
                                         Long expectedVersion, String note) {
        Order order = findOrder(orderId);
        checkVersion(order, expectedVersion);
        accessPolicy.checkCanAct(order, caller);

        OrderStatus from = order.getStatus();
        stateMachine.apply(order, target, caller.getRole());

        if (target == OrderStatus.CANCELLED) {
            order.setCancellationReason(note);
            order.setCancelledBy(caller.getRole());
        }

        Order saved = orderRepository.saveAndFlush(order);
        log.info("Order status changed: orderId={}, from={}, to={}, role={}, userId={}",
                saved.getId(), from, target, caller.getRole(), caller.getUserId());

        Instant now = Instant.now(clock);
        appendHistory(saved, from, caller, note, now);
        eventPublisher.publishEvent(transitionedEvent(saved, from, caller.getRole(), now).build());
        if (target == OrderStatus.OUT_FOR_DELIVERY) {
            eventPublisher.publishEvent(courierAssignedEvent(saved, false, now));
        }

        return orderMapper.toOrderResponse(saved);
    }

    /**
     * Hands an in-flight delivery to a different courier. The order keeps its
     * status; only the courier and the version change.
     */
    @Transactional
    public OrderResponse reassignCourier(UUID orderId, CallerIdentity caller) {
        if (!caller.isPrivileged()) {
            throw new AccessDeniedException("ROLE_NOT_PERMITTED", "Only administrators can reassign couriers");
        }
        Order order = findOrder(orderId);
        if (order.getStatus().isTerminal()) {
            throw new OrderClosedException(order.getStatus(), OrderStatus.OUT_FOR_DELIVERY);
        }
        if (order.getStatus() != OrderStatus.OUT_FOR_DELIVERY) {
            throw new InvalidTransitionException(order.getStatus(), OrderStatus.OUT_FOR_DELIVERY);
        }

        UUID previous = order.getCourierId();
        UUID courierId = dispatchAssigner.reassign(order);
        order.assignCourier(courierId);

        Order saved = orderRepository.saveAndFlush(order);
        Instant now = Instant.now(clock);
        appendHistory(saved, OrderStatus.OUT_FOR_DELIVERY, caller,
                String.format("Courier reassigned from %s to %s", previous, courierId), now);
        eventPublisher.publishEvent(courierAssignedEvent(saved, true, now));

        return orderMapper.toOrderResponse(saved);
    }

    @Transactional(readOnly = true)
    public OrderResponse readOrder(UUID orderId) {
        return orderMapper.toOrderResponse(findOrder(orderId));
    }

    private List<PricedItem> snapshotItems(OrderRequest request) {
        if (request.getItems() == null || request.getItems().isEmpty()) {
            throw new InvalidItemsException("Order must contain at least one item");
        }
        List<UUID> dishIds = request.getItems().stream()
                .map(OrderItemRequest::getDishId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();

        // Fetch all dishes in one lookup to avoid N+1
        Map<UUID, DishInfo> dishes = catalogClient.getDishes(dishIds);
        log.info("Fetched {} dish snapshots from local catalog", dishes.size());

        List<PricedItem> lines = new ArrayList<>();
        for (OrderItemRequest requested : request.getItems()) {
            DishInfo dish = requested.getDishId() == null ? null : dishes.get(requested.getDishId());
            if (dish == null) {
                log.warn("Dish not found in catalog: dishId={}, restaurantId={}",
                        requested.getDishId(), request.getRestaurantId());
                throw new InvalidItemsException("Dish not found: " + requested.getDishId());
            }
            if (!dish.getRestaurantId().equals(request.getRestaurantId())) {
                log.warn("Dish belongs to different restaurant: dishId={}, expected={}, actual={}",
                        dish.getDishId(), request.getRestaurantId(), dish.getRestaurantId());
                throw new InvalidItemsException("Dish " + dish.getDishId()
                        + " does not belong to restaurant " + request.getRestaurantId());
            }
            if (!dish.isAvailable()) {
                log.warn("Dish not available: dishId={}, name={}", dish.getDishId(), dish.getName());
                throw new InvalidItemsException("Dish is not available: " + dish.getName());
            }
            int quantity = requested.getQuantity() == null ? 0 : requested.getQuantity();
            lines.add(new PricedItem(dish.getDishId(), dish.getName(), quantity, dish.getPrice()));
        }
        return lines;
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
    }

    private void checkVersion(Order order, Long expectedVersion) {
        if (expectedVersion != null && !expectedVersion.equals(order.getVersion())) {
            log.info("Stale order version: orderId={}, expected={}, actual={}",
                    order.getId(), expectedVersion, order.getVersion());
            throw new ConcurrencyConflictException(String.format(
                    "Order %s was modified concurrently (expected version %d, current %d)",
                    order.getId(), expectedVersion, order.getVersion()));
        }
    }

    private void appendHistory(Order order, OrderStatus from, CallerIdentity caller, String note, Instant at) {
        historyRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .fromStatus(from)
                .toStatus(order.getStatus())
                .actorRole(caller.getRole())
                .actorId(caller.getUserId())
                .note(note)
                .occurredAt(at)
                .build());
    }

    private OrderTransitionedEvent.OrderTransitionedEventBuilder transitionedEvent(Order order, OrderStatus from,
                                                                                   ActorRole role, Instant at) {
        return OrderTransitionedEvent.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .restaurantId(order.getRestaurantId())
                .courierId(order.getCourierId())
                .fromStatus(from)
                .toStatus(order.getStatus())
                .actorRole(role)
                .total(order.getTotal())
                .occurredAt(at);
    }

    private CourierAssignedEvent courierAssignedEvent(Order order, boolean reassignment, Instant at) {
        return CourierAssignedEvent.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .courierId(order.getCourierId())
                .customerId(order.getCustomerId())
                .restaurantId(order.getRestaurantId())
                .reassignment(reassignment)
                .occurredAt(at)
                .build();
    }
}
