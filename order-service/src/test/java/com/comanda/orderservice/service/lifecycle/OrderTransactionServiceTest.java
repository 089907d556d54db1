package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
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
import com.comanda.orderservice.model.Coupon;
import com.comanda.orderservice.model.DiscountType;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.model.OrderStatusHistory;
import com.comanda.orderservice.repository.OrderRepository;
import com.comanda.orderservice.repository.OrderStatusHistoryRepository;
import com.comanda.orderservice.service.catalog.CatalogClient;
import com.comanda.orderservice.service.catalog.DishInfo;
import com.comanda.orderservice.service.catalog.RestaurantInfo;
import com.comanda.orderservice.service.coupon.CouponRejection;
import com.comanda.orderservice.service.coupon.CouponService;
import com.comanda.orderservice.service.coupon.CouponValidationResult;
import com.comanda.orderservice.service.dispatch.DispatchAssigner;
import com.comanda.orderservice.service.identity.CallerIdentity;
import com.comanda.orderservice.service.pricing.PricingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderTransactionService Unit Tests")
class OrderTransactionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderStatusHistoryRepository historyRepository;
    @Mock
    private CatalogClient catalogClient;
    @Mock
    private CouponService couponService;
    @Mock
    private OrderStateMachine stateMachine;
    @Mock
    private DispatchAssigner dispatchAssigner;
    @Mock
    private OrderAccessPolicy accessPolicy;
    @Mock
    private OrderNumberGenerator orderNumberGenerator;
    @Mock
    private OrderMapper orderMapper;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrderTransactionService service;

    private UUID customerId;
    private UUID restaurantId;
    private UUID ownerId;
    private UUID dishId;
    private CallerIdentity customer;

    @BeforeEach
    void setUp() {
        service = new OrderTransactionService(orderRepository, historyRepository, catalogClient, new PricingEngine(),
                couponService, stateMachine, dispatchAssigner, accessPolicy, orderNumberGenerator, orderMapper,
                eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));

        customerId = UUID.randomUUID();
        restaurantId = UUID.randomUUID();
        ownerId = UUID.randomUUID();
        dishId = UUID.randomUUID();
        customer = CallerIdentity.of(customerId, ActorRole.CUSTOMER);

        lenient().when(orderMapper.toOrderResponse(any())).thenAnswer(i -> {
            Order order = i.getArgument(0);
            return OrderResponse.builder().id(order.getId()).status(order.getStatus()).total(order.getTotal()).build();
        });
    }

    private OrderRequest request(int quantity, String couponCode) {
        OrderRequest request = new OrderRequest();
        request.setRestaurantId(restaurantId);
        request.setItems(List.of(new OrderItemRequest(dishId, quantity)));
        request.setCouponCode(couponCode);
        return request;
    }

    private void restaurantOpen(boolean open) {
        when(catalogClient.getRestaurant(restaurantId))
                .thenReturn(new RestaurantInfo(restaurantId, ownerId, "Kebab House", 40.99, 29.02, open));
    }

    private void dish(UUID dishRestaurant, boolean available) {
        when(catalogClient.getDishes(anyCollection())).thenReturn(Map.of(dishId,
                new DishInfo(dishId, dishRestaurant, "Adana", new BigDecimal("25.00"), available)));
    }

    private Order storedOrder(OrderStatus status) {
        Order order = new Order();
        order.setId(UUID.randomUUID());
        order.setOrderNumber("ORD-20260301-ABCDEF");
        order.setCustomerId(customerId);
        order.setRestaurantId(restaurantId);
        order.setTotal(new BigDecimal("50.00"));
        order.setVersion(3L);
        order.moveTo(status, NOW.minusSeconds(300));
        return order;
    }

    @Nested
    @DisplayName("createOrder")
    class CreateOrder {

        @Test
        void success_PricesSnapshotsRedeemsAndPublishes() {
            // Arrange
            restaurantOpen(true);
            dish(restaurantId, true);
            Coupon save10 = Coupon.builder().id(UUID.randomUUID()).code("SAVE10").discountType(DiscountType.FLAT)
                    .discountValue(new BigDecimal("10.00")).build();
            CouponValidationResult coupon = CouponValidationResult.accepted(save10, new BigDecimal("10.00"));
            when(couponService.evaluate(eq("save10"), any(), eq(restaurantId), eq(customerId))).thenReturn(coupon);
            when(orderNumberGenerator.next()).thenReturn("ORD-20260301-ABCDEF");
            when(orderRepository.saveAndFlush(any(Order.class))).thenAnswer(i -> {
                Order o = i.getArgument(0);
                o.setId(UUID.randomUUID());
                return o;
            });

            // Act
            service.createOrder(customer, request(2, "save10"));

            // Assert
            ArgumentCaptor<Order> orderCaptor = ArgumentCaptor.forClass(Order.class);
            verify(orderRepository).saveAndFlush(orderCaptor.capture());
            Order saved = orderCaptor.getValue();
            assertThat(saved.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(saved.getSubtotal()).isEqualByComparingTo("50.00");
            assertThat(saved.getDiscount()).isEqualByComparingTo("10.00");
            assertThat(saved.getTotal()).isEqualByComparingTo("40.00");
            assertThat(saved.getCouponCode()).isEqualTo("SAVE10");
            assertThat(saved.getPickupLatitude()).isEqualTo(40.99);
            assertThat(saved.getItems()).singleElement()
                    .satisfies(item -> assertThat(item.getUnitPrice()).isEqualByComparingTo("25.00"));

            verify(couponService).redeem(coupon);

            ArgumentCaptor<OrderTransitionedEvent> eventCaptor = ArgumentCaptor.forClass(OrderTransitionedEvent.class);
            verify(eventPublisher).publishEvent(eventCaptor.capture());
            assertThat(eventCaptor.getValue().getToStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(eventCaptor.getValue().getFromStatus()).isNull();
            assertThat(eventCaptor.getValue().getRestaurantOwnerId()).isEqualTo(ownerId);

            ArgumentCaptor<OrderStatusHistory> historyCaptor = ArgumentCaptor.forClass(OrderStatusHistory.class);
            verify(historyRepository).save(historyCaptor.capture());
            assertThat(historyCaptor.getValue().getActorId()).isEqualTo(customerId);
        }

        @Test
        void notCustomer_IsDenied() {
            CallerIdentity courier = CallerIdentity.of(UUID.randomUUID(), ActorRole.COURIER);

            assertThatThrownBy(() -> service.createOrder(courier, request(1, null)))
                    .isInstanceOf(AccessDeniedException.class);
            verifyNoInteractions(catalogClient, orderRepository);
        }

        @Test
        void dishFromOtherRestaurant_IsInvalidItems() {
            restaurantOpen(true);
            dish(UUID.randomUUID(), true);

            assertThatThrownBy(() -> service.createOrder(customer, request(1, null)))
                    .isInstanceOf(InvalidItemsException.class)
                    .hasMessageContaining("does not belong");
            verify(orderRepository, never()).saveAndFlush(any());
        }

        @Test
        void unavailableDish_IsInvalidItems() {
            restaurantOpen(true);
            dish(restaurantId, false);

            assertThatThrownBy(() -> service.createOrder(customer, request(1, null)))
                    .isInstanceOf(InvalidItemsException.class)
                    .hasMessageContaining("not available");
        }

        @Test
        void unknownDish_IsInvalidItems() {
            restaurantOpen(true);
            when(catalogClient.getDishes(anyCollection())).thenReturn(Map.of());

            assertThatThrownBy(() -> service.createOrder(customer, request(1, null)))
                    .isInstanceOf(InvalidItemsException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        void closedRestaurant_IsRejected() {
            restaurantOpen(false);

            assertThatThrownBy(() -> service.createOrder(customer, request(1, null)))
                    .isInstanceOf(InvalidItemsException.class);
            verify(catalogClient, never()).getDishes(anyCollection());
        }

        @Test
        void rejectedCoupon_FailsWithReasonAndNothingIsSaved() {
            restaurantOpen(true);
            dish(restaurantId, true);
            when(couponService.evaluate(eq("OLD"), any(), eq(restaurantId), eq(customerId)))
                    .thenReturn(CouponValidationResult.rejected("OLD", CouponRejection.EXPIRED));

            assertThatThrownBy(() -> service.createOrder(customer, request(1, "OLD")))
                    .isInstanceOf(CouponRejectedException.class)
                    .satisfies(e -> assertThat(((CouponRejectedException) e).getErrorCode()).isEqualTo("EXPIRED"));
            verify(couponService, never()).redeem(any());
            verify(orderRepository, never()).saveAndFlush(any());
        }
    }

    @Nested
    @DisplayName("applyTransition")
    class ApplyTransition {

        @Test
        void staleExpectedVersion_IsConflictBeforeAnyChange() {
            Order order = storedOrder(OrderStatus.PENDING);
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));

            assertThatThrownBy(() -> service.applyTransition(order.getId(), OrderStatus.CANCELLED, customer, 2L, null))
                    .isInstanceOf(ConcurrencyConflictException.class);
            verifyNoInteractions(stateMachine);
            verify(orderRepository, never()).saveAndFlush(any());
        }

        @Test
        void cancel_RecordsReasonAndActor() {
            Order order = storedOrder(OrderStatus.PENDING);
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
            when(orderRepository.saveAndFlush(order)).thenReturn(order);

            service.applyTransition(order.getId(), OrderStatus.CANCELLED, customer, 3L, "changed my mind");

            verify(accessPolicy).checkCanAct(order, customer);
            verify(stateMachine).apply(order, OrderStatus.CANCELLED, ActorRole.CUSTOMER);
            assertThat(order.getCancellationReason()).isEqualTo("changed my mind");
            assertThat(order.getCancelledBy()).isEqualTo(ActorRole.CUSTOMER);
        }

        @Test
        void outForDelivery_PublishesCourierAssignment() {
            Order order = storedOrder(OrderStatus.READY_FOR_PICKUP);
            UUID courierId = UUID.randomUUID();
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
            when(orderRepository.saveAndFlush(order)).thenReturn(order);
            doAnswer(i -> {
                order.assignCourier(courierId);
                order.moveTo(OrderStatus.OUT_FOR_DELIVERY, NOW);
                return null;
            }).when(stateMachine).apply(order, OrderStatus.OUT_FOR_DELIVERY, ActorRole.DISPATCH);

            service.applyTransition(order.getId(), OrderStatus.OUT_FOR_DELIVERY, CallerIdentity.dispatch(), null, null);

            ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
            verify(eventPublisher, times(2)).publishEvent(events.capture());
            assertThat(events.getAllValues()).hasExactlyElementsOfTypes(OrderTransitionedEvent.class, CourierAssignedEvent.class);
            assertThat(((CourierAssignedEvent) events.getAllValues().get(1)).getCourierId()).isEqualTo(courierId);
        }

        @Test
        void ownershipFailure_StopsBeforeStateMachine() {
            Order order = storedOrder(OrderStatus.PENDING);
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
            CallerIdentity stranger = CallerIdentity.of(UUID.randomUUID(), ActorRole.CUSTOMER);
            doThrow(new AccessDeniedException("NOT_ORDER_PARTY", "no")).when(accessPolicy).checkCanAct(order, stranger);

            assertThatThrownBy(() -> service.applyTransition(order.getId(), OrderStatus.CANCELLED, stranger, null, null))
                    .isInstanceOf(AccessDeniedException.class);
            verifyNoInteractions(stateMachine);
        }
    }

    @Nested
    @DisplayName("reassignCourier")
    class ReassignCourier {

        @Test
        void notOutForDelivery_IsInvalidTransition() {
            Order order = storedOrder(OrderStatus.PREPARING);
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));

            assertThatThrownBy(() -> service.reassignCourier(order.getId(), CallerIdentity.of(UUID.randomUUID(), ActorRole.ADMIN)))
                    .isInstanceOf(InvalidTransitionException.class);
            verifyNoInteractions(dispatchAssigner);
        }

        @Test
        void deliveredOrder_IsClosed() {
            Order order = storedOrder(OrderStatus.DELIVERED);
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));

            assertThatThrownBy(() -> service.reassignCourier(order.getId(), CallerIdentity.of(UUID.randomUUID(), ActorRole.ADMIN)))
                    .isInstanceOf(OrderClosedException.class);
            verifyNoInteractions(dispatchAssigner);
        }

        @Test
        void nonAdmin_IsDenied() {
            assertThatThrownBy(() -> service.reassignCourier(UUID.randomUUID(), customer))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        void admin_MovesOrderToNewCourier() {
            Order order = storedOrder(OrderStatus.OUT_FOR_DELIVERY);
            order.assignCourier(UUID.randomUUID());
            UUID replacement = UUID.randomUUID();
            when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
            when(dispatchAssigner.reassign(order)).thenReturn(replacement);
            when(orderRepository.saveAndFlush(order)).thenReturn(order);

            OrderResponse response = service.reassignCourier(order.getId(), CallerIdentity.of(UUID.randomUUID(), ActorRole.ADMIN));

            assertThat(order.getCourierId()).isEqualTo(replacement);
            assertThat(response.getStatus()).isEqualTo(OrderStatus.OUT_FOR_DELIVERY);
            verify(eventPublisher).publishEvent(any(CourierAssignedEvent.class));
        }
    }
}
