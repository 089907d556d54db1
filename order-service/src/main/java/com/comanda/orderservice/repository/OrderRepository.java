package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    List<Order> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    List<Order> findByCustomerIdAndStatusOrderByCreatedAtDesc(UUID customerId, OrderStatus status);

    List<Order> findByRestaurantIdOrderByCreatedAtDesc(UUID restaurantId);

    List<Order> findByRestaurantIdAndStatusOrderByCreatedAtDesc(UUID restaurantId, OrderStatus status);

    List<Order> findByRestaurantIdInOrderByCreatedAtDesc(Collection<UUID> restaurantIds);

    List<Order> findByRestaurantIdInAndStatusOrderByCreatedAtDesc(Collection<UUID> restaurantIds, OrderStatus status);

    List<Order> findByCourierIdOrderByCreatedAtDesc(UUID courierId);

    List<Order> findByCourierIdAndStatusOrderByCreatedAtDesc(UUID courierId, OrderStatus status);

    List<Order> findAllByOrderByCreatedAtDesc();

    List<Order> findByStatusOrderByCreatedAtDesc(OrderStatus status);

    boolean existsByCustomerId(UUID customerId);

    // READY_FOR_PICKUP orders still waiting for a courier
    List<Order> findByStatusAndCourierIdIsNullOrderByReadyAtAsc(OrderStatus status);

    List<Order> findByStatusAndCourierIdIsNullAndReadyAtBeforeOrderByReadyAtAsc(OrderStatus status, Instant before);

    List<Order> findByStatusAndDeliveredAtAfterOrderByDeliveredAtAsc(OrderStatus status, Instant after);
}
