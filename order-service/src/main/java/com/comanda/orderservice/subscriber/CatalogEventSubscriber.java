package com.comanda.orderservice.subscriber;

import com.comanda.common.contracts.DishEventContract;
import com.comanda.common.contracts.RestaurantEventContract;
import com.comanda.orderservice.config.AmqpConfig;
import com.comanda.orderservice.model.DishSnapshot;
import com.comanda.orderservice.model.RestaurantSnapshot;
import com.comanda.orderservice.repository.DishSnapshotRepository;
import com.comanda.orderservice.repository.RestaurantSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitHandler;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the local restaurant and dish snapshots in sync with the catalog
 * service. Orders are priced from these snapshots, never from a live call.
 *
 * A message that cannot be applied is rejected without requeue and lands in
 * the dead letter queue.
 */
@Component
@RabbitListener(queues = AmqpConfig.Q_CATALOG_UPDATES)
@RequiredArgsConstructor
@Slf4j
public class CatalogEventSubscriber {

    private final DishSnapshotRepository dishRepository;
    private final RestaurantSnapshotRepository restaurantRepository;

    // upsert, or delete when the catalog removed the dish
    @RabbitHandler
    @Transactional
    public void handleDishEvent(DishEventContract event) {
        try {
            if (event.isDeleted()) {
                dishRepository.deleteById(event.getDishId());
                log.info("Dish snapshot deleted: dishId={}", event.getDishId());
                return;
            }

            DishSnapshot snapshot = dishRepository.findById(event.getDishId()).orElseGet(DishSnapshot::new);
            snapshot.setDishId(event.getDishId());
            snapshot.setRestaurantId(event.getRestaurantId());
            snapshot.setName(event.getName());
            snapshot.setPrice(event.getPrice());
            snapshot.setAvailable(event.isAvailable());

            dishRepository.save(snapshot);
            log.info("Dish snapshot updated: dishId={}, price={}, available={}",
                    event.getDishId(), event.getPrice(), event.isAvailable());
        } catch (DataAccessException e) {
            log.error("Failed to apply dish event: dishId={}, error={}", event.getDishId(), e.getMessage());
            throw new AmqpRejectAndDontRequeueException("Dish event could not be applied", e);
        }
    }

    @RabbitHandler
    @Transactional
    public void handleRestaurantEvent(RestaurantEventContract event) {
        try {
            RestaurantSnapshot snapshot = restaurantRepository.findById(event.getRestaurantId())
                    .orElseGet(RestaurantSnapshot::new);
            snapshot.setRestaurantId(event.getRestaurantId());
            snapshot.setOwnerId(event.getOwnerId());
            snapshot.setName(event.getName());
            snapshot.setLatitude(event.getLatitude());
            snapshot.setLongitude(event.getLongitude());
            snapshot.setAcceptingOrders(event.isOpen());

            restaurantRepository.save(snapshot);
            log.info("Restaurant snapshot updated: restaurantId={}, open={}", event.getRestaurantId(), event.isOpen());
        } catch (DataAccessException e) {
            log.error("Failed to apply restaurant event: restaurantId={}, error={}",
                    event.getRestaurantId(), e.getMessage());
            throw new AmqpRejectAndDontRequeueException("Restaurant event could not be applied", e);
        }
    }
}
