package com.comanda.orderservice.service.catalog;

import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.exception.ExternalServiceException;
import com.comanda.orderservice.model.DishSnapshot;
import com.comanda.orderservice.model.RestaurantSnapshot;
import com.comanda.orderservice.repository.DishSnapshotRepository;
import com.comanda.orderservice.repository.RestaurantSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Serves catalog lookups from the local snapshot tables that
 * {@code CatalogEventSubscriber} keeps in sync, so placing an order never
 * waits on the catalog service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotCatalogClient implements CatalogClient {

    private final RestaurantSnapshotRepository restaurantRepository;
    private final DishSnapshotRepository dishRepository;

    @Override
    public RestaurantInfo getRestaurant(UUID restaurantId) {
        RestaurantSnapshot snapshot;
        try {
            snapshot = restaurantRepository.findById(restaurantId).orElse(null);
        } catch (DataAccessException e) {
            log.error("Catalog lookup failed for restaurant {}: {}", restaurantId, e.getMessage());
            throw new ExternalServiceException("Catalog is unavailable, please retry", e);
        }
        if (snapshot == null) {
            throw new ResourceNotFoundException("Restaurant not found: " + restaurantId);
        }
        return new RestaurantInfo(snapshot.getRestaurantId(), snapshot.getOwnerId(), snapshot.getName(),
                snapshot.getLatitude(), snapshot.getLongitude(), snapshot.isAcceptingOrders());
    }

    @Override
    public Map<UUID, DishInfo> getDishes(Collection<UUID> dishIds) {
        Map<UUID, DishInfo> dishes = new HashMap<>();
        if (dishIds.isEmpty()) {
            return dishes;
        }
        try {
            for (DishSnapshot snapshot : dishRepository.findAllById(dishIds)) {
                dishes.put(snapshot.getDishId(), new DishInfo(snapshot.getDishId(), snapshot.getRestaurantId(),
                        snapshot.getName(), snapshot.getPrice(), snapshot.isAvailable()));
            }
        } catch (DataAccessException e) {
            log.error("Catalog lookup failed for dishes {}: {}", dishIds, e.getMessage());
            throw new ExternalServiceException("Catalog is unavailable, please retry", e);
        }
        return dishes;
    }

    @Override
    public List<UUID> findRestaurantIdsOwnedBy(UUID ownerId) {
        try {
            return restaurantRepository.findByOwnerId(ownerId).stream()
                    .map(RestaurantSnapshot::getRestaurantId)
                    .toList();
        } catch (DataAccessException e) {
            log.error("Catalog lookup failed for owner {}: {}", ownerId, e.getMessage());
            throw new ExternalServiceException("Catalog is unavailable, please retry", e);
        }
    }
}
