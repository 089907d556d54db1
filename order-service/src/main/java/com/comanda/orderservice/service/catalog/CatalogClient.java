package com.comanda.orderservice.service.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Narrow view of the restaurant catalog needed to place an order.
 * Implementations throw {@link com.comanda.orderservice.exception.ExternalServiceException}
 * when the catalog cannot be consulted.
 */
public interface CatalogClient {

    /**
     * @throws com.comanda.common.exception.ResourceNotFoundException for an unknown restaurant
     */
    RestaurantInfo getRestaurant(UUID restaurantId);

    /**
     * Unknown ids are simply absent from the returned map.
     */
    Map<UUID, DishInfo> getDishes(Collection<UUID> dishIds);

    List<UUID> findRestaurantIdsOwnedBy(UUID ownerId);
}
