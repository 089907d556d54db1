package com.comanda.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Published by the catalog service when a restaurant profile changes.
 * Latitude/longitude are the pickup point used for courier ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantEventContract {
    private UUID restaurantId;
    private UUID ownerId;
    private String name;
    private Double latitude;
    private Double longitude;
    private boolean open;
}
