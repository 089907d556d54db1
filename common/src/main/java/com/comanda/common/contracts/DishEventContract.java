package com.comanda.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Published by the catalog service whenever a dish is created or edited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DishEventContract {
    private UUID dishId;
    private UUID restaurantId;
    private String name;
    private BigDecimal price;
    private boolean available;
    private boolean deleted;
}
