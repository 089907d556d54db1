package com.comanda.orderservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class OrderRequest {

    @NotNull(message = "Restaurant ID cannot be null")
    private UUID restaurantId;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid // validate each OrderItemRequest in the list
    private List<OrderItemRequest> items;

    private String couponCode;

    @Size(max = 500, message = "Delivery note must be at most 500 characters")
    private String deliveryNote;
}
