package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class TransitionRequest {

    @NotNull(message = "Target status is required")
    private OrderStatus targetStatus;

    // optional compare-and-set guard; omit to act on whatever is current
    private Long expectedVersion;

    @Size(max = 500, message = "Note must be at most 500 characters")
    private String note;
}
