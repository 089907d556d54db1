package com.comanda.orderservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RegisterCourierRequest {

    @Size(max = 20, message = "Vehicle plate must be at most 20 characters")
    private String vehiclePlate;

    @Size(max = 30, message = "Phone number must be at most 30 characters")
    private String phoneNumber;

    // null keeps the current capacity (or the configured default for new couriers)
    @Min(value = 1, message = "Capacity must be at least 1")
    @Max(value = 10, message = "Capacity must be at most 10")
    private Integer capacity;
}
