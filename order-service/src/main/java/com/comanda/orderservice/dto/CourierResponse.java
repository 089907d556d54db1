package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.CourierStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourierResponse {
    private UUID id;
    private CourierStatus status;
    private String vehiclePlate;
    private String phoneNumber;
    private Boolean isActive;
    private Double currentLatitude;
    private Double currentLongitude;
    private Integer activeOrderCount;
    private Integer capacity;
    private boolean available;
}
