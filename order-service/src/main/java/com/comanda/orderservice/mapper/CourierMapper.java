package com.comanda.orderservice.mapper;

import com.comanda.orderservice.dto.CourierResponse;
import com.comanda.orderservice.model.Courier;
import org.springframework.stereotype.Component;

@Component
public class CourierMapper {

    /**
     * Maps the courier row to its API view. {@code available} is derived here,
     * it is not stored.
     */
    public CourierResponse toCourierResponse(Courier courier) {
        return CourierResponse.builder()
                .id(courier.getId())
                .status(courier.getStatus())
                .vehiclePlate(courier.getVehiclePlate())
                .phoneNumber(courier.getPhoneNumber())
                .isActive(courier.getIsActive())
                .currentLatitude(courier.getCurrentLatitude())
                .currentLongitude(courier.getCurrentLongitude())
                .activeOrderCount(courier.getActiveOrderCount())
                .capacity(courier.getCapacity())
                .available(courier.isAvailable())
                .build();
    }
}
