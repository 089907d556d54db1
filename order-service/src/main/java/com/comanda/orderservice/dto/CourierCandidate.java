package com.comanda.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

// JPQL constructor projection, see CourierRepository.findCandidates
@Value
@AllArgsConstructor
public class CourierCandidate {
    UUID courierId;
    Double latitude;
    Double longitude;
    Integer activeOrderCount;
    Integer capacity;
}
