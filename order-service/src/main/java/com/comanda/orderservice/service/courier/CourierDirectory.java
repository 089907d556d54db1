package com.comanda.orderservice.service.courier;

import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.config.DispatchProperties;
import com.comanda.orderservice.dto.CourierCandidate;
import com.comanda.orderservice.dto.CourierResponse;
import com.comanda.orderservice.dto.RegisterCourierRequest;
import com.comanda.orderservice.mapper.CourierMapper;
import com.comanda.orderservice.model.Courier;
import com.comanda.orderservice.model.CourierStatus;
import com.comanda.orderservice.repository.CourierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Authoritative record of courier availability and load.
 *
 * Profile edits (status, location, capacity) go through the entity and its
 * version. The active order count is only ever changed by {@link #reserve}
 * and {@link #release}, each a single conditional UPDATE, so no two
 * reservations can both take the last slot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourierDirectory {

    private final CourierRepository courierRepository;
    private final CourierMapper courierMapper;
    private final DispatchProperties dispatchProperties;

    /**
     * Returns the courier's profile, creating an OFF_DUTY one on first login.
     */
    @Transactional
    public CourierResponse getOrRegister(UUID courierId) {
        Courier courier = courierRepository.findById(courierId)
                .orElseGet(() -> {
                    log.info("Courier {} not found in database. Creating new profile (first login).", courierId);
                    return courierRepository.save(newCourier(courierId));
                });
        return courierMapper.toCourierResponse(courier);
    }

    /**
     * Creates or updates the courier's profile. Capacity cannot drop below
     * the number of orders the courier is carrying right now.
     */
    @Transactional
    public CourierResponse register(UUID courierId, RegisterCourierRequest request) {
        Courier courier = courierRepository.findById(courierId).orElseGet(() -> newCourier(courierId));

        if (request.getVehiclePlate() != null) {
            courier.setVehiclePlate(request.getVehiclePlate());
        }
        if (request.getPhoneNumber() != null) {
            courier.setPhoneNumber(request.getPhoneNumber());
        }
        if (request.getCapacity() != null) {
            if (request.getCapacity() < courier.getActiveOrderCount()) {
                throw new IllegalArgumentException(String.format(
                        "Capacity %d is below the %d orders currently assigned",
                        request.getCapacity(), courier.getActiveOrderCount()));
            }
            courier.setCapacity(request.getCapacity());
        }

        Courier saved = courierRepository.save(courier);
        log.info("Courier profile saved: courierId={}, capacity={}, vehiclePlate={}",
                courierId, saved.getCapacity(), saved.getVehiclePlate());
        return courierMapper.toCourierResponse(saved);
    }

    /**
     * Going OFF_DUTY or ON_BREAK forces the courier unavailable regardless of
     * load. Orders already assigned stay with the courier.
     */
    @Transactional
    public CourierResponse setAvailability(UUID courierId, CourierStatus status) {
        Courier courier = findCourier(courierId);

        CourierStatus oldStatus = courier.getStatus();
        courier.setStatus(status);
        Courier updated = courierRepository.save(courier);

        log.info("Courier status updated: courierId={}, oldStatus={}, newStatus={}, activeOrders={}",
                courierId, oldStatus, status, updated.getActiveOrderCount());
        return courierMapper.toCourierResponse(updated);
    }

    @Transactional
    public CourierResponse updateLocation(UUID courierId, Double latitude, Double longitude) {
        Courier courier = findCourier(courierId);

        courier.setCurrentLatitude(latitude);
        courier.setCurrentLongitude(longitude);
        Courier updated = courierRepository.save(courier);

        log.debug("Courier location updated: courierId={}, lat={}, lon={}", courierId, latitude, longitude);
        return courierMapper.toCourierResponse(updated);
    }

    /**
     * Deactivated couriers keep their history but are never offered orders.
     */
    @Transactional
    public CourierResponse setActive(UUID courierId, boolean active) {
        Courier courier = findCourier(courierId);
        courier.setIsActive(active);
        log.info("Courier account {}: courierId={}", active ? "activated" : "deactivated", courierId);
        return courierMapper.toCourierResponse(courierRepository.save(courier));
    }

    /**
     * Takes one delivery slot on the courier if one is free.
     * Joins the caller's transaction so the slot is given back if the order
     * update fails.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReservationResult reserve(UUID courierId) {
        int updated = courierRepository.reserve(courierId, CourierStatus.ON_DUTY);
        if (updated == 0) {
            log.debug("Courier {} could not be reserved (full or unavailable)", courierId);
            return ReservationResult.FULL;
        }
        log.debug("Courier slot reserved: courierId={}", courierId);
        return ReservationResult.RESERVED;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void release(UUID courierId) {
        int updated = courierRepository.release(courierId);
        if (updated == 0) {
            log.warn("Release ignored, courier has no active orders: courierId={}", courierId);
            return;
        }
        log.debug("Courier slot released: courierId={}", courierId);
    }

    /**
     * Lock-free snapshot of couriers that looked available at read time.
     */
    public List<CourierCandidate> findAvailableCandidates(boolean requirePosition) {
        return courierRepository.findCandidates(CourierStatus.ON_DUTY, requirePosition);
    }

    @Transactional(readOnly = true)
    public CourierResponse getCourier(UUID courierId) {
        return courierMapper.toCourierResponse(findCourier(courierId));
    }

    @Transactional(readOnly = true)
    public List<CourierResponse> listCouriers() {
        return courierRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(courierMapper::toCourierResponse)
                .toList();
    }

    private Courier findCourier(UUID courierId) {
        return courierRepository.findById(courierId)
                .orElseThrow(() -> {
                    log.warn("Courier not found: courierId={}", courierId);
                    return new ResourceNotFoundException("Courier not found. Please call /me first to create profile.");
                });
    }

    private Courier newCourier(UUID courierId) {
        return Courier.builder()
                .id(courierId)
                .status(CourierStatus.OFF_DUTY)
                .isActive(true)
                .activeOrderCount(0)
                .capacity(dispatchProperties.getDefaultCourierCapacity())
                .build();
    }
}
