package com.comanda.orderservice.service.dispatch;

import com.comanda.orderservice.dto.CourierCandidate;
import com.comanda.orderservice.exception.NoCourierAvailableException;
import com.comanda.orderservice.model.AssignmentReleaseReason;
import com.comanda.orderservice.model.CourierAssignment;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.repository.CourierAssignmentRepository;
import com.comanda.orderservice.service.courier.CourierDirectory;
import com.comanda.orderservice.service.courier.ReservationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Picks a courier for an order that is ready for pickup.
 *
 * 1. Read every courier that looks available (no locks, may be stale)
 * 2. Rank by distance to the pickup point, then by current load, then by id
 * 3. Try to reserve each candidate in turn; a FULL answer means someone else
 *    took the last slot after we read, so move on to the next one
 * 4. Record the assignment for the first reservation that succeeds
 *
 * Every method joins the caller's transaction: the reservation, the
 * assignment row and the order's move to OUT_FOR_DELIVERY commit together or
 * not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchAssigner {

    private static final int EARTH_RADIUS_KM = 6371;

    private final CourierDirectory courierDirectory;
    private final CourierAssignmentRepository assignmentRepository;
    private final Clock clock;

    /**
     * @return id of the reserved courier
     * @throws NoCourierAvailableException when every candidate is full
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID assign(Order order) {
        return reserveBest(order, Set.of());
    }

    /**
     * Moves an order to a different courier. The new slot is taken before the
     * old one is given back, so a failed reassignment leaves the current
     * courier in place.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID reassign(Order order) {
        CourierAssignment current = assignmentRepository.findFirstByOrderIdAndReleasedAtIsNull(order.getId())
                .orElse(null);
        Set<UUID> excluded = current == null ? Set.of() : Set.of(current.getCourierId());

        UUID courierId = reserveBest(order, excluded);

        if (current != null) {
            close(current, AssignmentReleaseReason.REASSIGNED);
        }
        log.info("Order reassigned: orderId={}, fromCourier={}, toCourier={}",
                order.getId(), current == null ? null : current.getCourierId(), courierId);
        return courierId;
    }

    /**
     * Dissolves the order's open assignment and gives the courier's slot back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void release(Order order, AssignmentReleaseReason reason) {
        assignmentRepository.findFirstByOrderIdAndReleasedAtIsNull(order.getId())
                .ifPresentOrElse(
                        assignment -> close(assignment, reason),
                        () -> log.warn("No open assignment to release: orderId={}, courierId={}",
                                order.getId(), order.getCourierId()));
    }

    List<CourierCandidate> rank(Order order, Set<UUID> excluded) {
        Double pickupLat = order.getPickupLatitude();
        Double pickupLon = order.getPickupLongitude();
        boolean pickupLocated = pickupLat != null && pickupLon != null;

        // couriers without a known position only qualify when distance cannot be measured anyway
        List<CourierCandidate> candidates = courierDirectory.findAvailableCandidates(pickupLocated).stream()
                .filter(candidate -> !excluded.contains(candidate.getCourierId()))
                .toList();

        Comparator<CourierCandidate> byLoadThenId = Comparator
                .comparing(CourierCandidate::getActiveOrderCount)
                .thenComparing(CourierCandidate::getCourierId);

        if (!pickupLocated) {
            log.warn("Pickup point missing coordinates, ranking by load only: orderId={}", order.getId());
            return candidates.stream().sorted(byLoadThenId).toList();
        }

        Map<UUID, Double> distances = new HashMap<>();
        for (CourierCandidate candidate : candidates) {
            distances.put(candidate.getCourierId(),
                    distanceKm(pickupLat, pickupLon, candidate.getLatitude(), candidate.getLongitude()));
        }

        Comparator<CourierCandidate> byDistance = Comparator.comparing(c -> distances.get(c.getCourierId()));
        return candidates.stream().sorted(byDistance.thenComparing(byLoadThenId)).toList();
    }

    private UUID reserveBest(Order order, Set<UUID> excluded) {
        List<CourierCandidate> ranked = rank(order, excluded);

        if (ranked.isEmpty()) {
            log.info("No available courier found for order: orderId={}", order.getId());
            throw new NoCourierAvailableException(order.getId(), 0);
        }
        log.debug("Found {} candidate couriers for order: orderId={}", ranked.size(), order.getId());

        for (CourierCandidate candidate : ranked) {
            if (courierDirectory.reserve(candidate.getCourierId()) != ReservationResult.RESERVED) {
                log.debug("Courier {} was claimed by another order, trying next candidate", candidate.getCourierId());
                continue;
            }

            assignmentRepository.save(CourierAssignment.builder()
                    .orderId(order.getId())
                    .courierId(candidate.getCourierId())
                    .assignedAt(Instant.now(clock))
                    .build());

            log.info("Courier reserved for order: courierId={}, orderId={}", candidate.getCourierId(), order.getId());
            return candidate.getCourierId();
        }

        log.info("All {} candidates were claimed before reservation: orderId={}", ranked.size(), order.getId());
        throw new NoCourierAvailableException(order.getId(), ranked.size());
    }

    private void close(CourierAssignment assignment, AssignmentReleaseReason reason) {
        assignment.setReleasedAt(Instant.now(clock));
        assignment.setReleaseReason(reason);
        assignmentRepository.save(assignment);
        courierDirectory.release(assignment.getCourierId());
        log.info("Assignment released: orderId={}, courierId={}, reason={}",
                assignment.getOrderId(), assignment.getCourierId(), reason);
    }

    /**
     * Great-circle distance between two points (Haversine).
     *
     * @return distance in kilometers
     */
    static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }
}
