package com.comanda.orderservice.repository;

import com.comanda.orderservice.dto.CourierCandidate;
import com.comanda.orderservice.model.Courier;
import com.comanda.orderservice.model.CourierStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CourierRepository extends JpaRepository<Courier, UUID> {

    List<Courier> findAllByOrderByCreatedAtAsc();

    /**
     * Read-only view of every courier that could take one more order right now.
     * Couriers without a known position are left out; they cannot be ranked.
     * The result may be stale by the time {@link #reserve} runs.
     */
    @Query("SELECT new com.comanda.orderservice.dto.CourierCandidate(" +
            "c.id, c.currentLatitude, c.currentLongitude, c.activeOrderCount, c.capacity) " +
            "FROM Courier c " +
            "WHERE c.isActive = true AND c.status = :status AND c.activeOrderCount < c.capacity " +
            "AND (:requirePosition = false OR (c.currentLatitude IS NOT NULL AND c.currentLongitude IS NOT NULL))")
    List<CourierCandidate> findCandidates(@Param("status") CourierStatus status,
                                          @Param("requirePosition") boolean requirePosition);

    /**
     * Atomic check-and-increment of the active order count.
     * Must run inside the caller's transaction; the row lock taken by the
     * UPDATE is held until that transaction ends.
     *
     * @return 1 if a slot was taken, 0 if the courier is full, off duty or inactive
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Courier c SET c.activeOrderCount = c.activeOrderCount + 1, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.isActive = true AND c.status = :status AND c.activeOrderCount < c.capacity")
    int reserve(@Param("id") UUID id, @Param("status") CourierStatus status);

    /**
     * Gives a slot back. Never drives the count below zero.
     *
     * @return 1 if a slot was released, 0 if the courier had nothing to release
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Courier c SET c.activeOrderCount = c.activeOrderCount - 1, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.activeOrderCount > 0")
    int release(@Param("id") UUID id);
}
