package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.CourierAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CourierAssignmentRepository extends JpaRepository<CourierAssignment, UUID> {

    Optional<CourierAssignment> findFirstByOrderIdAndReleasedAtIsNull(UUID orderId);

    List<CourierAssignment> findByOrderIdOrderByAssignedAtAsc(UUID orderId);

    long countByCourierIdAndReleasedAtIsNull(UUID courierId);
}
