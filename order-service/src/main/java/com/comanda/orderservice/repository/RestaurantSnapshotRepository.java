package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.RestaurantSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RestaurantSnapshotRepository extends JpaRepository<RestaurantSnapshot, UUID> {

    List<RestaurantSnapshot> findByOwnerId(UUID ownerId);
}
