package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.DishSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface DishSnapshotRepository extends JpaRepository<DishSnapshot, UUID> {
}
