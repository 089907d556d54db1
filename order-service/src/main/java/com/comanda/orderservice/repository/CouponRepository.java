package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.Coupon;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CouponRepository extends JpaRepository<Coupon, UUID> {

    Optional<Coupon> findByCode(String code);

    boolean existsByCode(String code);

    /**
     * Consumes one redemption if the coupon still has one left.
     * The check and the increment are one statement, so concurrent orders can
     * never push the count past the maximum.
     *
     * @return 1 if redeemed, 0 if the coupon is exhausted or inactive
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Coupon c SET c.redemptionCount = c.redemptionCount + 1, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.active = true AND c.redemptionCount < c.maxRedemptions")
    int redeem(@Param("id") UUID id);
}
