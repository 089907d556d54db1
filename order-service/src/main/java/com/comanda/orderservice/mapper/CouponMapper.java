package com.comanda.orderservice.mapper;

import com.comanda.orderservice.dto.CouponRequest;
import com.comanda.orderservice.dto.CouponResponse;
import com.comanda.orderservice.model.Coupon;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface CouponMapper {

    CouponResponse toCouponResponse(Coupon coupon);

    // Code is normalised by CouponService; counters keep their defaults
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "code", ignore = true)
    @Mapping(target = "redemptionCount", ignore = true)
    @Mapping(target = "active", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "version", ignore = true)
    Coupon toCoupon(CouponRequest request);
}
