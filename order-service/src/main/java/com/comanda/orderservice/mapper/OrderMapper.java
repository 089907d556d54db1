package com.comanda.orderservice.mapper;

import com.comanda.orderservice.dto.AssignmentResponse;
import com.comanda.orderservice.dto.CompletedOrderRecord;
import com.comanda.orderservice.dto.OrderItemResponse;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.dto.StatusHistoryResponse;
import com.comanda.orderservice.model.CourierAssignment;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderItem;
import com.comanda.orderservice.model.OrderStatusHistory;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);

    List<OrderResponse> toOrderResponses(List<Order> orders);

    OrderItemResponse toOrderItemResponse(OrderItem item);

    StatusHistoryResponse toStatusHistoryResponse(OrderStatusHistory history);

    List<StatusHistoryResponse> toStatusHistoryResponses(List<OrderStatusHistory> history);

    @Mapping(target = "orderId", source = "id")
    CompletedOrderRecord toCompletedOrderRecord(Order order);

    List<CompletedOrderRecord> toCompletedOrderRecords(List<Order> orders);

    @Mapping(target = "open", expression = "java(assignment.isOpen())")
    AssignmentResponse toAssignmentResponse(CourierAssignment assignment);

    List<AssignmentResponse> toAssignmentResponses(List<CourierAssignment> assignments);
}
