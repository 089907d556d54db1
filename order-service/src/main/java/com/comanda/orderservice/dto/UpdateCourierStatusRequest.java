package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.CourierStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdateCourierStatusRequest {
  @NotNull(message = "Status is required")
  private CourierStatus status;
}
