package com.comanda.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private int status;
    private String error;
    private String message;
    private String path;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime timestamp;

    // Taxonomy bucket (VALIDATION, STATE_CONFLICT, ...)
    private String category;

    // Precise reason, e.g. EXHAUSTED or INVALID_TRANSITION
    private String errorCode;

    // Correlation ID for tracking requests across services
    private String correlationId;
}
