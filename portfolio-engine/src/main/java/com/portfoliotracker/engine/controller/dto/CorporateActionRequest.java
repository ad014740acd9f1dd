package com.portfoliotracker.engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.portfoliotracker.engine.domain.CorporateActionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for a declared dividend or bonus issue, given as a percentage.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CorporateActionRequest {

    @NotNull(message = "Event type is required")
    private CorporateActionType type;

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Event date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    @NotNull(message = "Percentage is required")
    @Positive(message = "Percentage must be positive")
    private Double percentage;
}
