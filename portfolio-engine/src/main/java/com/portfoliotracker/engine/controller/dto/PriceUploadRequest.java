package com.portfoliotracker.engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.portfoliotracker.engine.domain.PriceBar;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Request DTO for storing daily bars of one symbol or FX pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceUploadRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotEmpty(message = "At least one bar is required")
    @Valid
    private List<Bar> bars;

    public List<PriceBar> toPriceBars() {
        String normalized = symbol.trim().toUpperCase();
        return bars.stream()
                .map(bar -> PriceBar.builder()
                        .symbol(normalized)
                        .date(bar.getDate())
                        .open(bar.getOpen() != null ? bar.getOpen() : bar.getClose())
                        .high(bar.getHigh() != null ? bar.getHigh() : bar.getClose())
                        .low(bar.getLow() != null ? bar.getLow() : bar.getClose())
                        .close(bar.getClose())
                        .volume(bar.getVolume() != null ? bar.getVolume() : 0.0)
                        .build())
                .collect(Collectors.toList());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Bar {

        @NotNull(message = "Date is required")
        @JsonFormat(pattern = "yyyy-MM-dd")
        private LocalDate date;

        private Double open;
        private Double high;
        private Double low;

        @NotNull(message = "Close is required")
        @Positive(message = "Close must be positive")
        private Double close;

        private Double volume;
    }
}
