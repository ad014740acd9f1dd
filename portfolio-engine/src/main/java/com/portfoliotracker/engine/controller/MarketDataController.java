package com.portfoliotracker.engine.controller;

import com.portfoliotracker.engine.controller.dto.PriceUploadRequest;
import com.portfoliotracker.engine.service.MarketDataService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for recording daily price and FX history.
 */
@RestController
@RequestMapping("/prices")
@RequiredArgsConstructor
@Slf4j
public class MarketDataController {

    private final MarketDataService marketDataService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> storePrices(@Valid @RequestBody PriceUploadRequest request) {

        log.info("POST /prices - Symbol: {}, Bars: {}", request.getSymbol(), request.getBars().size());

        int stored = marketDataService.savePrices(request.toPriceBars());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("symbol", request.getSymbol().trim().toUpperCase(), "stored", stored));
    }
}
