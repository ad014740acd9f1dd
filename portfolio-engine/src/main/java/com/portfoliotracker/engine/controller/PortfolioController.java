package com.portfoliotracker.engine.controller;

import com.portfoliotracker.engine.controller.dto.CorporateActionRequest;
import com.portfoliotracker.engine.controller.dto.ErrorResponse;
import com.portfoliotracker.engine.domain.*;
import com.portfoliotracker.engine.domain.scoring.RiskReport;
import com.portfoliotracker.engine.service.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller exposing holdings, valuation and analytics computed from the ledger.
 * Calculations that lack data answer 422 with an error reason.
 */
@RestController
@RequestMapping("/portfolio")
@RequiredArgsConstructor
@Slf4j
public class PortfolioController {

    private final PortfolioValuationService valuationService;
    private final PositionService positionService;
    private final RiskAnalysisService riskAnalysisService;
    private final SectorAnalysisService sectorAnalysisService;
    private final DashboardMetricsService dashboardMetricsService;
    private final CorporateActionService corporateActionService;
    private final MarketAnalysisService marketAnalysisService;

    @GetMapping("/holdings")
    public ResponseEntity<HoldingSnapshot> getHoldings(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        log.info("GET /portfolio/holdings - asOf: {}", asOf);

        return ResponseEntity.ok(valuationService.holdings(asOf));
    }

    @GetMapping("/positions")
    public ResponseEntity<PortfolioSummary> getPositions() {

        log.info("GET /portfolio/positions");

        return ResponseEntity.ok(positionService.portfolioSummary());
    }

    @GetMapping("/positions/{symbol}/cost-basis")
    public ResponseEntity<CostBasis> getCostBasis(@PathVariable String symbol) {

        log.info("GET /portfolio/positions/{}/cost-basis", symbol);

        return ResponseEntity.ok(positionService.currentCostBasis(symbol.toUpperCase()));
    }

    @GetMapping("/positions/{symbol}/performance")
    public ResponseEntity<?> getPerformance(
            @PathVariable String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("GET /portfolio/positions/{}/performance - {} to {}", symbol, startDate, endDate);

        return respond(valuationService.performanceVersusCost(symbol.toUpperCase(), startDate, endDate));
    }

    /**
     * Daily valuation curve. Both dates are optional.
     */
    @GetMapping("/timeline")
    public ResponseEntity<List<ValuationPoint>> getTimeline(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("GET /portfolio/timeline - {} to {}", startDate, endDate);

        return ResponseEntity.ok(valuationService.timeline(startDate, endDate));
    }

    @GetMapping("/risk")
    public ResponseEntity<?> getRisk(@RequestParam(defaultValue = "1y") String period) {

        log.info("GET /portfolio/risk - period: {}", period);

        CalculationResult<RiskReport> result = riskAnalysisService.analyze(AnalysisPeriod.fromCode(period));
        return respond(result);
    }

    @GetMapping("/sectors")
    public ResponseEntity<?> getSectors() {

        log.info("GET /portfolio/sectors");

        return respond(sectorAnalysisService.analyze());
    }

    @GetMapping("/dashboard")
    public ResponseEntity<?> getDashboard() {

        log.info("GET /portfolio/dashboard");

        return respond(dashboardMetricsService.dashboard());
    }

    /**
     * Split-adjusted price chart with moving averages and rolling volatility.
     */
    @GetMapping("/charts/{symbol}")
    public ResponseEntity<?> getChart(@PathVariable String symbol,
                                      @RequestParam(defaultValue = "1y") String period) {

        log.info("GET /portfolio/charts/{} - period: {}", symbol, period);

        return respond(marketAnalysisService.chart(symbol.toUpperCase(), AnalysisPeriod.fromCode(period)));
    }

    @GetMapping("/market-comparison/{symbol}")
    public ResponseEntity<?> getMarketComparison(@PathVariable String symbol,
                                                 @RequestParam(defaultValue = "1y") String period) {

        log.info("GET /portfolio/market-comparison/{} - period: {}", symbol, period);

        return respond(marketAnalysisService.compareWithIndices(symbol.toUpperCase(), AnalysisPeriod.fromCode(period)));
    }

    /**
     * Apply a declared dividend or bonus issue to the ledger.
     *
     * @return the created transaction, or 404 when no shares were held before the event
     */
    @PostMapping("/events")
    public ResponseEntity<?> applyEvent(@Valid @RequestBody CorporateActionRequest request) {

        log.info("POST /portfolio/events - {} {} on {} ({}%)",
                request.getType(), request.getSymbol(), request.getDate(), request.getPercentage());

        CalculationResult<Transaction> result = corporateActionService.applyEvent(
                request.getType(), request.getSymbol(), request.getDate(), request.getPercentage());

        if (!result.isOk()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(result.getError()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result.getValue());
    }

    private static ResponseEntity<?> respond(CalculationResult<?> result) {
        if (!result.isOk()) {
            return ResponseEntity.unprocessableEntity().body(ErrorResponse.of(result.getError()));
        }
        return ResponseEntity.ok(result.getValue());
    }
}
