package com.portfoliotracker.engine;

import com.portfoliotracker.engine.infrastructure.InMemoryResultCache;
import com.portfoliotracker.engine.infrastructure.ResultCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application context against H2: record a ledger and prices over HTTP, then read the
 * computed views back.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class PortfolioEngineApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ResultCache resultCache;

    @Test
    void testContextUsesInMemoryCache() {
        assertInstanceOf(InMemoryResultCache.class, resultCache);
    }

    @Test
    void testLedgerToValuationFlow() throws Exception {
        postJson("/transactions", "{\"type\":\"DEPOSIT\",\"quantity\":10000,\"date\":\"2024-01-01\"}");
        postJson("/transactions",
                "{\"type\":\"BUY\",\"symbol\":\"thyao\",\"quantity\":50,\"price\":100,\"date\":\"2024-01-05\"}");
        postJson("/prices", "{\"symbol\":\"THYAO\",\"bars\":["
                + "{\"date\":\"2024-01-05\",\"close\":100},"
                + "{\"date\":\"2024-01-10\",\"close\":120}]}");

        mockMvc.perform(get("/portfolio/holdings").param("asOf", "2024-01-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantities.THYAO").value(50.0))
                .andExpect(jsonPath("$.cashBalance").value(5000.0));

        mockMvc.perform(get("/portfolio/timeline")
                        .param("startDate", "2024-01-01")
                        .param("endDate", "2024-01-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(6))
                .andExpect(jsonPath("$[5].value").value(6000.0));

        // ten days after the last stored close
        mockMvc.perform(get("/portfolio/timeline")
                        .param("startDate", "2024-01-20")
                        .param("endDate", "2024-01-20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].value").value(6000.0));

        mockMvc.perform(get("/portfolio/positions/THYAO/cost-basis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCost").value(5000.0));

        mockMvc.perform(get("/portfolio/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalValue").value(6000.0))
                .andExpect(jsonPath("$.totalProfitLoss").value(1000.0));

        mockMvc.perform(get("/transactions").param("symbol", "THYAO"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].symbol").value("THYAO"))
                .andExpect(jsonPath("$[0].currency").value("TRY"));
    }

    @Test
    void testChartAndMarketComparisonFromStoredPrices() throws Exception {
        LocalDate today = LocalDate.now();
        postJson("/prices", twoBars("THYAO", today, 200, 250));
        postJson("/prices", twoBars("XU100", today, 8000, 8400));

        mockMvc.perform(get("/portfolio/charts/thyao").param("period", "1mo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("THYAO"))
                .andExpect(jsonPath("$.summary.dataPoints").value(2))
                .andExpect(jsonPath("$.summary.periodReturn").value(25.0))
                .andExpect(jsonPath("$.splitInfo.hasSplit").value(false));

        mockMvc.perform(get("/portfolio/market-comparison/thyao").param("period", "1mo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stockData[1].changePct").value(25.0))
                .andExpect(jsonPath("$.indices['BIST 100'][1].changePct").value(5.0))
                .andExpect(jsonPath("$.indices['BIST 30']").doesNotExist());
    }

    @Test
    void testDepositWithSymbolIsRejected() throws Exception {
        mockMvc.perform(post("/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"DEPOSIT\",\"symbol\":\"THYAO\",\"quantity\":100,\"date\":\"2024-01-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DEPOSIT must not carry a symbol"));
    }

    private static String twoBars(String symbol, LocalDate today, double first, double second) {
        return "{\"symbol\":\"" + symbol + "\",\"bars\":["
                + "{\"date\":\"" + today.minusDays(2) + "\",\"close\":" + first + "},"
                + "{\"date\":\"" + today.minusDays(1) + "\",\"close\":" + second + "}]}";
    }

    private void postJson(String path, String body) throws Exception {
        mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
    }
}
