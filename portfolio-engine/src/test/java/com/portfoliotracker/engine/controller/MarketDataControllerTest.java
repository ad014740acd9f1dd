package com.portfoliotracker.engine.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliotracker.engine.controller.dto.PriceUploadRequest;
import com.portfoliotracker.engine.domain.PriceBar;
import com.portfoliotracker.engine.service.MarketDataService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MarketDataController.class)
class MarketDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private MarketDataService marketDataService;

    @Test
    void testStorePrices_Created() throws Exception {
        // Arrange
        PriceUploadRequest request = new PriceUploadRequest("eurtry=x", List.of(
                PriceUploadRequest.Bar.builder().date(LocalDate.of(2024, 1, 2)).close(32.5).build(),
                PriceUploadRequest.Bar.builder().date(LocalDate.of(2024, 1, 3)).close(32.7).build()));
        when(marketDataService.savePrices(anyList())).thenReturn(2);

        // Act & Assert
        mockMvc.perform(post("/prices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.symbol").value("EURTRY=X"))
                .andExpect(jsonPath("$.stored").value(2));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PriceBar>> captor = ArgumentCaptor.forClass(List.class);
        verify(marketDataService).savePrices(captor.capture());
        assertEquals("EURTRY=X", captor.getValue().get(0).getSymbol());
        assertEquals(32.5, captor.getValue().get(0).getOpen());
    }

    @Test
    void testStorePrices_NonPositiveCloseRejected() throws Exception {
        PriceUploadRequest request = new PriceUploadRequest("THYAO", List.of(
                PriceUploadRequest.Bar.builder().date(LocalDate.of(2024, 1, 2)).close(0.0).build()));

        mockMvc.perform(post("/prices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields['bars[0].close']").value("Close must be positive"));

        verify(marketDataService, never()).savePrices(any());
    }
}
