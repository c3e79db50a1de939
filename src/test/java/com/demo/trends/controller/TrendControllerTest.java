package com.demo.trends.controller;

import com.demo.trends.service.CuratedTrendsCatalog;
import com.demo.trends.service.TrendService;
import com.demo.trends.service.dto.CuratedTrend;
import com.demo.trends.service.dto.TrendScores;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrendController.class)
@DisplayName("TrendController")
class TrendControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TrendService trendService;

    @MockBean
    private CuratedTrendsCatalog curated;

    @Test
    @DisplayName("Returns tagged scores for parsed keywords")
    void testTrends_Ok() throws Exception {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("linen", 1.0);
        scores.put("denim", 0.0);
        when(trendService.trends(List.of("linen", "denim"), null)).thenReturn(TrendScores.mock(scores));

        mvc.perform(get("/api/trends").param("keywords", " linen,denim ,linen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("mock"))
                .andExpect(jsonPath("$.scores.linen").value(1.0))
                .andExpect(jsonPath("$.scores.denim").value(0.0))
                .andExpect(jsonPath("$.timeframe").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("Fallback response carries the provider error")
    void testTrends_Fallback() throws Exception {
        when(trendService.trends(List.of("linen"), "today 3-m"))
                .thenReturn(TrendScores.fallback(Map.of("linen", 0.0), "interest fetch failed for batch 0"));

        mvc.perform(get("/api/trends").param("keywords", "linen").param("timeframe", "today 3-m"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("fallback_provider_error"))
                .andExpect(jsonPath("$.error").value("interest fetch failed for batch 0"));
    }

    @Test
    @DisplayName("Missing keywords is a 400 with the standard error body")
    void testTrends_Missing() throws Exception {
        mvc.perform(get("/api/trends"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.path").value("/api/trends"))
                .andExpect(jsonPath("$.timestamp").exists());
        verify(trendService, never()).trends(any(), any());
    }

    @Test
    @DisplayName("Keywords that are all blank are a 400")
    void testTrends_Blank() throws Exception {
        mvc.perform(get("/api/trends").param("keywords", " , ,"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("no valid keywords provided"));
    }

    @Test
    @DisplayName("Mock trends lists the curated catalog")
    void testMockTrends() throws Exception {
        when(curated.trends()).thenReturn(List.of(new CuratedTrend("linen", 0.92, "summer staple")));

        mvc.perform(get("/api/mock-trends"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generated_at").exists())
                .andExpect(jsonPath("$.trends[0].category").value("linen"))
                .andExpect(jsonPath("$.trends[0].score").value(0.92))
                .andExpect(jsonPath("$.trends[0].note").value("summer staple"));
    }
}
