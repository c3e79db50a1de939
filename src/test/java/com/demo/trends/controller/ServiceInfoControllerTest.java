package com.demo.trends.controller;

import com.demo.trends.service.clustering.ClusterSummarizer;
import com.demo.trends.service.interest.InterestFetcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ServiceInfoController.class)
class ServiceInfoControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private InterestFetcher fetcher;

    @MockBean
    private ClusterSummarizer summarizer;

    @Test
    void testHealth() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("trend-service"));
    }

    @Test
    void testInfo_ReportsAvailability() throws Exception {
        when(fetcher.isAvailable()).thenReturn(false);
        when(summarizer.isPipelineAvailable()).thenReturn(true);

        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints[0]").value("/api/trends"))
                .andExpect(jsonPath("$.trend_provider_available").value(false))
                .andExpect(jsonPath("$.cluster_pipeline_available").value(true));
    }
}
