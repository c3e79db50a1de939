package com.demo.trends.service;

import com.demo.trends.service.DemoRecommendationService.DemoProduct;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DemoRecommendationService")
class DemoRecommendationServiceTest {

    private DemoRecommendationService service;

    @BeforeEach
    void setUp() {
        service = new DemoRecommendationService(new MockTrendGenerator(), new CuratedTrendsCatalog());
    }

    @Test
    @DisplayName("Same keywords give the same products apart from the size pick")
    void testRecommend_Deterministic() {
        List<DemoProduct> a = service.recommend(List.of("linen", "denim", "wool"), 6);
        List<DemoProduct> b = service.recommend(List.of("linen", "denim", "wool"), 6);

        assertEquals(6, a.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).id(), b.get(i).id());
            assertEquals(a.get(i).price(), b.get(i).price());
            assertEquals(a.get(i).returnRiskScore(), b.get(i).returnRiskScore());
        }
    }

    @Test
    @DisplayName("Products stay within their documented ranges")
    void testRecommend_Ranges() {
        for (DemoProduct p : service.recommend(null, DemoRecommendationService.MAX_LIMIT)) {
            assertTrue(p.price() >= 40 && p.price() < 160);
            assertTrue(p.sizeConfidence() >= 70 && p.sizeConfidence() < 100);
            assertTrue(p.returnRiskScore() >= 0.02 && p.returnRiskScore() <= 1.0);
            assertEquals(p.returnRiskScore() < 0.25 ? "low" : "medium", p.returnRiskLabel());
            assertTrue(Set.of("S", "M", "L").contains(p.sizeRecommendation()));
            assertTrue(Set.of("linen", "oversized-blazer", "pastel-denim", "sustainable-fabrics", "athleisure")
                    .contains(p.trendCategory()));
            assertTrue(p.id().startsWith("demo-" + p.trendCategory() + "-"));
        }
    }

    @Test
    @DisplayName("Limit outside [1,50] is rejected")
    void testRecommend_Limit() {
        assertThrows(InvalidRequestException.class, () -> service.recommend(List.of("linen"), 0));
        assertThrows(InvalidRequestException.class, () -> service.recommend(List.of("linen"), 51));
    }

    @Test
    void testSeedAndTitle() {
        assertEquals(49L, DemoRecommendationService.seedOf(List.of("linen")));
        assertEquals("Pastel Denim", DemoRecommendationService.titleOf("pastel-denim"));
        assertEquals("Linen", DemoRecommendationService.titleOf("linen"));
    }

    @Test
    @DisplayName("Every word after a separator is capitalized, code point by code point")
    void testTitle_Separators() {
        assertEquals("T Shirt/Top", DemoRecommendationService.titleOf("t-shirt/top"));
        assertEquals("Ankle Boot", DemoRecommendationService.titleOf("ANKLE-boot"));
        // Deseret small long I (U+10428) is a surrogate pair; its capital is U+10400
        assertEquals("\uD801\uDC00x", DemoRecommendationService.titleOf("\uD801\uDC28x"));
    }
}
