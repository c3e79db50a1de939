package com.demo.trends.service;

import com.demo.trends.service.dto.CuratedTrend;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Hand-picked style categories for demos and keyword-less combined requests. */
@Component
public class CuratedTrendsCatalog {

    private static final List<CuratedTrend> TRENDS = List.of(
            new CuratedTrend("linen", 0.92, "Rising in searches across Europe; summer staple"),
            new CuratedTrend("oversized-blazer", 0.79, "High engagement on social platforms"),
            new CuratedTrend("pastel-denim", 0.66, "Niche but rapidly growing"),
            new CuratedTrend("sustainable-fabrics", 0.87, "Brands pushing eco-friendly collections"),
            new CuratedTrend("athleisure", 0.58, "Stable interest; high conversion rates")
    );

    public List<CuratedTrend> trends() {
        return TRENDS;
    }

    public Map<String, Double> scores() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (CuratedTrend t : TRENDS) out.put(t.category(), t.score());
        return out;
    }
}
