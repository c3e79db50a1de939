package com.demo.trends.controller;

import com.demo.trends.controller.dto.TrendDtos.CuratedItem;
import com.demo.trends.controller.dto.TrendDtos.MockTrendsResponse;
import com.demo.trends.controller.dto.TrendDtos.TrendsResponse;
import com.demo.trends.service.CuratedTrendsCatalog;
import com.demo.trends.service.InvalidRequestException;
import com.demo.trends.service.TrendService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TrendController {

    private final TrendService trends;
    private final CuratedTrendsCatalog curated;

    /** Normalized interest per keyword; never fails because of the provider. */
    @GetMapping("/trends")
    public TrendsResponse trends(@RequestParam String keywords,
                                 @RequestParam(required = false) String timeframe) {
        List<String> kws = TrendService.parseKeywords(keywords);
        if (kws.isEmpty()) {
            throw new InvalidRequestException("no valid keywords provided");
        }
        return TrendsResponse.from(trends.trends(kws, timeframe));
    }

    @GetMapping("/mock-trends")
    public MockTrendsResponse mockTrends() {
        MockTrendsResponse res = new MockTrendsResponse();
        res.generatedAt = Instant.now();
        res.trends = curated.trends().stream().map(CuratedItem::from).collect(Collectors.toList());
        return res;
    }
}
