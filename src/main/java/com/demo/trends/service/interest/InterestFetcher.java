package com.demo.trends.service.interest;

import com.demo.trends.service.ScoreNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batched interest fetch with whole-set normalization.
 * All-or-nothing: a failing batch discards every score gathered so far.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterestFetcher {

    private final InterestProvider provider;

    public boolean isAvailable() {
        return provider.isAvailable();
    }

    public TrendFetch fetch(List<String> keywords, String timeframe) {
        try {
            return new TrendFetch.Fetched(fetchInterest(keywords, timeframe));
        } catch (InterestFetchException e) {
            return new TrendFetch.FetchFailed(e);
        }
    }

    public Map<String, Double> fetchInterest(List<String> keywords, String timeframe) {
        Map<String, Double> raw = new LinkedHashMap<>();
        if (keywords == null || keywords.isEmpty()) return raw;

        int batchNo = 0;
        for (int i = 0; i < keywords.size(); i += InterestProvider.MAX_KEYWORDS) {
            List<String> batch = keywords.subList(i, Math.min(i + InterestProvider.MAX_KEYWORDS, keywords.size()));
            InterestSeries series;
            try {
                series = provider.interestOverTime(new ArrayList<>(batch), timeframe);
            } catch (Exception e) {
                log.warn("Interest provider {} failed on batch {}: {}", provider.name(), batchNo, e.toString());
                throw new InterestFetchException(batchNo, batch, e);
            }
            boolean empty = (series == null || series.isEmpty());
            for (String k : batch) {
                raw.put(k, empty ? 0.0 : series.mean(k));
            }
            batchNo++;
        }

        List<Double> normed = ScoreNormalizer.normalize(new ArrayList<>(raw.values()));
        Map<String, Double> out = new LinkedHashMap<>();
        int j = 0;
        for (String k : raw.keySet()) {
            out.put(k, ScoreNormalizer.round(normed.get(j++), 4));
        }
        log.debug("Fetched interest for {} keywords in {} batches", out.size(), batchNo);
        return out;
    }
}
