package com.demo.trends.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/** Trend-aware mock product feed for voice-agent and UI demos. */
@Service
@RequiredArgsConstructor
public class DemoRecommendationService {

    public static final int MAX_LIMIT = 50;
    private static final String[] SIZES = {"S", "M", "L"};

    private final MockTrendGenerator mockGenerator;
    private final CuratedTrendsCatalog curated;

    public List<DemoProduct> recommend(List<String> keywords, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        Map<String, Double> trends = (keywords == null || keywords.isEmpty())
                ? curated.scores()
                : mockGenerator.mockScores(keywords);
        List<String> cats = new ArrayList<>(trends.keySet());

        Random rng = new Random(seedOf(cats));
        List<DemoProduct> out = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            String cat = cats.get(rng.nextInt(cats.size()));
            double trend = trends.get(cat);
            int price = (int) (40 + rng.nextDouble() * 120);
            int sizeConf = (int) (70 + rng.nextDouble() * 30);
            double risk = ScoreNormalizer.round(Math.max(0.02, 1.0 - trend - rng.nextDouble() * 0.2), 2);
            // outside the seeded sequence
            String size = SIZES[ThreadLocalRandom.current().nextInt(SIZES.length)];
            out.add(new DemoProduct(
                    "demo-" + cat + "-" + i,
                    titleOf(cat) + " Sample " + (i + 1),
                    price,
                    size,
                    sizeConf,
                    risk,
                    risk < 0.25 ? "low" : "medium",
                    cat,
                    ScoreNormalizer.round(trend, 3)));
        }
        return out;
    }

    static long seedOf(List<String> categories) {
        long sum = String.join("", categories).codePoints().asLongStream().sum();
        return sum % 97;
    }

    /** "pastel-denim" -> "Pastel Denim", "t-shirt/top" -> "T Shirt/Top": upper-cases every letter that follows a non-letter. */
    static String titleOf(String category) {
        StringBuilder sb = new StringBuilder(category.length());
        boolean prevLetter = false;
        for (int cp : category.replace('-', ' ').codePoints().toArray()) {
            boolean letter = Character.isLetter(cp);
            if (letter) {
                sb.appendCodePoint(prevLetter ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
            } else {
                sb.appendCodePoint(cp);
            }
            prevLetter = letter;
        }
        return sb.toString();
    }

    public record DemoProduct(String id, String title, int price, String sizeRecommendation,
                              int sizeConfidence, double returnRiskScore, String returnRiskLabel,
                              String trendCategory, double trendScore) {}
}
