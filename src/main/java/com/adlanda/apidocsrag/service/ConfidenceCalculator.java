package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.model.RetrievalResponse;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic confidence for a retrieval outcome, between 0.1 and 1.0.
 *
 * Combines the top ranking score (60%), how specific the question reads (20%)
 * and how rich the assembled context is (20%).
 */
@Service
public class ConfidenceCalculator {

    static final double MIN_CONFIDENCE = 0.1;
    static final double MAX_CONFIDENCE = 1.0;

    private static final List<String> API_TERMS = List.of(
            "api", "endpoint", "method", "curl", "request", "ticket",
            "create", "get", "list", "update", "delete"
    );

    private final RetrievalProperties properties;

    public ConfidenceCalculator(RetrievalProperties properties) {
        this.properties = properties;
    }

    public double calculate(String rawQuery, RetrievalResponse response) {
        if (!response.hasResults()) {
            return MIN_CONFIDENCE;
        }
        double saturation = properties.getConfidenceSaturation();
        double topScore = response.results().get(0).score();
        double scoreFactor = Math.min(topScore, saturation) / saturation;

        double confidence = scoreFactor * 0.6
                + queryQuality(rawQuery) * 0.2
                + contextRichness(response.hasContext() ? response.context() : "") * 0.2;
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    double queryQuality(String rawQuery) {
        String query = rawQuery == null ? "" : rawQuery.toLowerCase(Locale.ROOT);
        long termCount = API_TERMS.stream().filter(query::contains).count();
        int wordCount = query.isBlank() ? 0 : query.trim().split("\\s+").length;

        double specificity = wordCount >= 4 ? 0.8 : wordCount >= 2 ? 0.5 : 0.2;
        double termScore = Math.min(1.0, (double) termCount / API_TERMS.size());
        return Math.min(1.0, specificity * 0.6 + termScore * 0.4);
    }

    double contextRichness(String context) {
        if (context == null || context.isEmpty()) {
            return 0.0;
        }
        long nonBlankLines = context.lines().filter(line -> !line.isBlank()).count();
        double richness = nonBlankLines >= 10 ? 0.4 : nonBlankLines >= 5 ? 0.2 : 0.1;

        if (context.contains("Parameters:")) {
            richness += 0.3;
        }
        if (context.contains("Example:")) {
            richness += 0.2;
        }
        if (context.split("Endpoint: ", -1).length - 1 > 1) {
            richness += 0.1;
        }
        return Math.min(1.0, richness);
    }
}
