package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.index.FieldWeights;
import com.adlanda.apidocsrag.index.IndexField;
import com.adlanda.apidocsrag.index.RecordTerms;
import com.adlanda.apidocsrag.model.Query;
import com.adlanda.apidocsrag.model.RankedResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores index records against an analyzed query.
 *
 * Base score of a record is the sum over query terms (duplicates included) and fields of
 * {@code fieldWeight * termFrequency * idf(term)}. Records with a positive base score may
 * then receive a path-match bonus and a full-coverage bonus. Results are ordered by
 * descending score; equal scores keep corpus order.
 */
@Service
public class EndpointRanker {

    private static final Comparator<RankedResult> BY_SCORE_THEN_CORPUS_ORDER =
            Comparator.comparingDouble(RankedResult::score).reversed()
                    .thenComparingInt(RankedResult::recordIndex);

    private final RetrievalProperties properties;

    public EndpointRanker(RetrievalProperties properties) {
        this.properties = properties;
    }

    /**
     * Ranks all records of {@code index} against {@code query}.
     *
     * @param index The index to score
     * @param query The analyzed query
     * @param k     Maximum number of results; values below 1 are treated as 1
     * @return At most {@code k} results with a positive score, best first
     */
    public List<RankedResult> rank(EndpointIndex index, Query query, int k) {
        if (query.isEmpty() || index.size() == 0) {
            return List.of();
        }
        int limit = Math.max(1, k);
        Set<String> distinctTerms = query.distinctTerms();
        String queryPhrase = " " + query.phrase() + " ";

        List<RankedResult> scored = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            RankedResult result = score(index, i, query, distinctTerms, queryPhrase);
            if (result != null) {
                scored.add(result);
            }
        }

        scored.sort(BY_SCORE_THEN_CORPUS_ORDER);
        return scored.size() <= limit ? List.copyOf(scored) : List.copyOf(scored.subList(0, limit));
    }

    /**
     * Scores a single record, or returns null when it shares no term with the query.
     */
    RankedResult score(EndpointIndex index, int recordIndex, Query query,
                       Set<String> distinctTerms, String queryPhrase) {
        RecordTerms terms = index.terms(recordIndex);
        FieldWeights weights = index.weights();
        Set<String> matched = new LinkedHashSet<>();
        double score = 0.0;

        for (String term : query.terms()) {
            double idf = index.inverseDocumentFrequency(term);
            if (idf == 0.0) {
                continue;
            }
            for (IndexField field : IndexField.values()) {
                int tf = terms.frequency(field, term);
                double weight = weights.weight(field);
                // a field weighted 0 contributes neither score nor a match
                if (tf > 0 && weight > 0.0) {
                    score += weight * tf * idf;
                    matched.add(term);
                }
            }
        }

        if (score <= 0.0) {
            return null;
        }
        if ((" " + terms.pathPhrase() + " ").contains(queryPhrase)) {
            score += properties.getPathMatchBonus();
        }
        if (matched.size() == distinctTerms.size()) {
            score += properties.getFullCoverageBonus();
        }
        return new RankedResult(recordIndex, score, matched);
    }
}
