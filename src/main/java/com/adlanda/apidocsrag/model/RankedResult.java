package com.adlanda.apidocsrag.model;

import java.util.Set;

/**
 * A scored match produced by ranking one query.
 *
 * @param recordIndex  Position of the matched record in the corpus that was ranked
 * @param score        Final score including bonuses, always positive
 * @param matchedTerms Distinct query terms found in the record
 */
public record RankedResult(int recordIndex, double score, Set<String> matchedTerms) {

    public RankedResult {
        matchedTerms = Set.copyOf(matchedTerms);
    }
}
