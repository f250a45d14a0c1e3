package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.model.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns text into comparable terms.
 *
 * {@link #normalize(String)} is the only tokenizer in the application: the indexer
 * calls it on endpoint fields and {@link #analyze(String)} calls it on queries.
 * No stemming is applied, terms only match when their normalized forms are equal.
 */
@Service
public class QueryAnalyzer {

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "be", "can", "do", "does", "for", "how", "i", "in",
            "is", "it", "me", "my", "of", "on", "or", "the", "to", "what", "which", "with"
    );

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private static final int MIN_TOKEN_LENGTH = 2;

    /**
     * Analyzes a raw query. A query without usable terms yields an empty {@link Query}.
     */
    public Query analyze(String rawQuery) {
        return new Query(rawQuery, normalize(rawQuery));
    }

    /**
     * Lower-cases, splits on non-alphanumeric characters and drops short tokens and stop words.
     *
     * @return terms in text order, duplicates retained
     */
    public List<String> normalize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String token : NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }
}
