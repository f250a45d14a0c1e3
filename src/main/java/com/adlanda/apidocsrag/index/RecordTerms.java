package com.adlanda.apidocsrag.index;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Term frequencies of a single record, kept separately per field.
 *
 * @param fields     Term to frequency, per field
 * @param pathPhrase Normalized path tokens joined by single spaces
 */
public record RecordTerms(Map<IndexField, Map<String, Integer>> fields, String pathPhrase) {

    public RecordTerms {
        EnumMap<IndexField, Map<String, Integer>> copy = new EnumMap<>(IndexField.class);
        fields.forEach((field, counts) -> copy.put(field, Map.copyOf(counts)));
        fields = Collections.unmodifiableMap(copy);
    }

    public int frequency(IndexField field, String term) {
        Map<String, Integer> counts = fields.get(field);
        return counts == null ? 0 : counts.getOrDefault(term, 0);
    }
}
