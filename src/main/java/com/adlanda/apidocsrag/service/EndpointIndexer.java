package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.index.FieldWeights;
import com.adlanda.apidocsrag.index.IndexField;
import com.adlanda.apidocsrag.index.RecordTerms;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.EndpointRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the lexical index for a corpus.
 */
@Service
public class EndpointIndexer {

    private static final Logger log = LoggerFactory.getLogger(EndpointIndexer.class);

    private final QueryAnalyzer analyzer;
    private final RetrievalProperties properties;

    public EndpointIndexer(QueryAnalyzer analyzer, RetrievalProperties properties) {
        this.analyzer = analyzer;
        this.properties = properties;
    }

    /**
     * Tokenizes every weighted field of every record and counts document frequencies.
     *
     * @param corpus The corpus to index
     * @return A new immutable index over {@code corpus}
     */
    public EndpointIndex build(Corpus corpus) {
        List<RecordTerms> records = new ArrayList<>(corpus.size());
        Map<String, Integer> documentFrequencies = new HashMap<>();

        for (EndpointRecord record : corpus.endpoints()) {
            Map<IndexField, Map<String, Integer>> fields = new EnumMap<>(IndexField.class);
            Set<String> seenInRecord = new HashSet<>();

            for (IndexField field : IndexField.values()) {
                Map<String, Integer> counts = new HashMap<>();
                for (String term : analyzer.normalize(field.textOf(record))) {
                    counts.merge(term, 1, Integer::sum);
                    seenInRecord.add(term);
                }
                fields.put(field, counts);
            }

            for (String term : seenInRecord) {
                documentFrequencies.merge(term, 1, Integer::sum);
            }
            String pathPhrase = String.join(" ", analyzer.normalize(record.path()));
            records.add(new RecordTerms(fields, pathPhrase));
        }

        EndpointIndex index = EndpointIndex.of(corpus, records, documentFrequencies, FieldWeights.from(properties));
        log.info("Indexed {} endpoints, vocabulary of {} terms", index.size(), index.vocabularySize());
        return index;
    }
}
