package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.CorpusProperties;
import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.exception.AnswerGenerationException;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.Query;
import com.adlanda.apidocsrag.model.QueryResponse;
import com.adlanda.apidocsrag.model.QueryResult;
import com.adlanda.apidocsrag.model.RankedResult;
import com.adlanda.apidocsrag.model.RetrievalResponse;
import com.adlanda.apidocsrag.model.RetrieveResponse;
import com.adlanda.apidocsrag.repository.EndpointIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Service responsible for answering questions from the endpoint index.
 *
 * Orchestrates the query flow:
 * 1. Analyze the question into terms
 * 2. Rank endpoints of the current index
 * 3. Assemble the bounded context
 * 4. Optionally generate an answer, degrading to retrieval-only on failure
 *
 * Each request reads the published index once, so a concurrent reload never
 * mixes two indexes within one response.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    static final String NO_CONTEXT_ANSWER = "I couldn't find any relevant information in the API documentation "
            + "for your query. Please try asking about specific API endpoints, for example creating, "
            + "updating or listing resources.";

    static final String GENERATION_FAILED_PREFIX =
            "I found some relevant information but encountered an error processing it. Here's what I found:\n\n";

    static final String GENERATION_DISABLED_PREFIX =
            "Answer generation is not configured. Here's what I found:\n\n";

    private final EndpointIndexStore indexStore;
    private final QueryAnalyzer analyzer;
    private final EndpointRanker ranker;
    private final ContextAssembler assembler;
    private final ConfidenceCalculator confidenceCalculator;
    private final AnswerService answerService;
    private final RetrievalProperties retrievalProperties;
    private final CorpusProperties corpusProperties;

    public RetrievalService(EndpointIndexStore indexStore,
                            QueryAnalyzer analyzer,
                            EndpointRanker ranker,
                            ContextAssembler assembler,
                            ConfidenceCalculator confidenceCalculator,
                            AnswerService answerService,
                            RetrievalProperties retrievalProperties,
                            CorpusProperties corpusProperties) {
        this.indexStore = indexStore;
        this.analyzer = analyzer;
        this.ranker = ranker;
        this.assembler = assembler;
        this.confidenceCalculator = confidenceCalculator;
        this.answerService = answerService;
        this.retrievalProperties = retrievalProperties;
        this.corpusProperties = corpusProperties;
    }

    /**
     * Runs retrieval against the currently published index.
     */
    public Retrieval retrieve(String question, int maxResults) {
        return retrieve(indexStore.current(), question, maxResults);
    }

    /**
     * Runs retrieval against a specific index snapshot.
     *
     * @param index      The index to rank
     * @param question   The raw question
     * @param maxResults Maximum number of ranked results; non-positive values use the configured default
     */
    public Retrieval retrieve(EndpointIndex index, String question, int maxResults) {
        int k = maxResults > 0 ? maxResults : retrievalProperties.getDefaultMaxResults();
        Query query = analyzer.analyze(question);
        List<RankedResult> ranked = ranker.rank(index, query, k);
        RetrievalResponse response = assembler.assemble(index.corpus(), ranked);
        return new Retrieval(index, query, response);
    }

    /**
     * Retrieval only, with the assembled context in the payload.
     */
    public RetrieveResponse retrieveContext(String question, int maxResults) {
        long startTime = System.currentTimeMillis();
        Retrieval retrieval = retrieve(question, maxResults);
        long queryTimeMs = System.currentTimeMillis() - startTime;

        return new RetrieveResponse(
                retrieval.results(),
                retrieval.response().context(),
                retrieval.index().size(),
                retrieval.response().contextRecords(),
                queryTimeMs
        );
    }

    /**
     * Answers a question: retrieval, confidence, and answer generation when requested.
     *
     * @param question       The question to answer
     * @param maxResults     Maximum number of endpoints to return
     * @param generateAnswer Whether to forward the context to the chat model
     * @return QueryResponse with the answer, matched endpoints and metadata
     */
    public QueryResponse query(String question, int maxResults, boolean generateAnswer) {
        long startTime = System.currentTimeMillis();

        Retrieval retrieval = retrieve(question, maxResults);
        RetrievalResponse response = retrieval.response();
        double confidence = confidenceCalculator.calculate(question, response);

        String answer;
        boolean generated = false;
        if (!response.hasContext()) {
            answer = NO_CONTEXT_ANSWER;
        } else if (!generateAnswer || !answerService.isAvailable()) {
            answer = GENERATION_DISABLED_PREFIX + response.context();
        } else {
            try {
                answer = answerService.generate(question, response.context());
                generated = true;
            } catch (AnswerGenerationException e) {
                log.warn("Answer generation failed, returning retrieval-only response: {}", e.getMessage());
                answer = GENERATION_FAILED_PREFIX + response.context();
            }
        }

        long queryTimeMs = System.currentTimeMillis() - startTime;
        log.debug("Query '{}' matched {} endpoints ({} in context, top score {}) in {}ms",
                truncate(question, 50), response.results().size(), response.contextRecords(),
                response.hasResults() ? String.format(Locale.ROOT, "%.2f", response.results().get(0).score()) : "n/a",
                queryTimeMs);

        return new QueryResponse(
                answer,
                retrieval.results(),
                List.of(corpusProperties.getSourceName()),
                confidence,
                explain(retrieval, confidence),
                generated,
                retrieval.index().size(),
                response.contextRecords(),
                queryTimeMs
        );
    }

    String explain(Retrieval retrieval, double confidence) {
        List<RankedResult> results = retrieval.response().results();
        StringBuilder explanation = new StringBuilder()
                .append("Found ").append(results.size()).append(" relevant endpoints. ");
        if (!results.isEmpty()) {
            RankedResult best = results.get(0);
            explanation.append("Best match: '")
                    .append(retrieval.index().corpus().get(best.recordIndex()).label())
                    .append("' with score ")
                    .append(String.format(Locale.ROOT, "%.2f", best.score()))
                    .append(". ");
        }
        explanation.append("Overall confidence: ").append(String.format(Locale.ROOT, "%.2f", confidence));
        return explanation.toString();
    }

    private String truncate(String s, int maxLen) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }

    /**
     * A retrieval outcome bound to the index snapshot it was computed from.
     */
    public record Retrieval(EndpointIndex index, Query query, RetrievalResponse response) {

        /**
         * Maps ranked results to web payload rows using the snapshot's corpus.
         */
        public List<QueryResult> results() {
            Corpus corpus = index.corpus();
            return response.results().stream()
                    .map(ranked -> QueryResult.from(corpus.get(ranked.recordIndex()), ranked))
                    .toList();
        }
    }
}
