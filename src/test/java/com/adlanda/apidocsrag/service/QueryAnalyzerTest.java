package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.model.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryAnalyzerTest {

    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryAnalyzer();
    }

    @Test
    void analyze_naturalQuestion_dropsStopWordsAndShortTokens() {
        Query query = analyzer.analyze("How do I create a ticket?");

        assertThat(query.terms()).containsExactly("create", "ticket");
        assertThat(query.raw()).isEqualTo("How do I create a ticket?");
    }

    @Test
    void normalize_lowerCasesAndSplitsOnPunctuation() {
        assertThat(analyzer.normalize("GET /Tickets/{ID}")).containsExactly("get", "tickets", "id");
    }

    @Test
    void normalize_splitsUnderscoresAndKeepsDigits() {
        assertThat(analyzer.normalize("per_page on /api/v2")).containsExactly("per", "page", "api", "v2");
    }

    @Test
    void normalize_retainsDuplicatesInOrder() {
        assertThat(analyzer.normalize("ticket status ticket")).containsExactly("ticket", "status", "ticket");
    }

    @Test
    void normalize_dropsSingleCharacterTokens() {
        assertThat(analyzer.normalize("x y zz")).containsExactly("zz");
    }

    @Test
    void normalize_nullOrEmpty_returnsNoTerms() {
        assertThat(analyzer.normalize(null)).isEmpty();
        assertThat(analyzer.normalize("")).isEmpty();
        assertThat(analyzer.normalize("   ?! ")).isEmpty();
    }

    @Test
    void analyze_onlyStopWords_returnsEmptyQuery() {
        Query query = analyzer.analyze("how is it the");

        assertThat(query.isEmpty()).isTrue();
        assertThat(query.phrase()).isEmpty();
    }

    @Test
    void query_distinctTerms_keepFirstOccurrenceOrder() {
        Query query = analyzer.analyze("update ticket update status");

        assertThat(query.terms()).hasSize(4);
        assertThat(query.distinctTerms()).containsExactly("update", "ticket", "status");
        assertThat(query.phrase()).isEqualTo("update ticket update status");
    }
}
