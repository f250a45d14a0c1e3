package com.adlanda.apidocsrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * API Docs RAG - Main Application
 *
 * Answers natural-language questions about a REST API's documentation by ranking
 * the documented endpoints against the question and, optionally, asking a chat
 * model to compose an answer from the best matches.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - An in-memory lexical index (TF-IDF with field weights) over the scraped endpoint corpus
 * - Spring AI's OpenAI-compatible chat client for answer generation (Groq by default)
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class ApiDocsRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiDocsRagApplication.class, args);
    }
}
