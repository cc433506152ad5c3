package com.adlanda.docretrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Document Retrieval - Main Application
 *
 * Splits uploaded documents into token windows, embeds them and answers
 * nearest-neighbour queries from an in-memory index.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI
 * - JTokkit for token counting
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class DocRetrievalApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocRetrievalApplication.class, args);
    }
}
