package com.adlanda.channelknowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Channel Knowledge Pipeline - Main Application
 *
 * Harvests posts from monitored channels, keeps the ones that score above the
 * ingestion threshold, and serves them together with curated documents as a
 * freshness-aware vector knowledge base.
 *
 * This application uses:
 * - Spring Boot 3.4 on Java 17
 * - Spring AI for embedding generation via OpenAI
 * - PostgreSQL with pgvector for vector storage and similarity search
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class ChannelKnowledgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChannelKnowledgeApplication.class, args);
    }
}
