package com.example.ingestionservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Ingestion Service entry point.
 *
 * Pulls activity records from Jira, Tempo, Fireflies, Notion and Slack,
 * resolves their identity, deduplicates transcripts and upserts embeddings
 * into the vector store. Backfills are checkpointed per (source, batch_id).
 */
@SpringBootApplication
@EnableScheduling
public class IngestionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestionServiceApplication.class, args);
    }
}
