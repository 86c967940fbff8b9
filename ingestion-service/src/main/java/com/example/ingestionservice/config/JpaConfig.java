package com.example.ingestionservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA configuration.
 * 
 * Enables JPA auditing for automatic created_at, updated_at timestamps
 * on checkpoint and sync status rows.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
