package com.dedupstore.api.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Kept off the application class so web slice tests start without JPA.
 */
@Configuration
@EntityScan("com.dedupstore.data.entity")
@EnableJpaRepositories("com.dedupstore.data.repository")
@EnableScheduling
public class PersistenceConfig {
}
