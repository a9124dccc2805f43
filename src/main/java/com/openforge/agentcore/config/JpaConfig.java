package com.openforge.agentcore.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA auditing so that @CreatedDate on BaseEntity is
 * filled in when history rows are inserted.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
