package com.compass.evidencecollector;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Evidence Collector Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.collection" properties to
 *     {@link EvidenceCollectionProperties}.</li>
 *     <li>{@link EnableScheduling}: Activates the scheduled collection and dead-letter monitoring tasks.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for the job and evidence repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.compass.evidencecollector.repository")
@EnableConfigurationProperties(value = EvidenceCollectionProperties.class)
public class EvidenceCollectorApplication {

    public static void main(final String[] args) {
        log.info("Starting EvidenceCollectorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(EvidenceCollectorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "EvidenceCollector"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Job queue:  {}", env.getProperty("app.collection.queue.name", "<not configured>"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
