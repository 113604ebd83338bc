package com.compass.evidencecollector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app.collection" prefix to a strongly-typed
 * configuration object. This provides centralized control over the automated evidence
 * collection pipeline: role assumption, rule evaluation, queue consumption and scheduling.
 */
@Data
@ConfigurationProperties(prefix = "app.collection")
public class EvidenceCollectionProperties {

    private Role role = new Role();
    private Evaluation evaluation = new Evaluation();
    private Queue queue = new Queue();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Role {
        /**
         * The role that must exist in every monitored account and trust this service.
         */
        private String name = "compass-aws-config-job";
        private String sessionName = "CompassAWSConfigJob";
        private Duration timeout = Duration.ofSeconds(10);
        private Duration sessionDuration = Duration.ofMinutes(15);
    }

    @Data
    public static class Evaluation {
        private String defaultRegion = "ca-central-1";
        /**
         * Aggregate budget for listing and describing rules, across all pages.
         */
        private Duration timeout = Duration.ofSeconds(30);
        private int describeBatchSize = 25;
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class RetryConfig {
        private int attempts = 3;
        private long initialDelayMs = 200;
        private double multiplier = 2.0;
        private long maxDelayMs = 2000;
    }

    @Data
    public static class Queue {
        private String name;
        private String deadLetterName;
        private int maxMessagesPerPoll = 10;
        private int maxConcurrentMessages = 10;
        private Duration pollTimeout = Duration.ofSeconds(20);
        /**
         * Upper bound a batch waits for any single message; should stay below the queue visibility timeout.
         */
        private Duration workerTimeout = Duration.ofSeconds(60);
        private String executorId = "evidence-collector";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String cron = "0 0 3 * * *";
        private String deadLetterMonitorCron = "0 */15 * * * *";
    }
}
