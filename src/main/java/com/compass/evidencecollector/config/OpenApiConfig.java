package com.compass.evidencecollector.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Evidence Collector API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Triggers and inspects automated evidence collection jobs.
                                
                                A job evaluates one evidence record's job template against one target AWS account:
                                * **Enqueue:** Creates a job record and publishes it to the job queue.
                                * **Status:** Returns the job's lifecycle state, failing step and aggregate compliance result.
                                * **Retry:** Re-enqueues a failed job under the same job id.
                                """));
    }
}
