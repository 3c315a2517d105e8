package org.rostilos.prwizard.pipelineagent.generic.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfiguration {

    @Bean("reviewRestTemplate")
    public RestTemplate reviewRestTemplate(
            RestTemplateBuilder builder,
            @Value("${prwizard.review-backend.timeout-seconds:30}") int timeoutSeconds
    ) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
