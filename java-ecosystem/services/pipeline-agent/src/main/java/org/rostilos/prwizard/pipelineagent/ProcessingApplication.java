package org.rostilos.prwizard.pipelineagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication(scanBasePackages = {
        "org.rostilos.prwizard.pipelineagent",
        "org.rostilos.prwizard.core.service",
        "org.rostilos.prwizard.vcsclient"
})
@EnableJpaRepositories(basePackages = "org.rostilos.prwizard.core.persistence.repository")
@EntityScan(basePackages = "org.rostilos.prwizard.core.model")
@EnableAsync
public class ProcessingApplication {

    public static void main(String[] args) {

        SpringApplication.run(ProcessingApplication.class, args);
    }
}
