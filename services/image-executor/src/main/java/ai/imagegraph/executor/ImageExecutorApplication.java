package ai.imagegraph.executor;

import ai.imagegraph.executor.config.BackendClientProperties;
import ai.imagegraph.executor.config.OutputProperties;
import ai.imagegraph.executor.config.WorkflowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application for the image executor.
 */
@SpringBootApplication(scanBasePackages = "ai.imagegraph.executor")
@EnableConfigurationProperties({BackendClientProperties.class, WorkflowProperties.class, OutputProperties.class})
public class ImageExecutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageExecutorApplication.class, args);
    }
}
