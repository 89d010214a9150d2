package ai.imagegraph.executor.config;

import ai.imagegraph.executor.model.Sleeper;
import ai.imagegraph.workflow.parser.ExecutionGraphWriter;
import ai.imagegraph.workflow.parser.WorkflowParser;
import ai.imagegraph.workflow.service.TemplateResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ExecutorConfiguration {

    @Bean
    public WorkflowParser workflowParser(ObjectMapper objectMapper) {
        return new WorkflowParser(objectMapper);
    }

    @Bean
    public TemplateResolver templateResolver(WorkflowParser workflowParser) {
        return new TemplateResolver(workflowParser);
    }

    @Bean
    public ExecutionGraphWriter executionGraphWriter(ObjectMapper objectMapper) {
        return new ExecutionGraphWriter(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
