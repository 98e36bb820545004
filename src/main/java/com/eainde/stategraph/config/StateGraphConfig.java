package com.eainde.stategraph.config;

import com.eainde.stategraph.CompileOptions;
import com.eainde.stategraph.checkpoint.InMemoryCheckpointSaver;
import com.eainde.stategraph.listener.GraphListener;
import com.eainde.stategraph.listener.LoggingGraphListener;
import com.eainde.stategraph.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.util.List;

/**
 * Spring wiring for graphs defined as beans.
 * <p>
 * Graph configurations inject the {@link CompileOptions} bean and compile their
 * {@code GraphBuilder} with it. Registering {@code WorkflowEngine} next to them (component
 * scan or an explicit import) makes every {@code Workflow} bean runnable by name.
 *
 * <pre>
 * stategraph.recursion-limit=25
 * stategraph.async.pool-size=4
 * stategraph.logging.enabled=true
 * stategraph.checkpoint.max-runs=1000
 * </pre>
 */
@Log4j2
@Configuration
@PropertySource(value = "classpath:stategraph.properties", ignoreResourceNotFound = true)
public class StateGraphConfig {

    @Value("${stategraph.recursion-limit:25}")
    private int recursionLimit;

    @Value("${stategraph.async.pool-size:4}")
    private int asyncPoolSize;

    @Value("${stategraph.logging.enabled:true}")
    private boolean loggingEnabled;

    @Value("${stategraph.checkpoint.max-runs:1000}")
    private int checkpointMaxRuns;

    @Bean
    public InMemoryCheckpointSaver checkpointSaver() {
        return new InMemoryCheckpointSaver(checkpointMaxRuns);
    }

    @Bean
    public LoggingGraphListener loggingGraphListener() {
        return new LoggingGraphListener();
    }

    @Bean
    public CompileOptions compileOptions(InMemoryCheckpointSaver checkpointSaver,
                                         List<GraphListener> listeners) {
        CompileOptions options = CompileOptions.builder()
                .recursionLimit(recursionLimit)
                .checkpointSaver(checkpointSaver)
                .listeners(listeners.stream()
                        .filter(l -> loggingEnabled || !(l instanceof LoggingGraphListener))
                        .toList())
                .build();

        log.info("State graph defaults: {}", options);
        return options;
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor graphRunExecutor() {
        return new MdcAwareExecutor(asyncPoolSize);
    }
}
