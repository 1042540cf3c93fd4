package eu.virtualparadox.articlefinder.application.config;

import eu.virtualparadox.articlefinder.application.executor.CapabilityExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public CapabilityExecutor capabilityExecutor(final RetrievalProperties props) {
        CapabilityExecutor executor = new CapabilityExecutor();
        executor.setCorePoolSize(props.effectivePoolSize());
        executor.setMaxPoolSize(props.effectivePoolSize());
        executor.setQueueCapacity(Integer.MAX_VALUE); // callers bound their own wait
        executor.setThreadNamePrefix("capability-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
