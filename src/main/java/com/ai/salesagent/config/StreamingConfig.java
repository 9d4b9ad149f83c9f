package com.ai.salesagent.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class StreamingConfig {

    /** Runs streamed chat turns off the servlet thread. */
    @Bean(name = "chatStreamExecutor")
    public TaskExecutor chatStreamExecutor(@Value("${agent.stream.pool-size:8}") int poolSize,
                                           @Value("${agent.stream.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("chat-stream-");
        return executor;
    }
}
