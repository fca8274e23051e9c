package com.dcruver.zettel.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Task pool shared by the background rebuild and the watcher consumer.
 * Threads are daemons so one-shot shell commands exit once they return.
 */
@Configuration
@Slf4j
public class TaskExecutorConfiguration {

    public static final String NOTE_TASK_EXECUTOR = "noteTaskExecutor";

    @Bean(name = NOTE_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor noteTaskExecutor(WikiProperties properties) {
        WikiProperties.Executor config = properties.getExecutor();
        log.info("Creating note task executor (core={}, max={})",
            config.getCorePoolSize(), config.getMaxPoolSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("note-task-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
