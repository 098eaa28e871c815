package org.clerasense.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // one task per source adapter per drug being ingested
    @Bean(name = "sourceFetchExecutor")
    public ThreadPoolTaskExecutor sourceFetchExecutor(IngestionProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getFetchPoolSize());
        ex.setMaxPoolSize(props.getFetchPoolSize());
        ex.setThreadNamePrefix("source-fetch-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    // one task per missing drug in a batch lookup
    @Bean(name = "lookupFillExecutor")
    public ThreadPoolTaskExecutor lookupFillExecutor(IngestionProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getFillPoolSize());
        ex.setMaxPoolSize(props.getFillPoolSize());
        ex.setThreadNamePrefix("lookup-fill-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    // long-running background discovery, one batch run at a time
    @Bean(name = "discoveryExecutor")
    public ThreadPoolTaskExecutor discoveryExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(1);
        ex.setThreadNamePrefix("discovery-");
        ex.initialize();
        return ex;
    }
}
