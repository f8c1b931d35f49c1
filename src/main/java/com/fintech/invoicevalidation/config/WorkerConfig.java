package com.fintech.invoicevalidation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the concurrent SUNAT validation calls.
 * <p>
 * Only HTTP calls run on this pool. Database writes stay on the polling thread.
 */
@Configuration
public class WorkerConfig {

    @Bean(name = "validationExecutor")
    public ThreadPoolTaskExecutor validationExecutor(
            @Value("${invoice-validation.worker.threads:10}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // fixed size: core == max, unbounded queue
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("sunat-validation-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
