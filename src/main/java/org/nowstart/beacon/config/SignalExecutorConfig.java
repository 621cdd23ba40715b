package org.nowstart.beacon.config;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.property.SignalProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
public class SignalExecutorConfig {

    private static final int MIN_POOL_SIZE = 2;
    private static final int MAX_POOL_SIZE = 16;

    /**
     * Per-symbol evaluation pool, sized to the watchlist so one batch fans out fully.
     */
    @Bean(name = "signalEvaluationExecutor")
    public ThreadPoolTaskExecutor signalEvaluationExecutor(SignalProperties signalProperties) {
        int poolSize = Math.max(MIN_POOL_SIZE, Math.min(MAX_POOL_SIZE, signalProperties.watchlist().size()));

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("signal-eval-");
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("event=signal_executor_init pool_size={}", poolSize);
        return executor;
    }
}
