package com.postx.pool.config;

import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for outbound publish calls. Publish calls run off the caller's thread so the timeout
 * can be enforced without holding any database resources.
 *
 * <p>The queue is bounded and overflow is rejected; a rejected publish is reported to the caller
 * as a capacity failure rather than run on the request thread.
 */
@Slf4j
@Configuration
public class DispatchExecutorConfig {

    @Bean("publishExecutor")
    public ThreadPoolTaskExecutor publishExecutor(PoolProperties poolProperties) {
        PoolProperties.Dispatch dispatch = poolProperties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(dispatch.getPublishThreads());
        executor.setMaxPoolSize(dispatch.getPublishThreads());
        executor.setQueueCapacity(dispatch.getPublishQueueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("publish-");

        // Timed-out publishes are cancelled; do not hold shutdown for hung platform calls
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);

        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        log.info(
                "Publish executor initialized: threads={}, queueCapacity={}",
                dispatch.getPublishThreads(),
                dispatch.getPublishQueueCapacity());
        return executor;
    }
}
