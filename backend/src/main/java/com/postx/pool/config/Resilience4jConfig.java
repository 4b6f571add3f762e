package com.postx.pool.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resilience4j setup for outbound publish calls */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String PUBLISH_TIME_LIMITER = "platform-publish";

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(PoolProperties poolProperties) {
        TimeLimiterConfig publishConfig =
                TimeLimiterConfig.custom()
                        .timeoutDuration(poolProperties.getDispatch().getPublishTimeout())
                        .cancelRunningFuture(true)
                        .build();
        return TimeLimiterRegistry.of(publishConfig);
    }

    @Bean
    public TimeLimiter publishTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(PUBLISH_TIME_LIMITER);
        timeLimiter
                .getEventPublisher()
                .onTimeout(
                        event ->
                                log.warn(
                                        "Publish call timed out after {}",
                                        timeLimiter.getTimeLimiterConfig().getTimeoutDuration()));
        return timeLimiter;
    }
}
