package com.postx.pool.monitoring;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PublishErrorKind;
import com.postx.pool.service.dispatch.DispatchStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/** Metrics for dispatches and the publish attempts inside them */
@Component
public class DispatchMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter poolExhaustedCounter;
    private final Counter poolNotConfiguredCounter;
    private final Counter reservationConflictCounter;
    private final Counter staleReservationCounter;
    private final Counter publishRejectedCounter;

    public DispatchMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.poolExhaustedCounter =
                Counter.builder("account.pool.exhausted")
                        .description("Dispatches rejected because no eligible account was left")
                        .register(meterRegistry);

        this.poolNotConfiguredCounter =
                Counter.builder("account.pool.not_configured")
                        .description("Dispatches for a brand and platform without an active pool")
                        .register(meterRegistry);

        this.reservationConflictCounter =
                Counter.builder("account.pool.reservation.conflict")
                        .description("Reservations lost to a concurrent dispatch")
                        .register(meterRegistry);

        this.staleReservationCounter =
                Counter.builder("account.pool.reservation.stale")
                        .description("Reservations force-released by the sweep")
                        .register(meterRegistry);

        this.publishRejectedCounter =
                Counter.builder("dispatch.publish.rejected")
                        .description("Publish calls refused by the full publish executor")
                        .register(meterRegistry);
    }

    public void recordAttempt(Platform platform, PublishErrorKind errorKind, long latencyMs) {
        String outcome = errorKind == null ? "success" : errorKind.name().toLowerCase();
        Counter.builder("dispatch.attempts")
                .description("Publish attempts by outcome")
                .tag("platform", platform.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        Timer.builder("dispatch.publish.duration")
                .description("Latency of the external publish call")
                .tag("platform", platform.name())
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void recordResult(Platform platform, DispatchStatus status) {
        Counter.builder("dispatch.results")
                .description("Completed dispatches by final status")
                .tag("platform", platform.name())
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
    }

    public void incrementPoolExhausted() {
        poolExhaustedCounter.increment();
    }

    public void incrementPoolNotConfigured() {
        poolNotConfiguredCounter.increment();
    }

    public void incrementReservationConflict() {
        reservationConflictCounter.increment();
    }

    public void incrementStaleReservations(int count) {
        staleReservationCounter.increment(count);
    }

    public void incrementPublishRejected() {
        publishRejectedCounter.increment();
    }

    public Timer.Sample startDispatchTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordDispatchTime(Timer.Sample sample, Platform platform) {
        sample.stop(
                Timer.builder("dispatch.duration")
                        .description("End-to-end dispatch time including failover")
                        .tag("platform", platform.name())
                        .register(meterRegistry));
    }
}
