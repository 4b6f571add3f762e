package com.postx.pool.service.dispatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.postx.pool.config.PoolProperties;
import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.PublishErrorKind;
import com.postx.pool.entity.RotationStrategy;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.DispatchCapacityException;
import com.postx.pool.exception.PoolExhaustedException;
import com.postx.pool.exception.PoolNotConfiguredException;
import com.postx.pool.monitoring.DispatchMetrics;
import com.postx.pool.publisher.PlatformPublisher;
import com.postx.pool.publisher.PlatformPublisherRegistry;
import com.postx.pool.publisher.PostContent;
import com.postx.pool.publisher.PublishException;
import com.postx.pool.publisher.PublishReceipt;
import com.postx.pool.service.audit.DispatchAuditService;
import com.postx.pool.service.health.AccountHealthService;
import com.postx.pool.service.health.PublishOutcome;
import com.postx.pool.service.pool.PoolRegistryService;
import com.postx.pool.service.pool.RotationSelector;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class DispatchServiceTest {

    private static final Long BRAND_ID = 7L;
    private static final Long POOL_ID = 1L;

    @Mock private PoolRegistryService poolRegistryService;
    @Mock private MembershipReservationService reservationService;
    @Mock private AccountHealthService accountHealthService;
    @Mock private DispatchAuditService auditService;
    @Mock private PlatformPublisherRegistry publisherRegistry;
    @Mock private PlatformPublisher publisher;

    private final PostContent content = PostContent.builder().text("hello").build();

    private PoolProperties poolProperties;
    private ThreadPoolTaskExecutor publishExecutor;
    private DispatchService dispatchService;

    @BeforeEach
    void setUp() {
        poolProperties = new PoolProperties();
        poolProperties.getDispatch().setReservationWait(Duration.ofMillis(200));
        poolProperties.getDispatch().setReservationPollInterval(Duration.ofMillis(10));
        publishExecutor = executor(2, 10);
        dispatchService = newService(TimeLimiter.of(Duration.ofSeconds(2)));
    }

    @AfterEach
    void tearDown() {
        publishExecutor.shutdown();
    }

    private static ThreadPoolTaskExecutor executor(int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("publish-test-");
        executor.initialize();
        return executor;
    }

    private DispatchService newService(TimeLimiter timeLimiter) {
        return new DispatchService(
                poolRegistryService,
                new RotationSelector(),
                reservationService,
                accountHealthService,
                auditService,
                publisherRegistry,
                new DispatchMetrics(new SimpleMeterRegistry()),
                poolProperties,
                timeLimiter,
                publishExecutor,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private AccountPool poolWithMembers(int count, MembershipStatus status) {
        AccountPool pool =
                AccountPool.builder()
                        .id(POOL_ID)
                        .brandId(BRAND_ID)
                        .platform(Platform.INSTAGRAM)
                        .name("main")
                        .rotationStrategy(RotationStrategy.ROUND_ROBIN)
                        .build();
        List<PoolMembership> members = new ArrayList<>();
        for (long i = 1; i <= count; i++) {
            SocialAccount account =
                    SocialAccount.builder().id(10 + i).platform(Platform.INSTAGRAM).build();
            members.add(
                    PoolMembership.builder()
                            .id(100 + i)
                            .accountPool(pool)
                            .socialAccount(account)
                            .status(status)
                            .build());
        }
        pool.setMemberships(members);
        return pool;
    }

    private void stubPool(AccountPool pool, List<PoolMembership> candidates) {
        when(poolRegistryService.getPool(BRAND_ID, Platform.INSTAGRAM)).thenReturn(pool);
        when(publisherRegistry.publisherFor(Platform.INSTAGRAM)).thenReturn(publisher);
        when(poolRegistryService.listCandidates(POOL_ID)).thenReturn(candidates);
    }

    private void stubReservations() {
        when(reservationService.tryReserve(anyLong(), anyInt()))
                .thenAnswer(inv -> Optional.of("token-" + inv.getArgument(0)));
    }

    @Test
    @DisplayName("First eligible member publishes and the outcome is recorded with its token")
    void dispatch_Success_ReturnsPublished() {
        // Arrange
        AccountPool pool = poolWithMembers(3, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any())).thenReturn(new PublishReceipt("p-1", "https://x/p-1"));

        // Act
        DispatchResult result = dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);

        // Assert
        assertTrue(result.isSuccess());
        assertEquals(DispatchStatus.PUBLISHED, result.getStatus());
        assertEquals(11L, result.getAccountId());
        assertEquals(101L, result.getMembershipId());
        assertEquals("p-1", result.getPostId());
        assertEquals(1, result.getAttempts());
        ArgumentCaptor<PublishOutcome> outcome = ArgumentCaptor.forClass(PublishOutcome.class);
        verify(accountHealthService).recordOutcome(eq(101L), outcome.capture(), eq("token-101"));
        assertTrue(outcome.getValue().isSuccess());
        verify(auditService).recordAttempt(any(DispatchOutcome.class));
    }

    @Test
    @DisplayName("Per-account failure fails over to the next member")
    void dispatch_NetworkErrorThenSuccess_FailsOver() {
        AccountPool pool = poolWithMembers(3, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenThrow(new PublishException(PublishErrorKind.NETWORK_ERROR, "reset"))
                .thenReturn(new PublishReceipt("p-2", "https://x/p-2"));

        DispatchResult result = dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);

        assertEquals(DispatchStatus.PUBLISHED, result.getStatus());
        assertEquals(12L, result.getAccountId());
        assertEquals(2, result.getAttempts());
        verify(accountHealthService, times(2)).recordOutcome(anyLong(), any(PublishOutcome.class), anyString());
    }

    @Test
    @DisplayName("All members rate limited: stops after maxAttempts and reports the pool exhausted")
    void dispatch_AllRateLimited_PoolExhausted() {
        AccountPool pool = poolWithMembers(5, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenThrow(new PublishException(PublishErrorKind.RATE_LIMITED, "429"));

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        assertEquals(POOL_ID, ex.getPoolId());
        assertEquals(3, ex.getAttempts());
        assertEquals(PublishErrorKind.RATE_LIMITED, ex.getLastErrorKind());
        assertEquals("POOL_EXHAUSTED", ex.getErrorCode());
        assertTrue(ex.getMessage().endsWith("last error RATE_LIMITED"));
        ArgumentCaptor<SocialAccount> accounts = ArgumentCaptor.forClass(SocialAccount.class);
        verify(publisher, times(3)).publish(accounts.capture(), any());
        assertEquals(
                List.of(11L, 12L, 13L),
                accounts.getAllValues().stream().map(SocialAccount::getId).toList());
    }

    @Test
    void dispatch_PoolSmallerThanMaxAttempts_BoundedByPoolSize() {
        AccountPool pool = poolWithMembers(2, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenThrow(new PublishException(PublishErrorKind.PLATFORM_ERROR, "500"));

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        assertEquals(2, ex.getAttempts());
        assertEquals(PublishErrorKind.PLATFORM_ERROR, ex.getLastErrorKind());
        verify(publisher, times(2)).publish(any(), any());
    }

    @Test
    @DisplayName("Content rejection returns at once without trying other members")
    void dispatch_ContentRejected_NoFailover() {
        AccountPool pool = poolWithMembers(3, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenThrow(new PublishException(PublishErrorKind.CONTENT_REJECTED, "policy"));

        DispatchResult result = dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);

        assertEquals(DispatchStatus.CONTENT_REJECTED, result.getStatus());
        assertEquals(PublishErrorKind.CONTENT_REJECTED, result.getErrorKind());
        assertEquals(1, result.getAttempts());
        verify(publisher, times(1)).publish(any(), any());
        verify(reservationService, times(1)).tryReserve(anyLong(), anyInt());
    }

    @Test
    void dispatch_ValidationError_NoFailover() {
        AccountPool pool = poolWithMembers(3, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenThrow(new PublishException(PublishErrorKind.VALIDATION_ERROR, "caption too long"));

        DispatchResult result = dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);

        assertEquals(DispatchStatus.CONTENT_REJECTED, result.getStatus());
        verify(publisher, times(1)).publish(any(), any());
    }

    @Test
    @DisplayName("Every member banned, exhausted without a publish call")
    void dispatch_AllBanned_PoolExhausted() {
        AccountPool pool = poolWithMembers(3, MembershipStatus.BANNED);
        stubPool(pool, List.of());

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        assertEquals(POOL_ID, ex.getPoolId());
        assertEquals(0, ex.getAttempts());
        verifyNoInteractions(publisher, reservationService, accountHealthService);
    }

    @Test
    void dispatch_NoPool_PropagatesNotConfigured() {
        when(poolRegistryService.getPool(BRAND_ID, Platform.INSTAGRAM))
                .thenThrow(new PoolNotConfiguredException(BRAND_ID, Platform.INSTAGRAM));

        assertThrows(
                PoolNotConfiguredException.class,
                () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));
        verifyNoInteractions(publisherRegistry, reservationService);
    }

    @Test
    @DisplayName("Without auto failover only one member is tried")
    void dispatch_AutoFailoverDisabled_SingleAttempt() {
        AccountPool pool = poolWithMembers(3, MembershipStatus.ACTIVE);
        pool.setAutoFailover(false);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenThrow(new PublishException(PublishErrorKind.NETWORK_ERROR, "reset"));

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        assertEquals(1, ex.getAttempts());
        verify(publisher, times(1)).publish(any(), any());
    }

    @Test
    @DisplayName("A lost reservation race falls through to the next ranked member")
    void dispatch_ReservationLost_UsesNextMember() {
        AccountPool pool = poolWithMembers(2, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        when(reservationService.tryReserve(101L, pool.getMaxPostsPerDay())).thenReturn(Optional.empty());
        when(reservationService.tryReserve(102L, pool.getMaxPostsPerDay())).thenReturn(Optional.of("t2"));
        when(publisher.publish(any(), any())).thenReturn(new PublishReceipt("p", "u"));

        DispatchResult result = dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);

        assertEquals(12L, result.getAccountId());
        verify(accountHealthService).recordOutcome(eq(102L), any(PublishOutcome.class), eq("t2"));
    }

    @Test
    @DisplayName("Members held by other dispatches are waited for, then reported as exhausted")
    void dispatch_OnlyInFlightMembers_WaitsThenExhausted() {
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        pool.getMemberships().get(0).setInFlight(true);
        stubPool(pool, pool.getMemberships());

        assertThrows(
                PoolExhaustedException.class,
                () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        verify(poolRegistryService, atLeast(2)).listCandidates(POOL_ID);
        verifyNoInteractions(publisher, reservationService);
    }

    @Test
    @DisplayName("A publish call past the time limit counts as a network error")
    void dispatch_PublishTimeout_RecordedAsNetworkError() {
        dispatchService = newService(TimeLimiter.of(Duration.ofMillis(100)));
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenAnswer(
                        inv -> {
                            Thread.sleep(1000);
                            return new PublishReceipt("late", "late");
                        });

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        assertEquals(PublishErrorKind.NETWORK_ERROR, ex.getLastErrorKind());
        ArgumentCaptor<PublishOutcome> outcome = ArgumentCaptor.forClass(PublishOutcome.class);
        verify(accountHealthService).recordOutcome(eq(101L), outcome.capture(), eq("token-101"));
        assertEquals(PublishErrorKind.NETWORK_ERROR, outcome.getValue().getErrorKind());
        assertEquals("Publish timed out after PT0.1S", outcome.getValue().getErrorMessage());
    }

    @Test
    @DisplayName("A timed-out publish is interrupted and frees its worker for the next attempt")
    void dispatch_HungPublish_WorkerInterruptedAndReused() {
        publishExecutor.shutdown();
        publishExecutor = executor(1, 10);
        dispatchService = newService(TimeLimiter.of(Duration.ofMillis(200)));
        AccountPool pool = poolWithMembers(2, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        CountDownLatch neverReleased = new CountDownLatch(1);
        AtomicBoolean hungCallInterrupted = new AtomicBoolean();
        AtomicInteger calls = new AtomicInteger();
        when(publisher.publish(any(), any()))
                .thenAnswer(
                        inv -> {
                            if (calls.incrementAndGet() == 1) {
                                try {
                                    neverReleased.await();
                                } catch (InterruptedException e) {
                                    hungCallInterrupted.set(true);
                                    throw e;
                                }
                            }
                            return new PublishReceipt("p-" + calls.get(), "u");
                        });

        DispatchResult result = dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);

        assertEquals(DispatchStatus.PUBLISHED, result.getStatus());
        assertEquals(12L, result.getAccountId());
        assertEquals(2, result.getAttempts());
        assertEquals(2, calls.get());
        assertTrue(hungCallInterrupted.get());
    }

    @Test
    @DisplayName("A caller-supplied timeout shorter than the configured one applies to the attempt")
    void dispatch_CallerTimeout_AppliedPerAttempt() {
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenAnswer(
                        inv -> {
                            Thread.sleep(1000);
                            return new PublishReceipt("late", "late");
                        });

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () ->
                                dispatchService.dispatch(
                                        BRAND_ID, Platform.INSTAGRAM, content, Duration.ofMillis(100)));

        assertEquals(PublishErrorKind.NETWORK_ERROR, ex.getLastErrorKind());
        ArgumentCaptor<PublishOutcome> outcome = ArgumentCaptor.forClass(PublishOutcome.class);
        verify(accountHealthService).recordOutcome(eq(101L), outcome.capture(), eq("token-101"));
        assertEquals("Publish timed out after PT0.1S", outcome.getValue().getErrorMessage());
    }

    @Test
    @DisplayName("A caller-supplied timeout above the configured one is capped")
    void dispatch_CallerTimeoutAboveMaximum_Capped() {
        dispatchService = newService(TimeLimiter.of(Duration.ofMillis(150)));
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any()))
                .thenAnswer(
                        inv -> {
                            Thread.sleep(1000);
                            return new PublishReceipt("late", "late");
                        });

        long start = System.nanoTime();
        assertThrows(
                PoolExhaustedException.class,
                () ->
                        dispatchService.dispatch(
                                BRAND_ID, Platform.INSTAGRAM, content, Duration.ofSeconds(10)));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
        ArgumentCaptor<PublishOutcome> outcome = ArgumentCaptor.forClass(PublishOutcome.class);
        verify(accountHealthService).recordOutcome(eq(101L), outcome.capture(), eq("token-101"));
        assertEquals("Publish timed out after PT0.15S", outcome.getValue().getErrorMessage());
    }

    @Test
    void dispatch_NonPositiveTimeout_Rejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content, Duration.ZERO));
        verifyNoInteractions(poolRegistryService, publisher);
    }

    @Test
    @DisplayName("A full publish executor refuses the attempt and releases the reservation")
    void dispatch_PublishExecutorFull_ReleasesReservation() {
        publishExecutor.shutdown();
        publishExecutor = executor(1, 0);
        dispatchService = newService(TimeLimiter.of(Duration.ofSeconds(2)));
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        CountDownLatch busy = new CountDownLatch(1);
        publishExecutor.execute(
                () -> {
                    try {
                        busy.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });

        try {
            DispatchCapacityException ex =
                    assertThrows(
                            DispatchCapacityException.class,
                            () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

            assertEquals("DISPATCH_CAPACITY_EXCEEDED", ex.getErrorCode());
            verify(reservationService).release(101L, "token-101");
            verify(accountHealthService, never())
                    .recordOutcome(anyLong(), any(PublishOutcome.class), anyString());
            verifyNoInteractions(publisher);
        } finally {
            busy.countDown();
        }
    }

    @Test
    void dispatch_UnclassifiedException_RecordedAsUnknown() {
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any())).thenThrow(new IllegalStateException("driver crashed"));

        PoolExhaustedException ex =
                assertThrows(
                        PoolExhaustedException.class,
                        () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        assertEquals(PublishErrorKind.UNKNOWN, ex.getLastErrorKind());
        ArgumentCaptor<PublishOutcome> outcome = ArgumentCaptor.forClass(PublishOutcome.class);
        verify(accountHealthService).recordOutcome(eq(101L), outcome.capture(), eq("token-101"));
        assertEquals("IllegalStateException: driver crashed", outcome.getValue().getErrorMessage());
    }

    @Test
    @DisplayName("Reservation is released when the outcome cannot be recorded")
    void dispatch_RecordOutcomeFails_ReleasesReservation() {
        AccountPool pool = poolWithMembers(1, MembershipStatus.ACTIVE);
        stubPool(pool, pool.getMemberships());
        stubReservations();
        when(publisher.publish(any(), any())).thenReturn(new PublishReceipt("p", "u"));
        when(accountHealthService.recordOutcome(anyLong(), any(PublishOutcome.class), anyString()))
                .thenThrow(new IllegalStateException("database down"));

        assertThrows(
                IllegalStateException.class,
                () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));

        verify(reservationService).release(101L, "token-101");
    }

    @Test
    void dispatch_EmptyPool_Exhausted() {
        AccountPool pool = poolWithMembers(0, MembershipStatus.ACTIVE);
        when(poolRegistryService.getPool(BRAND_ID, Platform.INSTAGRAM)).thenReturn(pool);
        when(publisherRegistry.publisherFor(Platform.INSTAGRAM)).thenReturn(publisher);

        assertThrows(
                PoolExhaustedException.class,
                () -> dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content));
        verifyNoInteractions(publisher);
    }
}
