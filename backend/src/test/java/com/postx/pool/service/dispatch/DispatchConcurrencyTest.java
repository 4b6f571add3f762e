package com.postx.pool.service.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.RotationStrategy;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.PoolExhaustedException;
import com.postx.pool.publisher.PostContent;
import com.postx.pool.publisher.PublishReceipt;
import com.postx.pool.support.AbstractPoolIntegrationTest;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class DispatchConcurrencyTest extends AbstractPoolIntegrationTest {

    @Autowired private DispatchService dispatchService;

    private final PostContent content = PostContent.builder().text("launch day").build();

    @Test
    @DisplayName("Concurrent dispatches never push one member past its daily cap")
    void concurrentDispatches_SingleMember_CapHonoured() throws InterruptedException {
        int threads = 8;
        AccountPool pool = createPool(RotationStrategy.ROUND_ROBIN, threads - 1);
        PoolMembership member = addMembers(pool, 1).get(0);
        publisher.setDelayMs(30);

        RunResult run = runConcurrently(threads);

        assertEquals(threads - 1, run.published.get(), "Exactly cap dispatches should publish");
        assertEquals(1, run.exhausted.get(), "The dispatch over the cap should find the pool exhausted");
        assertEquals(0, run.unexpected.get());
        assertEquals(threads - 1, publisher.getCalls());

        PoolMembership reloaded = poolMembershipRepository.findById(member.getId()).orElseThrow();
        assertEquals(threads - 1, reloaded.getPostsToday());
        assertEquals(threads - 1, reloaded.getTotalPosts());
        assertFalse(reloaded.isInFlight());
        assertNull(reloaded.getReservationToken());
    }

    @Test
    @DisplayName("No member is ever used by two dispatches at once")
    void concurrentDispatches_ManyMembers_NoDoubleBooking() throws InterruptedException {
        AccountPool pool = createPool(RotationStrategy.LEAST_USED, 2);
        List<PoolMembership> members = addMembers(pool, 3);
        Set<Long> publishing = ConcurrentHashMap.newKeySet();
        AtomicInteger overlaps = new AtomicInteger();
        Function<SocialAccount, PublishReceipt> guarded =
                account -> {
                    if (!publishing.add(account.getId())) {
                        overlaps.incrementAndGet();
                    }
                    try {
                        Thread.sleep(20);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    publishing.remove(account.getId());
                    return new PublishReceipt("p-" + account.getId() + "-" + System.nanoTime(), null);
                };
        publisher.behave(guarded);

        RunResult run = runConcurrently(10);

        assertEquals(0, overlaps.get(), "A member was published through concurrently");
        assertEquals(6, run.published.get());
        assertEquals(4, run.exhausted.get());
        Map<Long, Long> usage =
                publisher.getAccountsUsed().stream()
                        .collect(Collectors.groupingBy(id -> id, Collectors.counting()));
        usage.values().forEach(count -> assertEquals(2L, count));
        for (PoolMembership member : members) {
            PoolMembership reloaded = poolMembershipRepository.findById(member.getId()).orElseThrow();
            assertEquals(2, reloaded.getPostsToday());
            assertFalse(reloaded.isInFlight());
        }
    }

    private RunResult runConcurrently(int threads) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        RunResult run = new RunResult();

        for (int i = 0; i < threads; i++) {
            executor.submit(
                    () -> {
                        try {
                            start.await();
                            DispatchResult result =
                                    dispatchService.dispatch(BRAND_ID, Platform.INSTAGRAM, content);
                            if (result.isSuccess()) {
                                run.published.incrementAndGet();
                            } else {
                                run.unexpected.incrementAndGet();
                            }
                        } catch (PoolExhaustedException e) {
                            run.exhausted.incrementAndGet();
                        } catch (Exception e) {
                            run.unexpected.incrementAndGet();
                        } finally {
                            done.countDown();
                        }
                    });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS), "Dispatches should complete within 30 seconds");
        executor.shutdown();
        return run;
    }

    private static class RunResult {
        final AtomicInteger published = new AtomicInteger();
        final AtomicInteger exhausted = new AtomicInteger();
        final AtomicInteger unexpected = new AtomicInteger();
    }
}
