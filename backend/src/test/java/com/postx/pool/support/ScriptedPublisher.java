package com.postx.pool.support;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.publisher.PlatformPublisher;
import com.postx.pool.publisher.PostContent;
import com.postx.pool.publisher.PublishReceipt;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Instagram publisher whose behaviour each test scripts. Succeeds by default. */
public class ScriptedPublisher implements PlatformPublisher {

    private final AtomicInteger calls = new AtomicInteger();
    private final List<Long> accountsUsed = new CopyOnWriteArrayList<>();
    private volatile Function<SocialAccount, PublishReceipt> behaviour = ScriptedPublisher::succeed;
    private volatile long delayMs = 0;

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public PublishReceipt publish(SocialAccount account, PostContent content) {
        calls.incrementAndGet();
        accountsUsed.add(account.getId());
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return behaviour.apply(account);
    }

    public void behave(Function<SocialAccount, PublishReceipt> behaviour) {
        this.behaviour = behaviour;
    }

    public void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }

    public int getCalls() {
        return calls.get();
    }

    public List<Long> getAccountsUsed() {
        return accountsUsed;
    }

    public void reset() {
        calls.set(0);
        accountsUsed.clear();
        behaviour = ScriptedPublisher::succeed;
        delayMs = 0;
    }

    private static PublishReceipt succeed(SocialAccount account) {
        String postId = "post-" + account.getId() + "-" + System.nanoTime();
        return new PublishReceipt(postId, "https://instagram.example/p/" + postId);
    }
}
