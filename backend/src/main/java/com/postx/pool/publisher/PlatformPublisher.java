package com.postx.pool.publisher;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.SocialAccount;

/**
 * Adapter that posts content to one platform with one concrete account. Implementations live
 * outside this service (API clients, browser automation workers).
 *
 * <p>Failures are reported by throwing {@link PublishException} with the matching {@link
 * com.postx.pool.entity.PublishErrorKind}. Any other runtime exception is treated as UNKNOWN.
 */
public interface PlatformPublisher {

    Platform getPlatform();

    PublishReceipt publish(SocialAccount account, PostContent content);
}
