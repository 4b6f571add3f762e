package com.postx.pool.exception;

import com.postx.pool.entity.PublishErrorKind;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/** No eligible member is left in the pool for this dispatch. */
@Getter
public class PoolExhaustedException extends ApiException {
    private final Long poolId;
    private final int attempts;
    private final PublishErrorKind lastErrorKind;

    public PoolExhaustedException(Long poolId, int attempts) {
        this(poolId, attempts, null);
    }

    public PoolExhaustedException(Long poolId, int attempts, PublishErrorKind lastErrorKind) {
        super(message(poolId, attempts, lastErrorKind), HttpStatus.CONFLICT, "POOL_EXHAUSTED");
        this.poolId = poolId;
        this.attempts = attempts;
        this.lastErrorKind = lastErrorKind;
    }

    private static String message(Long poolId, int attempts, PublishErrorKind lastErrorKind) {
        String message =
                String.format(
                        "Account pool %d has no eligible account left after %d attempt(s)",
                        poolId, attempts);
        return lastErrorKind == null ? message : message + "; last error " + lastErrorKind;
    }
}
