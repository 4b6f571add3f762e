package com.postx.pool.service.dispatch;

public enum DispatchStatus {
    PUBLISHED,
    // Content-level rejection; failover was skipped
    CONTENT_REJECTED
}
