package com.postx.pool.exception;

import org.springframework.http.HttpStatus;

/** The publish executor refused the call because its queue is full. */
public class DispatchCapacityException extends ApiException {

    public DispatchCapacityException(String dispatchId, Throwable cause) {
        super(
                "Dispatch " + dispatchId + " refused: publish capacity exhausted, retry later",
                cause,
                HttpStatus.SERVICE_UNAVAILABLE,
                "DISPATCH_CAPACITY_EXCEEDED");
    }
}
