package com.postx.pool.exception;

import com.postx.pool.entity.Platform;
import org.springframework.http.HttpStatus;

public class PublisherUnavailableException extends ApiException {

    public PublisherUnavailableException(Platform platform) {
        super(
                "No publisher registered for platform " + platform,
                HttpStatus.SERVICE_UNAVAILABLE,
                "PUBLISHER_UNAVAILABLE");
    }
}
