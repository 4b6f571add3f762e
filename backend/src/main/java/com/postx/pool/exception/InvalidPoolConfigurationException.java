package com.postx.pool.exception;

import org.springframework.http.HttpStatus;

public class InvalidPoolConfigurationException extends ApiException {

    public InvalidPoolConfigurationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_POOL_CONFIGURATION");
    }
}
