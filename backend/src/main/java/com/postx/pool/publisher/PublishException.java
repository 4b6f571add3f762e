package com.postx.pool.publisher;

import com.postx.pool.entity.PublishErrorKind;
import lombok.Getter;

@Getter
public class PublishException extends RuntimeException {
    private final PublishErrorKind kind;

    public PublishException(PublishErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PublishException(PublishErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
