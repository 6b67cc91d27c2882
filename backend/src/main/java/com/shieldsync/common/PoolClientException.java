package com.shieldsync.common;

import lombok.Getter;

/**
 * Base of every error the pool client surfaces to callers. The API layer maps {@link #getErrorCode()}
 * to an HTTP status and an ErrorBody.
 */
@Getter
public abstract class PoolClientException extends RuntimeException {

    private final String errorCode;

    protected PoolClientException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PoolClientException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
