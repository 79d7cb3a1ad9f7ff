package com.agrinova.backend.modules.auth.domain;

/**
 * The credential hashing pool could not take or finish the work in time. Says nothing about the credentials.
 */
public class HashingSaturatedException extends RateLimitedException {

    public HashingSaturatedException(long retryAfterSeconds, Throwable cause) {
        super(retryAfterSeconds, cause);
    }
}
