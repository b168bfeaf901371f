package com.iksanov.rangecache.common.exception;

/**
 * Root of the unchecked exception hierarchy shared by every cache module.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
