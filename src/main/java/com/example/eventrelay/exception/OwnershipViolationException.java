package com.example.eventrelay.exception;

/**
 * 调用方访问了不属于自己的资源。
 */
public class OwnershipViolationException extends RuntimeException {

    public OwnershipViolationException(String message) {
        super(message);
    }
}
