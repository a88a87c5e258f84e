package com.codebox.engine.service;

/**
 * Thrown when every worker is busy and the wait queue is full.
 * Nothing was started; the caller may retry later.
 */
public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
