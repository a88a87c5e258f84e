package com.codebox.engine.service;

/**
 * Thrown when a submission cannot be turned into an execution request
 * (unknown language or mode, missing caller for tracked mode, no source).
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
