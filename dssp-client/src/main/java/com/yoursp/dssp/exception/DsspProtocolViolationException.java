package com.yoursp.dssp.exception;

/**
 * Thrown when a response carries the expected result code but not the
 * content the flow requires, e.g. no signed document or more than one.
 */
public class DsspProtocolViolationException extends RuntimeException {

    public DsspProtocolViolationException(String message) {
        super(message);
    }

    public DsspProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
