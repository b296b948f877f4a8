package com.yoursp.dssp.exception;

/**
 * Network or HTTP level failure of the SOAP channel.
 */
public class DsspTransportException extends RuntimeException {

    public DsspTransportException(String message) {
        super(message);
    }

    public DsspTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
