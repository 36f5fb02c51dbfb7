package com.waveflow.core.exception;

/**
 * Base exception for all engine errors surfaced to callers.
 */
public class WaveflowException extends RuntimeException {

    private final String errorCode;

    public WaveflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WaveflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
