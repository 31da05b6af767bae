package com.example.craftscore.exception;

/**
 * The oracle produced no usable reply, after whatever retries its client performs.
 */
public class OracleUnavailableException extends RuntimeException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
