package com.example.ttsbatch;

/**
 * Network, timeout or server-side failure of a single send. Retried locally.
 */
public class TransientSendException extends SendException {
    public TransientSendException(String message) {
        super(message);
    }

    public TransientSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
