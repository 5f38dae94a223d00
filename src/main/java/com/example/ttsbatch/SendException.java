package com.example.ttsbatch;

/**
 * Base type for the modeled outcomes of a send other than audio.
 */
public class SendException extends Exception {
    public SendException(String message) {
        super(message);
    }

    public SendException(String message, Throwable cause) {
        super(message, cause);
    }
}
