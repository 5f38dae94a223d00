package com.example.ttsbatch;

/**
 * The remote refused a request because the session quota was reached.
 */
public class HardLimitException extends SendException {
    public HardLimitException(String message) {
        super(message);
    }
}
