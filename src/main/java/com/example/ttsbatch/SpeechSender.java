package com.example.ttsbatch;

/**
 * Sends one piece of text to the remote speech service.
 */
@FunctionalInterface
public interface SpeechSender {
    /**
     * Returns the synthesized audio for {@code text}.
     *
     * @throws TransientSendException when the request failed and may be retried
     * @throws HardLimitException when the session quota was hit
     */
    byte[] send(String text, String voice) throws SendException, InterruptedException;
}
