package com.example.ttsbatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * Posts text to a speech endpoint and maps the response onto the three send outcomes.
 * 429 and 403 mean the session quota was hit; any other non-2xx status, timeout or
 * I/O error is transient.
 */
public final class HttpSpeechSender implements SpeechSender {
    private final HttpClient client;
    private final URI endpoint;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Creates a sender with its own client and cookie store.
     */
    public HttpSpeechSender(URI endpoint, Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .cookieHandler(new CookieManager())
                .build(), endpoint, timeout);
    }

    HttpSpeechSender(HttpClient client, URI endpoint, Duration timeout) {
        this.client = client;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    /**
     * One sender per worker id. A worker id asked for twice, as in the safety probe and
     * then the main run, gets the same sender back.
     */
    public static IntFunction<SpeechSender> perWorker(URI endpoint, Duration timeout) {
        Map<Integer, SpeechSender> senders = new ConcurrentHashMap<>();
        return workerId -> senders.computeIfAbsent(workerId, id -> new HttpSpeechSender(endpoint, timeout));
    }

    HttpClient client() {
        return client;
    }

    @Override
    public byte[] send(String text, String voice) throws SendException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "audio/mpeg")
                .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody(text, voice)))
                .build();
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException ex) {
            throw new TransientSendException("Request timed out after " + timeout.toSeconds() + "s", ex);
        } catch (IOException ex) {
            throw new TransientSendException("Request failed: " + ex.getMessage(), ex);
        }
        return interpret(response.statusCode(), response.body());
    }

    static byte[] interpret(int status, byte[] body) throws SendException {
        if (status == 429 || status == 403) {
            throw new HardLimitException("Remote returned " + status);
        }
        if (status < 200 || status >= 300) {
            throw new TransientSendException("Remote returned " + status);
        }
        if (body == null || body.length == 0) {
            throw new TransientSendException("Remote returned an empty body");
        }
        return body;
    }

    private byte[] requestBody(String text, String voice) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("voice", voice);
        try {
            return mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode request body", ex);
        }
    }
}
