package com.example.ttsbatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpSpeechSenderTest {
    @Test
    void mapsStatusesToOutcomes() throws Exception {
        byte[] audio = {1, 2, 3};

        assertArrayEquals(audio, HttpSpeechSender.interpret(200, audio));
        assertThrows(HardLimitException.class, () -> HttpSpeechSender.interpret(429, audio));
        assertThrows(HardLimitException.class, () -> HttpSpeechSender.interpret(403, audio));
        assertThrows(TransientSendException.class, () -> HttpSpeechSender.interpret(500, audio));
        assertThrows(TransientSendException.class, () -> HttpSpeechSender.interpret(404, audio));
        assertThrows(TransientSendException.class, () -> HttpSpeechSender.interpret(200, new byte[0]));
    }

    @Test
    void postsTextAndVoice() throws Exception {
        AtomicReference<JsonNode> received = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/speak", exchange -> {
            received.set(new ObjectMapper().readTree(exchange.getRequestBody()));
            byte[] body = "ID3-audio".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        try {
            URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/speak");
            HttpSpeechSender sender = new HttpSpeechSender(endpoint, Duration.ofSeconds(5));

            byte[] audio = sender.send("Hello there.", "narrator");

            assertEquals("ID3-audio", new String(audio, StandardCharsets.UTF_8));
            assertEquals("Hello there.", received.get().get("text").asText());
            assertEquals("narrator", received.get().get("voice").asText());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void quotaResponseIsHardLimit() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/speak", exchange -> {
            exchange.sendResponseHeaders(429, -1);
            exchange.close();
        });
        server.start();
        try {
            URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/speak");
            HttpSpeechSender sender = new HttpSpeechSender(endpoint, Duration.ofSeconds(5));

            assertThrows(HardLimitException.class, () -> sender.send("Hello.", "narrator"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void perWorkerSendersAreIsolated() {
        IntFunction<SpeechSender> senders = HttpSpeechSender.perWorker(
                URI.create("http://127.0.0.1:9/speak"), Duration.ofSeconds(5));

        SpeechSender first = senders.apply(1);
        SpeechSender second = senders.apply(2);

        assertNotSame(first, second);
        assertSame(first, senders.apply(1));
        assertNotSame(((HttpSpeechSender) first).client(), ((HttpSpeechSender) second).client());
        assertTrue(((HttpSpeechSender) first).client().cookieHandler().isPresent());
    }

    @Test
    void cookiesStayWithTheirSession() throws Exception {
        List<String> cookieHeaders = new CopyOnWriteArrayList<>();
        AtomicInteger sessions = new AtomicInteger();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/speak", exchange -> {
            exchange.getRequestBody().readAllBytes();
            String cookie = exchange.getRequestHeaders().getFirst("Cookie");
            cookieHeaders.add(cookie == null ? "" : cookie);
            if (cookie == null) {
                exchange.getResponseHeaders().add("Set-Cookie", "session=s" + sessions.incrementAndGet() + "; Path=/");
            }
            byte[] body = "ID3-audio".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        try {
            URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/speak");
            IntFunction<SpeechSender> senders = HttpSpeechSender.perWorker(endpoint, Duration.ofSeconds(5));

            senders.apply(1).send("One.", "narrator");
            senders.apply(1).send("Two.", "narrator");
            senders.apply(2).send("Three.", "narrator");
            senders.apply(2).send("Four.", "narrator");

            assertEquals(List.of("", "session=s1", "", "session=s2"), cookieHeaders);
        } finally {
            server.stop(0);
        }
    }
}
