package com.rottenpotatoes.intake.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import com.rottenpotatoes.intake.support.RecordingMetricsPort;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpEventSinkTest {
  private static final LogEvent EVENT = new LogEvent(
      Instant.parse("2024-01-01T00:00:00Z"), EventLevel.INFO, "Review submitted", "review-intake.events",
      Map.of("event", "review.committed", "movie_id", 1));

  private final ObjectMapper mapper = new ObjectMapper();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<byte[]> bodies = new CopyOnWriteArrayList<>();
  private HttpServer server;
  private HttpEventSink sink;

  @AfterEach
  void tearDown() {
    if (sink != null) {
      sink.close();
    }
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void postsEventDocumentAsJson() throws Exception {
    URI endpoint = startServer(204, 0);
    sink = new HttpEventSink(endpoint, Duration.ofSeconds(2), 8, metrics, mapper);

    sink.write(EVENT);

    awaitCount(() -> metrics.count("events.remote.sent"), 1);
    assertEquals(1, bodies.size());
    JsonNode document = mapper.readTree(bodies.get(0));
    assertEquals("Review submitted", document.get("message").asText());
    assertEquals("INFO", document.get("level").asText());
    assertEquals("review.committed", document.get("event").asText());
    assertEquals(1, document.get("movie_id").asInt());
    awaitCount(sink::availablePermits, 8);
  }

  @Test
  void serverErrorCountsAsFailure() throws Exception {
    sink = new HttpEventSink(startServer(500, 0), Duration.ofSeconds(2), 8, metrics, mapper);

    sink.write(EVENT);

    awaitCount(() -> metrics.count("events.remote.failed"), 1);
    assertEquals(0, metrics.count("events.remote.sent"));
  }

  @Test
  void unreachableEndpointIsCountedNotThrown() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    sink = new HttpEventSink(URI.create("http://127.0.0.1:" + port + "/events"),
        Duration.ofSeconds(1), 8, metrics, mapper);

    sink.write(EVENT);

    awaitCount(() -> metrics.count("events.remote.failed"), 1);
  }

  @Test
  void slowCollectorDoesNotBlockWriter() throws Exception {
    URI endpoint = startServer(204, 1_500);
    sink = new HttpEventSink(endpoint, Duration.ofMillis(300), 1, metrics, mapper);

    long started = System.nanoTime();
    sink.write(EVENT);
    sink.write(EVENT);
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertTrue(elapsedMillis < 250, "write blocked for " + elapsedMillis + " ms");
    assertEquals(1, metrics.count("events.remote.dropped"));
    awaitCount(() -> metrics.count("events.remote.failed"), 1);
  }

  @Test
  void writesAfterCloseAreDropped() throws Exception {
    sink = new HttpEventSink(startServer(204, 0), Duration.ofSeconds(1), 4, metrics, mapper);
    sink.close();

    sink.write(EVENT);

    assertEquals(1, metrics.count("events.remote.dropped"));
    assertTrue(bodies.isEmpty());
  }

  private URI startServer(int status, long delayMillis) throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/events", exchange -> respond(exchange, status, delayMillis));
    server.start();
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/events");
  }

  private void respond(HttpExchange exchange, int status, long delayMillis) throws IOException {
    try (InputStream in = exchange.getRequestBody()) {
      bodies.add(in.readAllBytes());
    }
    if (delayMillis > 0) {
      CountDownLatch never = new CountDownLatch(1);
      try {
        never.await(delayMillis, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    exchange.sendResponseHeaders(status, -1);
    exchange.close();
  }

  private static void awaitCount(IntSupplier actual, int expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (actual.getAsInt() != expected && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(expected, actual.getAsInt());
  }
}
