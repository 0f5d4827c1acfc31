package com.rottenpotatoes.intake.infrastructure.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rottenpotatoes.intake.application.port.EventSink;
import com.rottenpotatoes.intake.application.port.MetricsPort;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import com.rottenpotatoes.intake.infrastructure.exec.ExecutorFactories;
import com.rottenpotatoes.intake.validation.Numbers;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Best-effort sink posting one JSON document per event to a remote search index.
 * <p><strong>Why:</strong> Remote indexing must never become a reliability dependency of review intake, so
 * delivery is at most once and fire-and-forget.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize the event envelope plus fields with Jackson and {@code POST} it asynchronously.</li>
 *   <li>Bound each request by the configured timeout and the number of outstanding requests.</li>
 *   <li>Count and DEBUG-log non-2xx responses, I/O errors, and timeouts; never rethrow them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent writers.</p>
 * <p><strong>Observability:</strong> {@code events.remote.sent}, {@code events.remote.failed},
 * {@code events.remote.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class HttpEventSink implements EventSink {
  private static final Logger log = LoggerFactory.getLogger(HttpEventSink.class);
  private static final int CALLBACK_THREADS = 2;

  private final URI endpoint;
  private final Duration timeout;
  private final int maxInFlight;
  private final MetricsPort metrics;
  private final ObjectMapper mapper;
  private final HttpClient client;
  private final ExecutorService executor;
  private final Semaphore permits;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a sink with its own HTTP client and daemon callback pool.
   *
   * @param endpoint absolute {@code http(s)} URL of the index write endpoint
   * @param timeout per-request bound covering connect and response
   * @param maxInFlight maximum outstanding requests; further events are dropped
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   * @param mapper JSON mapper used for documents
   */
  public HttpEventSink(URI endpoint, Duration timeout, int maxInFlight, MetricsPort metrics, ObjectMapper mapper) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.maxInFlight = (int) Numbers.requireRange("remoteSink.maxInFlight", maxInFlight, 1, 10_000);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.executor = ExecutorFactories.newSinkPool(CALLBACK_THREADS, "intake-remote-sink");
    this.client = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .executor(executor)
        .build();
    this.permits = new Semaphore(this.maxInFlight);
  }

  @Override
  public Kind kind() {
    return Kind.REMOTE;
  }

  @Override
  public void write(LogEvent event) {
    Objects.requireNonNull(event, "event");
    if (closed.get() || !permits.tryAcquire()) {
      metrics.increment("events.remote.dropped");
      return;
    }
    byte[] body;
    try {
      body = mapper.writeValueAsBytes(event.toDocument());
    } catch (JsonProcessingException ex) {
      permits.release();
      failed("serialization", ex);
      return;
    }
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
        .build();
    try {
      client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
          .whenComplete((response, error) -> {
            permits.release();
            if (error != null) {
              failed("transport", error);
            } else if (response.statusCode() / 100 != 2) {
              metrics.increment("events.remote.failed");
              log.debug("Remote sink {} answered HTTP {}", endpoint, response.statusCode());
            } else {
              metrics.increment("events.remote.sent");
            }
          });
    } catch (RuntimeException ex) {
      permits.release();
      failed("dispatch", ex);
    }
  }

  /**
   * Stops accepting events and waits up to the request timeout for outstanding deliveries.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      if (permits.tryAcquire(maxInFlight, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        permits.release(maxInFlight);
      } else {
        log.debug("Remote sink closed with deliveries still outstanding");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      executor.shutdownNow();
    }
  }

  int availablePermits() {
    return permits.availablePermits();
  }

  private void failed(String stage, Throwable error) {
    metrics.increment("events.remote.failed");
    log.debug("Remote sink {} {} failure: {}", endpoint, stage, error.toString());
  }
}
