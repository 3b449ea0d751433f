package agentbroker.micrometer;

import agentbroker.spi.TelemetrySink;
import agentbroker.telemetry.EventType;
import agentbroker.telemetry.TelemetryEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link TelemetrySink}.
 *
 * <p>Turns broker telemetry into meters for export to Prometheus, Grafana, Datadog, and
 * other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code agentbroker.events{type=<event type>}}: one counter per {@link EventType},
 *       e.g. {@code type=MESSAGE_SENT}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code agentbroker.queue.length{agent=<agent id>}}: pending messages per recipient,
 *       registered on the first {@link EventType#QUEUE_LENGTH_CHANGED} for that agent</li>
 * </ul>
 *
 * @see TelemetrySink
 */
public final class MicrometerTelemetrySink implements TelemetrySink, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<EventType, Counter> eventCounters = new EnumMap<>(EventType.class);
  private final Map<String, AtomicInteger> queueLengths = new ConcurrentHashMap<>();
  private final Map<String, Gauge> queueGauges = new ConcurrentHashMap<>();
  // Guards gauge registration against close() so no gauge outlives the sink.
  private final Object registrationLock = new Object();
  private volatile boolean closed;

  /**
   * Creates a sink with the default metric name prefix {@code "agentbroker"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerTelemetrySink(MeterRegistry registry) {
    this(registry, "agentbroker");
  }

  /**
   * Creates a sink with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "planner.broker"})
   */
  public MicrometerTelemetrySink(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    for (EventType type : EventType.values()) {
      eventCounters.put(type, Counter.builder(namePrefix + ".events")
          .description("Broker telemetry events by type")
          .tag("type", type.name())
          .register(registry));
    }
  }

  @Override
  public void recordEvent(TelemetryEvent event) {
    if (closed) return;
    eventCounters.get(event.eventType()).increment();
    if (event.eventType() == EventType.QUEUE_LENGTH_CHANGED && event.agentId() != null) {
      AtomicInteger queueLength = queueLength(event.agentId());
      if (queueLength != null) {
        queueLength.set(event.intDetail("queue_length", 0));
      }
    }
  }

  private AtomicInteger queueLength(String agentId) {
    AtomicInteger existing = queueLengths.get(agentId);
    if (existing != null) {
      return existing;
    }
    synchronized (registrationLock) {
      if (closed) {
        return null;
      }
      existing = queueLengths.get(agentId);
      if (existing != null) {
        return existing;
      }
      AtomicInteger value = new AtomicInteger();
      queueGauges.put(agentId, Gauge.builder(namePrefix + ".queue.length", value, AtomicInteger::get)
          .description("Pending messages per recipient")
          .tag("agent", agentId)
          .register(registry));
      queueLengths.put(agentId, value);
      return value;
    }
  }

  /**
   * Removes all meters registered by this sink from the registry.
   *
   * <p>Call this when the broker is discarded to prevent stale gauges.
   */
  @Override
  public void close() {
    List<Meter> meters;
    synchronized (registrationLock) {
      closed = true;
      meters = new ArrayList<>(eventCounters.values());
      meters.addAll(queueGauges.values());
    }
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
