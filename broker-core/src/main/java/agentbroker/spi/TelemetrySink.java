package agentbroker.spi;

import agentbroker.telemetry.EventType;
import agentbroker.telemetry.TelemetryEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Observability hook receiving a structured event for every broker state transition.
 *
 * <p>The {@link #NOOP} instance discards all events. Implement this interface to bridge into
 * logs, Micrometer, OpenTelemetry or an audit table. The broker treats emission as
 * fire-and-forget: a sink that throws is logged and otherwise ignored.
 *
 * @see agentbroker.telemetry.LoggingTelemetrySink
 */
@FunctionalInterface
public interface TelemetrySink {

  /**
   * No-op instance that discards all events.
   */
  TelemetrySink NOOP = event -> {
  };

  /**
   * Records an event.
   *
   * @param event the event
   */
  void recordEvent(TelemetryEvent event);

  /**
   * Records an event stamped with the current time.
   *
   * @param eventType     what happened
   * @param correlationId correlation id, may be {@code null}
   * @param agentId       attributed agent, may be {@code null}
   * @param messageId     message involved, may be {@code null}
   * @param details       event-specific attributes, may be {@code null}
   */
  default void recordEvent(EventType eventType, String correlationId, String agentId,
      String messageId, Map<String, Object> details) {
    recordEvent(new TelemetryEvent(eventType, Instant.now(), correlationId, agentId, messageId, details));
  }
}
