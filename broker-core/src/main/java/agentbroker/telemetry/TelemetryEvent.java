package agentbroker.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured record of a single broker state transition.
 *
 * @param eventType     what happened
 * @param timestamp     when it was recorded
 * @param correlationId correlation id of the message involved, if any
 * @param agentId       agent the event is attributed to, if any
 * @param messageId     message involved, if any
 * @param details       event-specific attributes (insertion-ordered, unmodifiable)
 */
public record TelemetryEvent(
    EventType eventType,
    Instant timestamp,
    String correlationId,
    String agentId,
    String messageId,
    Map<String, Object> details
) {
  public TelemetryEvent {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(timestamp, "timestamp");
    details = details == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Returns a detail value as an int, or {@code defaultValue} if absent or not a number.
   *
   * @param key          detail key
   * @param defaultValue fallback value
   * @return the detail value
   */
  public int intDetail(String key, int defaultValue) {
    Object value = details.get(key);
    return value instanceof Number n ? n.intValue() : defaultValue;
  }
}
