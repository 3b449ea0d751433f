package agentbroker.telemetry;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoggingTelemetrySinkTest {

  @Test
  void failuresLogAtWarningOthersAtConfiguredLevel() {
    LoggingTelemetrySink sink = new LoggingTelemetrySink(Level.INFO);

    assertEquals(Level.WARNING, sink.levelFor(EventType.MESSAGE_FAILED));
    assertEquals(Level.WARNING, sink.levelFor(EventType.MESSAGE_VALIDATION_FAILED));
    assertEquals(Level.INFO, sink.levelFor(EventType.MESSAGE_SENT));
    assertEquals(Level.INFO, sink.levelFor(EventType.RETRY));
  }

  @Test
  void formatIncludesPresentFieldsOnly() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("queue_length", 2);
    details.put("previous_length", 1);
    TelemetryEvent event = new TelemetryEvent(EventType.QUEUE_LENGTH_CHANGED, Instant.now(),
        null, "B", null, details);

    assertEquals("QUEUE_LENGTH_CHANGED agent=B {queue_length=2, previous_length=1}",
        LoggingTelemetrySink.format(event));
  }

  @Test
  void formatWithIdsAndNoDetails() {
    TelemetryEvent event = new TelemetryEvent(EventType.MESSAGE_SENT, Instant.now(),
        "c-1", "A", "m-1", null);

    assertEquals("MESSAGE_SENT agent=A messageId=m-1 correlationId=c-1",
        LoggingTelemetrySink.format(event));
  }

  @Test
  void recordEventDoesNotThrow() {
    LoggingTelemetrySink sink = new LoggingTelemetrySink();

    assertDoesNotThrow(() -> sink.recordEvent(EventType.MESSAGE_FAILED, null, "B", "m-1",
        Map.of("retry_count", 4)));
  }

  @Test
  void eventDetailsAreCopiedAndReadable() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("retry_count", 2);
    TelemetryEvent event = new TelemetryEvent(EventType.RETRY, Instant.now(), null, "B", "m-1", details);
    details.put("retry_count", 9);

    assertEquals(2, event.intDetail("retry_count", -1));
    assertEquals(-1, event.intDetail("missing", -1));
  }
}
