package agentbroker.telemetry;

import agentbroker.spi.TelemetrySink;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TelemetrySink} that writes one log record per event through {@code java.util.logging}.
 *
 * <p>{@link EventType#MESSAGE_FAILED} and {@link EventType#MESSAGE_VALIDATION_FAILED} are
 * logged at {@link Level#WARNING}; everything else at the configured level (default
 * {@link Level#FINE}).
 */
public final class LoggingTelemetrySink implements TelemetrySink {
  private static final Logger logger = Logger.getLogger(LoggingTelemetrySink.class.getName());

  private final Level level;

  public LoggingTelemetrySink() {
    this(Level.FINE);
  }

  public LoggingTelemetrySink(Level level) {
    this.level = Objects.requireNonNull(level, "level");
  }

  @Override
  public void recordEvent(TelemetryEvent event) {
    Level effective = levelFor(event.eventType());
    if (!logger.isLoggable(effective)) {
      return;
    }
    logger.log(effective, format(event));
  }

  Level levelFor(EventType eventType) {
    switch (eventType) {
      case MESSAGE_FAILED:
      case MESSAGE_VALIDATION_FAILED:
        return Level.WARNING;
      default:
        return level;
    }
  }

  static String format(TelemetryEvent event) {
    StringBuilder sb = new StringBuilder(event.eventType().name());
    if (event.agentId() != null) {
      sb.append(" agent=").append(event.agentId());
    }
    if (event.messageId() != null) {
      sb.append(" messageId=").append(event.messageId());
    }
    if (event.correlationId() != null) {
      sb.append(" correlationId=").append(event.correlationId());
    }
    if (!event.details().isEmpty()) {
      sb.append(' ').append(event.details());
    }
    return sb.toString();
  }
}
