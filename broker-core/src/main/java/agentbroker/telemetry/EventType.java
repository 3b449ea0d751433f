package agentbroker.telemetry;

/**
 * State transitions reported by the broker.
 */
public enum EventType {
  MESSAGE_SENT,
  MESSAGE_VALIDATION_FAILED,
  MESSAGE_PROCESSED,
  MESSAGE_FAILED,
  QUEUE_LENGTH_CHANGED,
  RETRY
}
