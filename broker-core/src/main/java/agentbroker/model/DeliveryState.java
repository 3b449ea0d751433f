package agentbroker.model;

/**
 * Delivery state of a persisted message. Codes are stable and used as the stored column value.
 */
public enum DeliveryState {
  PENDING(0),
  PROCESSED(1),
  FAILED(2);

  private final int code;

  DeliveryState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static DeliveryState fromCode(int code) {
    for (DeliveryState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown delivery state code: " + code);
  }
}
