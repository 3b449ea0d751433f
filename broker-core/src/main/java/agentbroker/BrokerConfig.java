package agentbroker;

/**
 * Tunables for a {@link MessageBroker} and the {@link agentbroker.consumer.InboxConsumer}s
 * draining it. All setters return {@code this} for chaining.
 */
public final class BrokerConfig {
  private int historyLimit = 10;
  private String systemAgentId = "broker";
  private long pollIntervalMs = 1000L;

  public int getHistoryLimit() {
    return historyLimit;
  }

  /**
   * Maximum number of conversation-history messages passed to the validator. Defaults to 10.
   */
  public BrokerConfig setHistoryLimit(int historyLimit) {
    if (historyLimit < 0) {
      throw new IllegalArgumentException("historyLimit must be >= 0");
    }
    this.historyLimit = historyLimit;
    return this;
  }

  public String getSystemAgentId() {
    return systemAgentId;
  }

  /**
   * Sender id of broker-synthesized error replies. Defaults to {@code "broker"}.
   */
  public BrokerConfig setSystemAgentId(String systemAgentId) {
    if (systemAgentId == null || systemAgentId.isBlank()) {
      throw new IllegalArgumentException("systemAgentId cannot be blank");
    }
    this.systemAgentId = systemAgentId;
    return this;
  }

  public long getPollIntervalMs() {
    return pollIntervalMs;
  }

  /**
   * Delay between inbox drain cycles. Defaults to 1000 ms.
   */
  public BrokerConfig setPollIntervalMs(long pollIntervalMs) {
    if (pollIntervalMs <= 0L) {
      throw new IllegalArgumentException("pollIntervalMs must be > 0");
    }
    this.pollIntervalMs = pollIntervalMs;
    return this;
  }
}
