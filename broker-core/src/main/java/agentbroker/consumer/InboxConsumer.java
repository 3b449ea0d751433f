package agentbroker.consumer;

import agentbroker.MessageBroker;
import agentbroker.MessageEnvelope;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains one agent's pending messages from a {@link MessageBroker} and feeds them to a
 * {@link MessageHandler}.
 *
 * <p>For each pending envelope, in store order:
 * <ol>
 *   <li>If the broker has a shared secret and the signature does not verify, the envelope is
 *       logged and skipped. It stays PENDING.</li>
 *   <li>The handler is invoked. On normal return the envelope is acknowledged.</li>
 *   <li>If the handler throws, {@link MessageBroker#handleFailure} decides between redelivery on a
 *       later pass and permanent failure.</li>
 * </ol>
 *
 * <p>Call {@link #drainOnce()} directly, or {@link #start()} to drain on a daemon thread every
 * {@code pollIntervalMs}. The {@link #start()} and {@link #close()} methods are synchronized.
 *
 * @see InboxConsumer.Builder
 */
public final class InboxConsumer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(InboxConsumer.class.getName());

  private final MessageBroker broker;
  private final String agentId;
  private final MessageHandler handler;
  private final long pollIntervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> drainTask;
  private volatile boolean closed;

  private InboxConsumer(Builder builder) {
    this.broker = Objects.requireNonNull(builder.broker, "broker");
    this.agentId = Objects.requireNonNull(builder.agentId, "agentId");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    long interval = builder.pollIntervalMs != null
        ? builder.pollIntervalMs : broker.config().getPollIntervalMs();
    if (interval <= 0L) {
      throw new IllegalArgumentException("pollIntervalMs must be > 0");
    }
    this.pollIntervalMs = interval;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled drain loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("InboxConsumer has been closed");
    }
    if (drainTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new InboxThreadFactory(agentId));
    drainTask = scheduler.scheduleWithFixedDelay(this::drainSafely, 0L, pollIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Processes every envelope currently pending for this agent once.
   *
   * @return counters for this pass
   */
  public DrainResult drainOnce() {
    if (closed) {
      return DrainResult.EMPTY;
    }
    List<MessageEnvelope> pending = broker.getPendingMessages(agentId);
    int processed = 0;
    int retried = 0;
    int failed = 0;
    int rejected = 0;
    for (MessageEnvelope envelope : pending) {
      if (broker.isSigningEnabled() && !broker.verify(envelope)) {
        logger.warning("Message " + envelope.messageId() + " for " + agentId
            + " failed signature verification; skipping");
        rejected++;
        continue;
      }
      try {
        handler.onMessage(envelope);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Error processing message " + envelope.messageId()
            + " for " + agentId, e);
        if (broker.handleFailure(envelope.messageId(), agentId)) {
          retried++;
        } else {
          logger.warning("Max retries exceeded for message " + envelope.messageId());
          failed++;
        }
        continue;
      }
      broker.acknowledgeMessage(envelope.messageId(), agentId);
      processed++;
    }
    return new DrainResult(processed, retried, failed, rejected);
  }

  public String agentId() {
    return agentId;
  }

  private void drainSafely() {
    try {
      drainOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Inbox drain failed for " + agentId, t);
    }
  }

  /**
   * Stops the drain loop. A drain pass already in progress is allowed to finish.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (drainTask != null) {
      drainTask.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link InboxConsumer}. */
  public static final class Builder {
    private MessageBroker broker;
    private String agentId;
    private MessageHandler handler;
    private Long pollIntervalMs;

    private Builder() {
    }

    /**
     * Sets the broker to drain.
     *
     * <p><b>Required.</b>
     */
    public Builder broker(MessageBroker broker) {
      this.broker = broker;
      return this;
    }

    /**
     * Sets the agent whose inbox is drained.
     *
     * <p><b>Required.</b>
     */
    public Builder agentId(String agentId) {
      this.agentId = agentId;
      return this;
    }

    /**
     * Sets the callback processing each message.
     *
     * <p><b>Required.</b>
     */
    public Builder handler(MessageHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Sets the delay between drain passes when started.
     *
     * <p>Optional. Defaults to the broker's {@link agentbroker.BrokerConfig#getPollIntervalMs()}.
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    public InboxConsumer build() {
      return new InboxConsumer(this);
    }
  }
}
