package agentbroker;

import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;
import agentbroker.policy.PolicyViolation;
import agentbroker.policy.ValidationContext;
import agentbroker.policy.ValidationResult;
import agentbroker.sign.HmacMessageSigner;
import agentbroker.spi.MessageSigner;
import agentbroker.spi.MessageStore;
import agentbroker.spi.MessageValidator;
import agentbroker.spi.TelemetrySink;
import agentbroker.telemetry.EventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Store-and-forward broker for inter-agent messages.
 *
 * <p>On {@link #sendMessage} the broker validates the envelope (unless it is an
 * {@link MessageType#ERROR} reply or no validator is configured), then either queues it as
 * PENDING for its recipient or sends an itemized ERROR reply back to the sender. Recipients
 * drain their queue with {@link #getPendingMessages}, then {@link #acknowledgeMessage} each
 * envelope or report it through {@link #handleFailure}, which retries up to
 * {@link #MAX_RETRIES} times before marking it FAILED. Every transition is reported to the
 * {@link TelemetrySink}.
 *
 * <p>All collaborators are optional. Without a store the broker runs in
 * <em>pass-through mode</em>: messages are validated and accepted but never queued, and
 * {@link #getPendingMessages} always returns an empty list.
 *
 * <p>This class holds no per-call mutable state and is safe to share between threads,
 * provided the store and telemetry sink are. Create instances via {@link #builder()}.
 *
 * @see MessageBroker.Builder
 * @see agentbroker.consumer.InboxConsumer
 */
public final class MessageBroker {
  private static final Logger logger = Logger.getLogger(MessageBroker.class.getName());

  /** Maximum number of redeliveries before a message is marked FAILED. */
  public static final int MAX_RETRIES = 3;

  private final String secretKey;
  private final MessageSigner signer;
  private final MessageStore store;
  private final TelemetrySink telemetry;
  private final MessageValidator validator;
  private final BrokerConfig config;

  private MessageBroker(Builder builder) {
    this.secretKey = builder.secretKey == null || builder.secretKey.isEmpty() ? null : builder.secretKey;
    this.signer = builder.signer != null ? builder.signer : HmacMessageSigner.INSTANCE;
    this.store = builder.store != null ? builder.store : MessageStore.NOOP;
    this.telemetry = builder.telemetry != null ? builder.telemetry : TelemetrySink.NOOP;
    this.validator = builder.validator;
    this.config = builder.config != null ? builder.config : new BrokerConfig();
    if (store.isNoop()) {
      logger.info("No message store configured; broker runs in pass-through mode");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Validates and queues a message for delivery.
   *
   * <p>The returned future completes once the message has been queued or, if rejected, once the
   * ERROR reply has been stored. A rejection is a normal completion, not an exceptional one.
   * Store and validator failures complete the future exceptionally.
   *
   * @param envelope the message to send
   * @return future completing when admission has been decided and persisted
   */
  public CompletableFuture<Void> sendMessage(MessageEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    if (envelope.messageType() == MessageType.ERROR || validator == null) {
      return runNow(() -> admit(envelope));
    }
    CompletionStage<ValidationResult> validation;
    try {
      validation = validator.validate(envelope, buildValidationContext(envelope));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return validation.toCompletableFuture().thenAccept(result -> {
      if (result.valid()) {
        admit(envelope);
      } else {
        reject(envelope, result.violations());
      }
    });
  }

  /**
   * Returns the envelopes currently PENDING for {@code recipient}, in store order.
   *
   * @param recipient the receiving agent
   * @return pending envelopes; empty in pass-through mode
   */
  public List<MessageEnvelope> getPendingMessages(String recipient) {
    Objects.requireNonNull(recipient, "recipient");
    return store.getPendingMessages(recipient);
  }

  /**
   * Marks a message as successfully processed. Unknown ids are ignored.
   *
   * @param messageId the processed message
   * @param recipient the agent that processed it
   */
  public void acknowledgeMessage(String messageId, String recipient) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(recipient, "recipient");
    Optional<MessageEnvelope> found = store.getMessage(messageId);
    if (found.isEmpty()) {
      logger.fine(() -> "Acknowledge ignored for unknown messageId=" + messageId);
      return;
    }
    MessageEnvelope message = found.get();
    int previousLength = store.countPending(recipient);
    store.updateMessageState(messageId, DeliveryState.PROCESSED);
    int queueLength = store.countPending(recipient);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("sender", message.sender());
    details.put("message_type", message.messageType().tag());
    emit(EventType.MESSAGE_PROCESSED, message.correlationId(), recipient, messageId, details);
    emitQueueLength(recipient, previousLength, queueLength);
  }

  /**
   * Records a processing failure and decides whether the caller should retry.
   *
   * <p>The retry count is incremented atomically by the store. While it stays at or below
   * {@link #MAX_RETRIES} the message returns to PENDING and this method returns {@code true};
   * past the ceiling the message is marked FAILED and this method returns {@code false}.
   * Consumers must stop retrying once {@code false} is returned.
   *
   * @param messageId the message that failed
   * @param recipient the agent that failed to process it
   * @return {@code true} if the message will be redelivered
   */
  public boolean handleFailure(String messageId, String recipient) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(recipient, "recipient");
    if (store.isNoop()) {
      return false;
    }
    Optional<MessageEnvelope> found = store.getMessage(messageId);
    if (found.isEmpty()) {
      return false;
    }
    MessageEnvelope message = found.get();
    Optional<FailureOutcome> recorded = store.recordFailure(messageId, MAX_RETRIES);
    if (recorded.isEmpty()) {
      return false;
    }
    FailureOutcome outcome = recorded.get();

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("retry_count", outcome.retryCount());
    details.put("max_retries", MAX_RETRIES);
    if (outcome.willRetry()) {
      logger.fine(() -> "Message " + messageId + " re-queued, retry " + outcome.retryCount()
          + "/" + MAX_RETRIES);
      emit(EventType.RETRY, message.correlationId(), recipient, messageId, details);
      return true;
    }

    logger.warning(() -> "Message " + messageId + " marked FAILED after "
        + outcome.retryCount() + " attempts");
    details.put("sender", message.sender());
    details.put("message_type", message.messageType().tag());
    emit(EventType.MESSAGE_FAILED, message.correlationId(), recipient, messageId, details);
    return false;
  }

  /**
   * Returns {@code true} if a shared secret is configured, meaning envelopes created by the
   * broker are signed and consumers should verify what they receive.
   *
   * @return whether signing is enabled
   */
  public boolean isSigningEnabled() {
    return secretKey != null;
  }

  /**
   * Verifies an envelope against the broker's secret and signer.
   *
   * @param envelope the envelope to check
   * @return {@code false} if signing is disabled or the signature is absent or invalid
   */
  public boolean verify(MessageEnvelope envelope) {
    return secretKey != null && envelope.verify(secretKey, signer);
  }

  /**
   * Creates a DIRECT envelope from {@code sender}, signed with the broker's secret if one is set.
   *
   * @param sender    the sending agent
   * @param recipient the receiving agent
   * @param payload   the payload
   * @return a new envelope
   */
  public MessageEnvelope newEnvelope(String sender, String recipient, String payload) {
    return MessageEnvelope.builder(sender, recipient)
        .payload(payload)
        .signer(signer)
        .secretKey(secretKey)
        .build();
  }

  public MessageStore store() {
    return store;
  }

  public BrokerConfig config() {
    return config;
  }

  ValidationContext buildValidationContext(MessageEnvelope envelope) {
    Instant now = Instant.now();
    if (store.isNoop()) {
      return ValidationContext.withoutHistory(now);
    }
    try {
      List<MessageEnvelope> history = store.getConversationHistory(
          envelope.sender(), envelope.recipient(), config.getHistoryLimit());
      return new ValidationContext(now, history);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to load conversation history for "
          + envelope.sender() + " -> " + envelope.recipient() + "; validating without it", e);
      return ValidationContext.withoutHistory(now);
    }
  }

  MessageEnvelope createErrorResponse(MessageEnvelope original, List<PolicyViolation> violations) {
    List<String> lines = new ArrayList<>(violations.size());
    for (PolicyViolation violation : violations) {
      lines.add(violation.describe());
    }
    String text = "Your message to " + original.recipient()
        + " was rejected due to policy violations:\n\n"
        + String.join("\n", lines)
        + "\n\nPlease modify your message and try again.";
    return MessageEnvelope.builder(config.getSystemAgentId(), original.sender())
        .payload(text)
        .messageType(MessageType.ERROR)
        .correlationId(original.correlationId())
        .replyTo(original.messageId())
        .signer(signer)
        .secretKey(secretKey)
        .build();
  }

  private void admit(MessageEnvelope envelope) {
    if (store.isNoop()) {
      logger.fine(() -> "Accepted " + envelope.messageId() + " without queuing (no store)");
      return;
    }
    int previousLength = store.countPending(envelope.recipient());
    store.saveMessage(envelope);
    int queueLength = store.countPending(envelope.recipient());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("recipient", envelope.recipient());
    details.put("message_type", envelope.messageType().tag());
    emit(EventType.MESSAGE_SENT, envelope.correlationId(), envelope.sender(),
        envelope.messageId(), details);
    emitQueueLength(envelope.recipient(), previousLength, queueLength);
  }

  private void reject(MessageEnvelope envelope, List<PolicyViolation> violations) {
    MessageEnvelope error = createErrorResponse(envelope, violations);
    store.saveMessage(error);
    logger.fine(() -> "Rejected " + envelope.messageId() + " from " + envelope.sender()
        + ": " + violations.size() + " violation(s)");

    List<Map<String, String>> violationDetails = new ArrayList<>(violations.size());
    for (PolicyViolation violation : violations) {
      Map<String, String> entry = new LinkedHashMap<>();
      entry.put("policy", violation.policyName());
      entry.put("reason", violation.reason());
      violationDetails.add(entry);
    }
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("recipient", envelope.recipient());
    details.put("violations", violationDetails);
    emit(EventType.MESSAGE_VALIDATION_FAILED, envelope.correlationId(), envelope.sender(),
        envelope.messageId(), details);
  }

  private void emitQueueLength(String agentId, int previousLength, int queueLength) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("queue_length", queueLength);
    details.put("previous_length", previousLength);
    emit(EventType.QUEUE_LENGTH_CHANGED, null, agentId, null, details);
  }

  private void emit(EventType eventType, String correlationId, String agentId, String messageId,
      Map<String, Object> details) {
    try {
      telemetry.recordEvent(eventType, correlationId, agentId, messageId, details);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Telemetry sink failed to record " + eventType, e);
    }
  }

  private static CompletableFuture<Void> runNow(Runnable action) {
    try {
      action.run();
      return CompletableFuture.completedFuture(null);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Builder for {@link MessageBroker}. */
  public static final class Builder {
    private String secretKey;
    private MessageSigner signer;
    private MessageStore store;
    private TelemetrySink telemetry;
    private MessageValidator validator;
    private BrokerConfig config;

    private Builder() {
    }

    /**
     * Sets the shared secret used to sign broker-created envelopes and verify received ones.
     *
     * <p>Optional. Defaults to none (signing disabled).
     *
     * @param secretKey the shared secret
     * @return this builder
     */
    public Builder secretKey(String secretKey) {
      this.secretKey = secretKey;
      return this;
    }

    /**
     * Sets the signature scheme.
     *
     * <p>Optional. Defaults to {@link HmacMessageSigner#INSTANCE}.
     *
     * @param signer the signer
     * @return this builder
     */
    public Builder signer(MessageSigner signer) {
      this.signer = signer;
      return this;
    }

    /**
     * Sets the store holding envelopes and delivery state.
     *
     * <p>Optional. Defaults to {@link MessageStore#NOOP} (pass-through mode).
     *
     * @param store the message store
     * @return this builder
     */
    public Builder store(MessageStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the telemetry sink.
     *
     * <p>Optional. Defaults to {@link TelemetrySink#NOOP}.
     *
     * @param telemetry the telemetry sink
     * @return this builder
     */
    public Builder telemetry(TelemetrySink telemetry) {
      this.telemetry = telemetry;
      return this;
    }

    /**
     * Sets the admission validator.
     *
     * <p>Optional. Defaults to none (every message is admitted).
     *
     * @param validator the validator
     * @return this builder
     */
    public Builder validator(MessageValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Sets broker tunables.
     *
     * <p>Optional. Defaults to a new {@link BrokerConfig}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(BrokerConfig config) {
      this.config = config;
      return this;
    }

    public MessageBroker build() {
      return new MessageBroker(this);
    }
  }
}
