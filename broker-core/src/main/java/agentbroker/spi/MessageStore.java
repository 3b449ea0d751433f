package agentbroker.spi;

import agentbroker.MessageEnvelope;
import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;
import agentbroker.model.StoredMessage;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for envelopes and their delivery state, managing transitions
 * through the lifecycle: PENDING → PROCESSED, PENDING → (retry) PENDING, or PENDING → FAILED.
 *
 * <p>The store is the single source of truth for delivery state; the broker caches nothing.
 * Implementations must be safe for concurrent use and must apply {@link #recordFailure}
 * atomically per message id.
 *
 * <p>The {@link #NOOP} instance accepts writes and returns nothing, giving a broker that
 * admits messages without queuing them.
 *
 * @see agentbroker.store.InMemoryMessageStore
 */
public interface MessageStore {

  /**
   * Store that keeps nothing.
   */
  MessageStore NOOP = new Noop();

  /**
   * Persists an envelope with state PENDING and retry count 0.
   *
   * @param envelope the envelope to persist
   */
  void saveMessage(MessageEnvelope envelope);

  /**
   * Returns the PENDING envelopes addressed to {@code recipient}, in insertion order.
   *
   * @param recipient the receiving agent
   * @return pending envelopes, oldest first
   */
  List<MessageEnvelope> getPendingMessages(String recipient);

  /**
   * Looks up an envelope by id regardless of its state.
   *
   * @param messageId the message id
   * @return the envelope, or empty if unknown
   */
  Optional<MessageEnvelope> getMessage(String messageId);

  /**
   * Sets the delivery state, leaving the retry count unchanged.
   *
   * @param messageId the message id
   * @param state     the new state
   * @return {@code true} if a message was updated
   */
  boolean updateMessageState(String messageId, DeliveryState state);

  /**
   * Sets the delivery state and retry count.
   *
   * @param messageId  the message id
   * @param state      the new state
   * @param retryCount the new retry count
   * @return {@code true} if a message was updated
   */
  boolean updateMessageState(String messageId, DeliveryState state, int retryCount);

  /**
   * Returns the stored retry count, or 0 for unknown ids.
   *
   * @param messageId the message id
   * @return retry count
   */
  int getRetryCount(String messageId);

  /**
   * Returns up to {@code limit} of the most recent envelopes exchanged between two agents in
   * either direction, in chronological order.
   *
   * @param agent1 one participant
   * @param agent2 the other participant
   * @param limit  maximum number of envelopes
   * @return conversation history, oldest first
   */
  List<MessageEnvelope> getConversationHistory(String agent1, String agent2, int limit);

  /**
   * Atomically increments the retry count and moves the message to PENDING if the new count is
   * at most {@code maxRetries}, otherwise to FAILED.
   *
   * <p>Implementations <strong>must</strong> perform the read-increment-write as one unit
   * (transaction, row lock or compare-and-swap) so concurrent failures for the same message are
   * never lost.
   *
   * @param messageId  the message id
   * @param maxRetries retry ceiling
   * @return the new state and count, or empty if the message is unknown
   */
  Optional<FailureOutcome> recordFailure(String messageId, int maxRetries);

  /**
   * Counts PENDING envelopes for {@code recipient}.
   *
   * <p>Default returns the size of {@link #getPendingMessages}. Implementations may override
   * with a cheaper count.
   *
   * @param recipient the receiving agent
   * @return number of pending envelopes
   */
  default int countPending(String recipient) {
    return getPendingMessages(recipient).size();
  }

  /**
   * Queries FAILED messages, optionally for a single recipient.
   *
   * @param recipient optional recipient filter ({@code null} for all)
   * @param limit     maximum number of messages to return
   * @return failed messages, oldest first
   */
  default List<StoredMessage> queryFailed(String recipient, int limit) {
    return List.of();
  }

  /**
   * Resets a FAILED message to PENDING with retry count 0. Messages in any other state are
   * left untouched.
   *
   * @param messageId the message id
   * @return {@code true} if the message was replayed
   */
  default boolean replayFailed(String messageId) {
    return false;
  }

  /**
   * Counts FAILED messages, optionally for a single recipient.
   *
   * @param recipient optional recipient filter ({@code null} for all)
   * @return number of failed messages
   */
  default int countFailed(String recipient) {
    return 0;
  }

  /**
   * Returns {@code true} if this store persists nothing.
   *
   * @return whether this is a no-op store
   */
  default boolean isNoop() {
    return false;
  }

  /**
   * Store that discards all writes.
   */
  final class Noop implements MessageStore {
    private Noop() {
    }

    @Override
    public void saveMessage(MessageEnvelope envelope) {
    }

    @Override
    public List<MessageEnvelope> getPendingMessages(String recipient) {
      return List.of();
    }

    @Override
    public Optional<MessageEnvelope> getMessage(String messageId) {
      return Optional.empty();
    }

    @Override
    public boolean updateMessageState(String messageId, DeliveryState state) {
      return false;
    }

    @Override
    public boolean updateMessageState(String messageId, DeliveryState state, int retryCount) {
      return false;
    }

    @Override
    public int getRetryCount(String messageId) {
      return 0;
    }

    @Override
    public List<MessageEnvelope> getConversationHistory(String agent1, String agent2, int limit) {
      return List.of();
    }

    @Override
    public Optional<FailureOutcome> recordFailure(String messageId, int maxRetries) {
      return Optional.empty();
    }

    @Override
    public boolean isNoop() {
      return true;
    }
  }
}
