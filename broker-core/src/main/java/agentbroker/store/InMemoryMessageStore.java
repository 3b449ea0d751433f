package agentbroker.store;

import agentbroker.MessageEnvelope;
import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;
import agentbroker.model.StoredMessage;
import agentbroker.spi.MessageStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ConcurrentHashMap}-based message store for tests, demos and single-process deployments.
 *
 * <p>Messages keep their insertion position for their whole lifetime, so a retried message is
 * redelivered ahead of newer ones. State transitions use {@link ConcurrentHashMap#compute},
 * which makes {@link #recordFailure} atomic per message id.
 *
 * <p>This class is thread-safe. Nothing is ever evicted.
 */
public final class InMemoryMessageStore implements MessageStore {
  private final Map<String, Entry> messages = new ConcurrentHashMap<>();
  private final ConcurrentSkipListMap<Long, String> insertionOrder = new ConcurrentSkipListMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public void saveMessage(MessageEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    long seq = sequence.incrementAndGet();
    Entry existing = messages.putIfAbsent(envelope.messageId(),
        new Entry(envelope, DeliveryState.PENDING, 0));
    if (existing != null) {
      throw new IllegalArgumentException("Duplicate messageId: " + envelope.messageId());
    }
    insertionOrder.put(seq, envelope.messageId());
  }

  @Override
  public List<MessageEnvelope> getPendingMessages(String recipient) {
    List<MessageEnvelope> pending = new ArrayList<>();
    for (String messageId : insertionOrder.values()) {
      Entry entry = messages.get(messageId);
      if (entry != null && entry.state == DeliveryState.PENDING
          && entry.envelope.recipient().equals(recipient)) {
        pending.add(entry.envelope);
      }
    }
    return pending;
  }

  @Override
  public Optional<MessageEnvelope> getMessage(String messageId) {
    Entry entry = messages.get(messageId);
    return entry == null ? Optional.empty() : Optional.of(entry.envelope);
  }

  @Override
  public boolean updateMessageState(String messageId, DeliveryState state) {
    Objects.requireNonNull(state, "state");
    return messages.computeIfPresent(messageId,
        (id, entry) -> entry.with(state, entry.retryCount)) != null;
  }

  @Override
  public boolean updateMessageState(String messageId, DeliveryState state, int retryCount) {
    Objects.requireNonNull(state, "state");
    return messages.computeIfPresent(messageId,
        (id, entry) -> entry.with(state, retryCount)) != null;
  }

  @Override
  public int getRetryCount(String messageId) {
    Entry entry = messages.get(messageId);
    return entry == null ? 0 : entry.retryCount;
  }

  @Override
  public List<MessageEnvelope> getConversationHistory(String agent1, String agent2, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<MessageEnvelope> history = new ArrayList<>();
    for (String messageId : insertionOrder.descendingMap().values()) {
      Entry entry = messages.get(messageId);
      if (entry != null && isBetween(entry.envelope, agent1, agent2)) {
        history.add(entry.envelope);
        if (history.size() == limit) {
          break;
        }
      }
    }
    Collections.reverse(history);
    return history;
  }

  @Override
  public Optional<FailureOutcome> recordFailure(String messageId, int maxRetries) {
    AtomicReference<FailureOutcome> outcome = new AtomicReference<>();
    messages.computeIfPresent(messageId, (id, entry) -> {
      FailureOutcome next = FailureOutcome.next(entry.retryCount, maxRetries);
      outcome.set(next);
      return entry.with(next.state(), next.retryCount());
    });
    return Optional.ofNullable(outcome.get());
  }

  @Override
  public List<StoredMessage> queryFailed(String recipient, int limit) {
    List<StoredMessage> failed = new ArrayList<>();
    for (String messageId : insertionOrder.values()) {
      if (failed.size() >= limit) {
        break;
      }
      Entry entry = messages.get(messageId);
      if (entry != null && entry.state == DeliveryState.FAILED
          && (recipient == null || entry.envelope.recipient().equals(recipient))) {
        failed.add(entry.toStoredMessage());
      }
    }
    return failed;
  }

  @Override
  public boolean replayFailed(String messageId) {
    AtomicReference<Boolean> replayed = new AtomicReference<>(false);
    messages.computeIfPresent(messageId, (id, entry) -> {
      if (entry.state != DeliveryState.FAILED) {
        return entry;
      }
      replayed.set(true);
      return entry.with(DeliveryState.PENDING, 0);
    });
    return replayed.get();
  }

  @Override
  public int countFailed(String recipient) {
    int count = 0;
    for (Entry entry : messages.values()) {
      if (entry.state == DeliveryState.FAILED
          && (recipient == null || entry.envelope.recipient().equals(recipient))) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the stored state of a message, for inspection.
   *
   * @param messageId the message id
   * @return the stored message, or empty if unknown
   */
  public Optional<StoredMessage> find(String messageId) {
    Entry entry = messages.get(messageId);
    return entry == null ? Optional.empty() : Optional.of(entry.toStoredMessage());
  }

  public int size() {
    return messages.size();
  }

  private static boolean isBetween(MessageEnvelope envelope, String agent1, String agent2) {
    return (envelope.sender().equals(agent1) && envelope.recipient().equals(agent2))
        || (envelope.sender().equals(agent2) && envelope.recipient().equals(agent1));
  }

  private static final class Entry {
    private final MessageEnvelope envelope;
    private final DeliveryState state;
    private final int retryCount;

    private Entry(MessageEnvelope envelope, DeliveryState state, int retryCount) {
      this.envelope = envelope;
      this.state = state;
      this.retryCount = retryCount;
    }

    private Entry with(DeliveryState newState, int newRetryCount) {
      return new Entry(envelope, newState, newRetryCount);
    }

    private StoredMessage toStoredMessage() {
      return new StoredMessage(envelope, state, retryCount);
    }
  }
}
