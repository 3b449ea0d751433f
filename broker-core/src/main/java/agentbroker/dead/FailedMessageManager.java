package agentbroker.dead;

import agentbroker.model.StoredMessage;
import agentbroker.spi.MessageStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Operator facade for inspecting and replaying messages that exhausted their retries.
 *
 * <p>A replayed message returns to PENDING with a retry count of zero and is picked up by the
 * recipient's next drain.
 *
 * @see MessageStore#queryFailed
 * @see MessageStore#replayFailed
 * @see MessageStore#countFailed
 */
public final class FailedMessageManager {
  private static final Logger logger = Logger.getLogger(FailedMessageManager.class.getName());

  private final MessageStore store;

  public FailedMessageManager(MessageStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Queries FAILED messages.
   *
   * @param recipient optional recipient filter ({@code null} for all)
   * @param limit     maximum number of messages to return
   * @return failed messages, oldest first
   */
  public List<StoredMessage> query(String recipient, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return store.queryFailed(recipient, limit);
  }

  /**
   * Replays a single FAILED message.
   *
   * @param messageId the message to replay
   * @return {@code true} if the message was replayed, {@code false} if unknown or not FAILED
   */
  public boolean replay(String messageId) {
    Objects.requireNonNull(messageId, "messageId");
    boolean replayed = store.replayFailed(messageId);
    if (replayed) {
      logger.info("Replayed failed message " + messageId);
    }
    return replayed;
  }

  /**
   * Replays all FAILED messages for a recipient, in batches.
   *
   * @param recipient optional recipient filter ({@code null} for all)
   * @param batchSize number of messages to process per batch
   * @return total number of messages replayed
   */
  public int replayAll(String recipient, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int total = 0;
    List<StoredMessage> batch;
    do {
      batch = store.queryFailed(recipient, batchSize);
      int replayedInBatch = 0;
      for (StoredMessage message : batch) {
        if (store.replayFailed(message.messageId())) {
          replayedInBatch++;
        }
      }
      total += replayedInBatch;
      if (replayedInBatch == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    if (total > 0) {
      logger.info("Replayed " + total + " failed message(s)"
          + (recipient == null ? "" : " for " + recipient));
    }
    return total;
  }

  /**
   * Counts FAILED messages.
   *
   * @param recipient optional recipient filter ({@code null} for all)
   * @return the number of failed messages
   */
  public int count(String recipient) {
    return store.countFailed(recipient);
  }
}
