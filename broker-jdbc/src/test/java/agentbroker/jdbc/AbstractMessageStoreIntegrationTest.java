package agentbroker.jdbc;

import agentbroker.MessageBroker;
import agentbroker.MessageEnvelope;
import agentbroker.jdbc.store.AbstractJdbcMessageStore;
import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;
import agentbroker.policy.CompositeMessageValidator;
import agentbroker.policy.PatternPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior shared by every real database. Subclasses supply a bound store over an
 * emptied {@code agent_message} table.
 */
abstract class AbstractMessageStoreIntegrationTest {

  protected abstract AbstractJdbcMessageStore store();

  @Test
  void pendingOrderAndAcknowledgement() {
    MessageBroker broker = MessageBroker.builder().store(store()).build();
    MessageEnvelope first = MessageEnvelope.create("A", "B", "1");
    broker.sendMessage(first).join();
    broker.sendMessage(MessageEnvelope.create("C", "B", "2")).join();

    List<MessageEnvelope> pending = broker.getPendingMessages("B");
    assertEquals(2, pending.size());
    assertEquals("1", pending.get(0).payload());

    broker.acknowledgeMessage(first.messageId(), "B");
    assertEquals(1, store().countPending("B"));
  }

  @Test
  void recordFailureBoundaries() {
    MessageEnvelope envelope = MessageEnvelope.create("A", "B", "x");
    store().saveMessage(envelope);

    for (int i = 1; i <= 3; i++) {
      assertEquals(new FailureOutcome(DeliveryState.PENDING, i),
          store().recordFailure(envelope.messageId(), 3).orElseThrow());
    }
    assertEquals(new FailureOutcome(DeliveryState.FAILED, 4),
        store().recordFailure(envelope.messageId(), 3).orElseThrow());
    assertTrue(store().recordFailure("missing", 3).isEmpty());
  }

  @Test
  void concurrentFailuresAreSerialized() throws Exception {
    MessageEnvelope envelope = MessageEnvelope.create("A", "B", "x");
    store().saveMessage(envelope);
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return store().recordFailure(envelope.messageId(), 100).orElseThrow().retryCount();
        }));
      }
      start.countDown();
      List<Integer> counts = new ArrayList<>();
      for (Future<Integer> future : futures) {
        counts.add(future.get());
      }
      Collections.sort(counts);
      assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8), counts);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void historyAndRejection() {
    MessageBroker broker = MessageBroker.builder()
        .store(store())
        .validator(new CompositeMessageValidator()
            .register(new PatternPolicy("no_pii", PatternPolicy.EMAIL, "contains email")))
        .build();
    broker.sendMessage(MessageEnvelope.create("A", "B", "1")).join();
    broker.sendMessage(MessageEnvelope.create("B", "A", "2")).join();
    broker.sendMessage(MessageEnvelope.create("A", "B", "me@example.com")).join();

    List<MessageEnvelope> history = store().getConversationHistory("A", "B", 10);
    assertEquals(2, history.size());
    assertEquals("1", history.get(0).payload());
    assertEquals(2, store().countPending("A"));
  }

  @Test
  void failedMessagesReplay() {
    MessageEnvelope envelope = MessageEnvelope.create("A", "B", "x");
    store().saveMessage(envelope);
    store().updateMessageState(envelope.messageId(), DeliveryState.FAILED, 4);

    assertEquals(1, store().countFailed("B"));
    assertEquals(1, store().queryFailed(null, 10).size());
    assertTrue(store().replayFailed(envelope.messageId()));
    assertEquals(0, store().getRetryCount(envelope.messageId()));
  }
}
