package agentbroker.jdbc.store;

import agentbroker.MessageEnvelope;
import agentbroker.MessageType;
import agentbroker.jdbc.DataSourceConnectionProvider;
import agentbroker.jdbc.MessageStoreException;
import agentbroker.jdbc.Schemas;
import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;
import agentbroker.model.StoredMessage;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcMessageStoreTest {

  private JdbcDataSource dataSource;
  private H2MessageStore store;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    store = new H2MessageStore(new DataSourceConnectionProvider(dataSource));

    try (Connection conn = dataSource.getConnection()) {
      Schemas.create(conn, store);
    }
  }

  private static List<String> payloads(List<MessageEnvelope> envelopes) {
    return envelopes.stream().map(MessageEnvelope::payload).collect(Collectors.toList());
  }

  // ── Persistence ─────────────────────────────────────────────────

  @Test
  void savedEnvelopeReadsBackWithAllFields() {
    MessageEnvelope envelope = MessageEnvelope.create(
        "A", "B", "line one\nline two", MessageType.RESPONSE, "c-1", "m-0", "secret");

    store.saveMessage(envelope);

    StoredMessage stored = store.find(envelope.messageId()).orElseThrow();
    MessageEnvelope read = stored.envelope();
    assertEquals(DeliveryState.PENDING, stored.state());
    assertEquals(0, stored.retryCount());
    assertEquals(envelope.messageId(), read.messageId());
    assertEquals("A", read.sender());
    assertEquals("B", read.recipient());
    assertEquals(MessageType.RESPONSE, read.messageType());
    assertEquals("line one\nline two", read.payload());
    assertEquals("c-1", read.correlationId());
    assertEquals("m-0", read.replyTo());
    assertEquals(envelope.signature(), read.signature());
    assertEquals(envelope.timestamp().toEpochMilli(), read.timestamp().toEpochMilli());
    assertTrue(read.verify("secret"));
  }

  @Test
  void duplicateMessageIdFails() {
    MessageEnvelope envelope = MessageEnvelope.create("A", "B", "hello");
    store.saveMessage(envelope);

    assertThrows(MessageStoreException.class, () -> store.saveMessage(envelope));
  }

  @Test
  void unknownMessageLookups() {
    assertTrue(store.getMessage("missing").isEmpty());
    assertEquals(0, store.getRetryCount("missing"));
    assertFalse(store.updateMessageState("missing", DeliveryState.PROCESSED));
    assertTrue(store.recordFailure("missing", 3).isEmpty());
  }

  // ── Pending queue ───────────────────────────────────────────────

  @Test
  void pendingMessagesInInsertionOrderPerRecipient() {
    store.saveMessage(MessageEnvelope.create("A", "B", "1"));
    store.saveMessage(MessageEnvelope.create("A", "C", "x"));
    store.saveMessage(MessageEnvelope.create("C", "B", "2"));
    store.saveMessage(MessageEnvelope.create("A", "B", "3"));

    assertEquals(List.of("1", "2", "3"), payloads(store.getPendingMessages("B")));
    assertEquals(3, store.countPending("B"));
    assertEquals(1, store.countPending("C"));
  }

  @Test
  void stateUpdatesChangePendingSet() {
    MessageEnvelope first = MessageEnvelope.create("A", "B", "1");
    MessageEnvelope second = MessageEnvelope.create("A", "B", "2");
    store.saveMessage(first);
    store.saveMessage(second);

    assertTrue(store.updateMessageState(first.messageId(), DeliveryState.PROCESSED));
    assertTrue(store.updateMessageState(second.messageId(), DeliveryState.PENDING, 2));

    assertEquals(List.of("2"), payloads(store.getPendingMessages("B")));
    assertEquals(2, store.getRetryCount(second.messageId()));
    assertEquals(DeliveryState.PROCESSED, store.find(first.messageId()).orElseThrow().state());
  }

  // ── Conversation history ────────────────────────────────────────

  @Test
  void historyIsChronologicalBothDirectionsAndLimited() {
    store.saveMessage(MessageEnvelope.create("A", "B", "1"));
    store.saveMessage(MessageEnvelope.create("B", "A", "2"));
    store.saveMessage(MessageEnvelope.create("A", "C", "other"));
    store.saveMessage(MessageEnvelope.create("A", "B", "3"));

    assertEquals(List.of("1", "2", "3"), payloads(store.getConversationHistory("A", "B", 10)));
    assertEquals(List.of("2", "3"), payloads(store.getConversationHistory("B", "A", 2)));
    assertTrue(store.getConversationHistory("A", "B", 0).isEmpty());
  }

  // ── Failure bookkeeping ─────────────────────────────────────────

  @Test
  void recordFailureRetriesThenFails() {
    MessageEnvelope envelope = MessageEnvelope.create("A", "B", "1");
    store.saveMessage(envelope);

    assertEquals(new FailureOutcome(DeliveryState.PENDING, 1), store.recordFailure(envelope.messageId(), 3).orElseThrow());
    assertEquals(new FailureOutcome(DeliveryState.PENDING, 2), store.recordFailure(envelope.messageId(), 3).orElseThrow());
    assertEquals(new FailureOutcome(DeliveryState.PENDING, 3), store.recordFailure(envelope.messageId(), 3).orElseThrow());
    assertEquals(new FailureOutcome(DeliveryState.FAILED, 4), store.recordFailure(envelope.messageId(), 3).orElseThrow());

    assertTrue(store.getPendingMessages("B").isEmpty());
    assertEquals(4, store.getRetryCount(envelope.messageId()));
  }

  @Test
  void concurrentFailuresAreSerialized() throws Exception {
    MessageEnvelope envelope = MessageEnvelope.create("A", "B", "1");
    store.saveMessage(envelope);
    int threads = 4;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return store.recordFailure(envelope.messageId(), 100).orElseThrow().retryCount();
        }));
      }
      start.countDown();
      List<Integer> counts = new ArrayList<>();
      for (Future<Integer> future : futures) {
        counts.add(future.get());
      }
      Collections.sort(counts);

      assertEquals(List.of(1, 2, 3, 4), counts);
    } finally {
      pool.shutdownNow();
    }
  }

  // ── Failed messages ─────────────────────────────────────────────

  @Test
  void queryReplayAndCountFailed() {
    MessageEnvelope forB = MessageEnvelope.create("A", "B", "1");
    MessageEnvelope forC = MessageEnvelope.create("A", "C", "2");
    store.saveMessage(forB);
    store.saveMessage(forC);
    store.updateMessageState(forB.messageId(), DeliveryState.FAILED, 4);
    store.updateMessageState(forC.messageId(), DeliveryState.FAILED, 4);

    assertEquals(2, store.countFailed(null));
    assertEquals(1, store.countFailed("B"));
    List<StoredMessage> failed = store.queryFailed("B", 10);
    assertEquals(1, failed.size());
    assertEquals(4, failed.get(0).retryCount());
    assertEquals(1, store.queryFailed(null, 1).size());

    assertTrue(store.replayFailed(forB.messageId()));
    assertFalse(store.replayFailed(forB.messageId()));
    assertEquals(0, store.getRetryCount(forB.messageId()));
    assertEquals(1, store.countPending("B"));
  }

  @Test
  void createdAtIsStoredAsUtcWallClock() throws SQLException {
    Instant sentAt = Instant.parse("2024-11-03T05:30:00.123456Z");
    MessageEnvelope envelope = MessageEnvelope.builder("A", "B")
        .payload("x")
        .timestamp(sentAt)
        .build();

    TimeZone original = TimeZone.getDefault();
    TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
    try {
      store.saveMessage(envelope);
    } finally {
      TimeZone.setDefault(original);
    }

    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT created_at FROM agent_message WHERE message_id = ?")) {
      ps.setString(1, envelope.messageId());
      try (ResultSet rs = ps.executeQuery()) {
        assertTrue(rs.next());
        assertEquals(LocalDateTime.ofInstant(sentAt, ZoneOffset.UTC),
            rs.getObject("created_at", LocalDateTime.class));
      }
    }
    assertEquals(sentAt, store.find(envelope.messageId()).orElseThrow().envelope().timestamp());
  }

  // ── Configuration ───────────────────────────────────────────────

  @Test
  void unboundStoreRejectsOperations() {
    H2MessageStore unbound = new H2MessageStore();

    assertFalse(unbound.isBound());
    assertThrows(IllegalStateException.class, () -> unbound.getPendingMessages("B"));
  }

  @Test
  void invalidTableNameRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new H2MessageStore("agent_message; DROP TABLE x", new DataSourceConnectionProvider(dataSource)));
  }

  @Test
  void withConnectionProviderBindsACopy() {
    AbstractJdbcMessageStore bound = new H2MessageStore()
        .withConnectionProvider(new DataSourceConnectionProvider(dataSource));
    bound.saveMessage(MessageEnvelope.create("A", "B", "hello"));

    assertTrue(bound.isBound());
    assertEquals(1, store.countPending("B"));
  }
}
