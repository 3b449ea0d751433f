/**
 * Root API for agentbroker, a store-and-forward message broker for named agents.
 *
 * <h2>Core Design</h2>
 * <p>A sender builds a {@link agentbroker.MessageEnvelope} and hands it to
 * {@link agentbroker.MessageBroker#sendMessage}. Unless the envelope is an
 * {@linkplain agentbroker.MessageType#ERROR error reply}, the configured
 * {@linkplain agentbroker.spi.MessageValidator validator} decides admission. Admitted envelopes
 * are stored as PENDING for their recipient; rejected ones produce an itemized ERROR envelope
 * addressed back to the sender. Recipients drain their queue, acknowledging each envelope or
 * reporting a failure, which is retried up to {@link agentbroker.MessageBroker#MAX_RETRIES}
 * times before the envelope is marked FAILED.
 *
 * <p>Delivery is at-least-once and ordered per recipient only. Envelopes may be signed with a
 * shared secret; consumers verify signatures before processing.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>broker-core</b>: envelope, broker, SPIs, in-memory store, policies, inbox consumer</li>
 *   <li><b>broker-jdbc</b>: JDBC message stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>broker-micrometer</b>: Micrometer telemetry sink</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store = new InMemoryMessageStore();
 * var broker = MessageBroker.builder()
 *     .secretKey("shared-secret")
 *     .store(store)
 *     .telemetry(new LoggingTelemetrySink())
 *     .validator(new CompositeMessageValidator()
 *         .register(new PatternPolicy("no_pii", PatternPolicy.EMAIL, "contains email")))
 *     .build();
 *
 * broker.sendMessage(broker.newEnvelope("planner", "researcher", "find sources")).join();
 *
 * try (var inbox = InboxConsumer.builder()
 *     .broker(broker)
 *     .agentId("researcher")
 *     .handler(envelope -> System.out.println("Received: " + envelope.payload()))
 *     .build()) {
 *   inbox.start();
 *   // ...
 * }
 * }</pre>
 *
 * @see agentbroker.MessageBroker
 * @see agentbroker.MessageEnvelope
 * @see agentbroker.consumer.InboxConsumer
 * @see agentbroker.spi.MessageStore
 */
package agentbroker;
