/**
 * Service provider interfaces for the broker's collaborators: persistence
 * ({@link agentbroker.spi.MessageStore}), admission ({@link agentbroker.spi.MessageValidator}),
 * observability ({@link agentbroker.spi.TelemetrySink}) and signing
 * ({@link agentbroker.spi.MessageSigner}).
 *
 * <p>Store and telemetry have null-object defaults so a broker can be assembled with any
 * subset of collaborators.
 */
package agentbroker.spi;
