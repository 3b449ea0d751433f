/**
 * Telemetry event model and the built-in logging sink.
 *
 * <p>A Micrometer-backed sink lives in the {@code broker-micrometer} module.
 *
 * @see agentbroker.spi.TelemetrySink
 */
package agentbroker.telemetry;
