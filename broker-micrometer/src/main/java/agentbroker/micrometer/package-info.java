/**
 * Micrometer bridge for exporting broker telemetry to Prometheus, Grafana, and other backends.
 *
 * <p>{@link agentbroker.micrometer.MicrometerTelemetrySink} implements the
 * {@link agentbroker.spi.TelemetrySink} SPI using Micrometer counters and gauges.
 *
 * @see agentbroker.micrometer.MicrometerTelemetrySink
 */
package agentbroker.micrometer;
