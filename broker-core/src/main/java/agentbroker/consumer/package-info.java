/**
 * Receive side of the broker: a polling loop that verifies, processes, acknowledges and
 * retries one agent's pending messages.
 *
 * @see agentbroker.consumer.InboxConsumer
 */
package agentbroker.consumer;
