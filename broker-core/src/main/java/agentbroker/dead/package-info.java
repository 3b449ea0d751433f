/**
 * Inspection and replay of messages that exhausted their retries.
 */
package agentbroker.dead;
