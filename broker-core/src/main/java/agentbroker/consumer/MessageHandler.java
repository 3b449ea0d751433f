package agentbroker.consumer;

import agentbroker.MessageEnvelope;

/**
 * Application callback that processes one delivered message.
 *
 * <p>Returning normally acknowledges the message. Throwing any exception reports a processing
 * failure, which the broker converts into a bounded retry.
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Processes a message.
   *
   * @param envelope the delivered message
   * @throws Exception to report a processing failure
   */
  void onMessage(MessageEnvelope envelope) throws Exception;
}
