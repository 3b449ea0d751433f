package agentbroker.model;

/**
 * Result of atomically recording a processing failure: the new state and retry count.
 *
 * @param state      {@link DeliveryState#PENDING} if the message will be retried,
 *                   {@link DeliveryState#FAILED} once the retry ceiling is exceeded
 * @param retryCount the retry count after the increment
 * @see agentbroker.spi.MessageStore#recordFailure
 */
public record FailureOutcome(DeliveryState state, int retryCount) {

  /**
   * Computes the outcome for a failure given the stored retry count before the increment.
   *
   * @param previousRetryCount retry count currently stored
   * @param maxRetries         retry ceiling
   * @return the outcome to persist
   */
  public static FailureOutcome next(int previousRetryCount, int maxRetries) {
    int retryCount = previousRetryCount + 1;
    DeliveryState state = retryCount <= maxRetries ? DeliveryState.PENDING : DeliveryState.FAILED;
    return new FailureOutcome(state, retryCount);
  }

  public boolean willRetry() {
    return state == DeliveryState.PENDING;
  }
}
