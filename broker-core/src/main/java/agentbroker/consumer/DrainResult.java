package agentbroker.consumer;

/**
 * Counters for one {@link InboxConsumer#drainOnce()} pass.
 *
 * @param processed messages handled and acknowledged
 * @param retried   messages that failed and were re-queued
 * @param failed    messages that failed and exhausted their retries
 * @param rejected  messages skipped because their signature did not verify
 */
public record DrainResult(int processed, int retried, int failed, int rejected) {

  public static final DrainResult EMPTY = new DrainResult(0, 0, 0, 0);

  public int total() {
    return processed + retried + failed + rejected;
  }
}
