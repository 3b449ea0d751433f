package agentbroker.consumer;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon drain threads of an {@link InboxConsumer}, named
 * {@code agentbroker-inbox-<agentId>-<n>}. Anything escaping the drain loop is logged
 * against the agent.
 */
final class InboxThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(InboxThreadFactory.class.getName());

  private final String agentId;
  private final AtomicInteger counter = new AtomicInteger(1);

  InboxThreadFactory(String agentId) {
    this.agentId = agentId;
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, "agentbroker-inbox-" + agentId + "-" + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Inbox thread " + t.getName() + " for " + agentId + " died", e));
    return thread;
  }
}
