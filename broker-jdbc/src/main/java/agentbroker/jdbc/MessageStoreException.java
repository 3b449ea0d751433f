package agentbroker.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by the JDBC message stores.
 */
public final class MessageStoreException extends RuntimeException {
  public MessageStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
