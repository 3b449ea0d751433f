package agentbroker.spi;

/**
 * Keyed signature scheme over an envelope's {@code (messageId, payload)} pair.
 *
 * <p>Implementations must be stateless and thread-safe. {@link #verify} must fail closed:
 * any malformed token, key mismatch or claim mismatch yields {@code false}, never an exception.
 *
 * @see agentbroker.sign.HmacMessageSigner
 */
public interface MessageSigner {

  /**
   * Produces a signature token binding {@code messageId} and {@code payload} to {@code secretKey}.
   *
   * @param messageId the envelope identifier
   * @param payload   the envelope payload
   * @param secretKey the shared secret (non-empty)
   * @return the signature token
   * @throws IllegalArgumentException if {@code secretKey} is empty
   */
  String sign(String messageId, String payload, String secretKey);

  /**
   * Checks that {@code token} was produced by {@link #sign} for exactly these values and key.
   *
   * @param token     the signature token, may be {@code null}
   * @param messageId the envelope identifier
   * @param payload   the envelope payload
   * @param secretKey the shared secret, may be {@code null}
   * @return {@code true} only if the token is well-formed, authentic and matches both values
   */
  boolean verify(String token, String messageId, String payload, String secretKey);
}
