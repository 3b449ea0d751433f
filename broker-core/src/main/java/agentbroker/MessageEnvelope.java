package agentbroker;

import agentbroker.sign.HmacMessageSigner;
import agentbroker.spi.MessageSigner;
import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable envelope routing a payload from one agent to another.
 *
 * <p>Each envelope is assigned a ULID-based {@code messageId} by default. When a secret key is
 * supplied at creation, the envelope carries a signature over {@code (messageId, payload)};
 * the signature can never be added or replaced afterwards.
 *
 * <p>Use the {@code create} factory methods or the {@linkplain Builder builder}.
 *
 * @see MessageBroker
 * @see MessageType
 */
public final class MessageEnvelope {
  private final String messageId;
  private final String sender;
  private final String recipient;
  private final MessageType messageType;
  private final String payload;
  private final Instant timestamp;
  private final String correlationId;
  private final String replyTo;
  private final String signature;

  private MessageEnvelope(Builder builder) {
    this.messageId = builder.messageId == null ? newMessageId() : requireText(builder.messageId, "messageId");
    this.sender = requireText(builder.sender, "sender");
    this.recipient = requireText(builder.recipient, "recipient");
    this.messageType = builder.messageType == null ? MessageType.DIRECT : builder.messageType;
    this.payload = Objects.requireNonNull(builder.payload, "payload");
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.correlationId = builder.correlationId;
    this.replyTo = builder.replyTo;

    boolean signing = builder.secretKey != null && !builder.secretKey.isEmpty();
    if (signing && builder.signature != null) {
      throw new IllegalArgumentException("Set either signature or secretKey, not both");
    }
    if (signing) {
      this.signature = builder.signer.sign(messageId, payload, builder.secretKey);
    } else {
      this.signature = builder.signature;
    }
  }

  /**
   * Creates a builder for an envelope from {@code sender} to {@code recipient}.
   *
   * @param sender    the sending agent
   * @param recipient the receiving agent
   * @return a new builder
   */
  public static Builder builder(String sender, String recipient) {
    return new Builder(sender, recipient);
  }

  /**
   * Creates an unsigned {@link MessageType#DIRECT} envelope.
   */
  public static MessageEnvelope create(String sender, String recipient, String payload) {
    return builder(sender, recipient).payload(payload).build();
  }

  /**
   * Creates an unsigned envelope of the given type.
   */
  public static MessageEnvelope create(String sender, String recipient, String payload,
      MessageType messageType) {
    return builder(sender, recipient).payload(payload).messageType(messageType).build();
  }

  /**
   * Creates an envelope, signing it with the default HMAC signer when {@code secretKey}
   * is non-empty.
   *
   * @param sender        the sending agent
   * @param recipient     the receiving agent
   * @param payload       opaque payload
   * @param messageType   routing category ({@code null} for {@link MessageType#DIRECT})
   * @param correlationId optional request/response chain id
   * @param replyTo       optional id of the message being replied to
   * @param secretKey     optional shared secret
   * @return a new envelope
   */
  public static MessageEnvelope create(String sender, String recipient, String payload,
      MessageType messageType, String correlationId, String replyTo, String secretKey) {
    return builder(sender, recipient)
        .payload(payload)
        .messageType(messageType)
        .correlationId(correlationId)
        .replyTo(replyTo)
        .secretKey(secretKey)
        .build();
  }

  /**
   * Rebuilds an envelope from the mapping produced by {@link #serialize()}. The stored
   * signature is carried over as-is and not re-verified.
   *
   * @param fields serialized fields
   * @return the envelope
   * @throws IllegalArgumentException if a required field is missing or the type tag is unknown
   */
  public static MessageEnvelope deserialize(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    Object timestamp = fields.get("timestamp");
    if (!(timestamp instanceof Number seconds)) {
      throw new IllegalArgumentException("timestamp must be a number of epoch seconds");
    }
    return builder(requiredField(fields, "sender"), requiredField(fields, "recipient"))
        .messageId(requiredField(fields, "message_id"))
        .messageType(MessageType.fromTag(stringField(fields, "message_type")))
        .payload(requiredField(fields, "payload"))
        .timestamp(fromEpochSeconds(seconds.doubleValue()))
        .correlationId(stringField(fields, "correlation_id"))
        .replyTo(stringField(fields, "reply_to"))
        .signature(stringField(fields, "signature"))
        .build();
  }

  public String messageId() {
    return messageId;
  }

  public String sender() {
    return sender;
  }

  public String recipient() {
    return recipient;
  }

  public MessageType messageType() {
    return messageType;
  }

  public String payload() {
    return payload;
  }

  public Instant timestamp() {
    return timestamp;
  }

  /**
   * Returns the creation time as seconds since the epoch with sub-second precision.
   *
   * @return epoch seconds
   */
  public double timestampSeconds() {
    return timestamp.getEpochSecond() + timestamp.getNano() / 1_000_000_000.0;
  }

  public String correlationId() {
    return correlationId;
  }

  public String replyTo() {
    return replyTo;
  }

  public String signature() {
    return signature;
  }

  public boolean isSigned() {
    return signature != null;
  }

  /**
   * Verifies the signature with the default HMAC signer.
   *
   * @param secretKey the shared secret
   * @return {@code true} only if a signature is present and matches this envelope and key
   */
  public boolean verify(String secretKey) {
    return verify(secretKey, HmacMessageSigner.INSTANCE);
  }

  /**
   * Verifies the signature with the given signer. Never throws: any signer error is
   * reported as {@code false}.
   *
   * @param secretKey the shared secret
   * @param signer    the signature scheme the envelope was created with
   * @return {@code true} only if a signature is present and matches this envelope and key
   */
  public boolean verify(String secretKey, MessageSigner signer) {
    if (signature == null || secretKey == null || signer == null) {
      return false;
    }
    try {
      return signer.verify(signature, messageId, payload, secretKey);
    } catch (RuntimeException e) {
      return false;
    }
  }

  /**
   * Returns all fields as an ordered mapping for storage or transport, with
   * {@code message_type} rendered as its string tag and {@code timestamp} as epoch seconds.
   *
   * @return unmodifiable field mapping
   */
  public Map<String, Object> serialize() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("message_id", messageId);
    fields.put("sender", sender);
    fields.put("recipient", recipient);
    fields.put("message_type", messageType.tag());
    fields.put("payload", payload);
    fields.put("timestamp", timestampSeconds());
    fields.put("correlation_id", correlationId);
    fields.put("reply_to", replyTo);
    fields.put("signature", signature);
    return Collections.unmodifiableMap(fields);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageEnvelope that)) return false;
    return messageId.equals(that.messageId)
        && sender.equals(that.sender)
        && recipient.equals(that.recipient)
        && messageType == that.messageType
        && payload.equals(that.payload)
        && timestamp.equals(that.timestamp)
        && Objects.equals(correlationId, that.correlationId)
        && Objects.equals(replyTo, that.replyTo)
        && Objects.equals(signature, that.signature);
  }

  @Override
  public int hashCode() {
    return messageId.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("MessageEnvelope{messageId=").append(messageId)
        .append(", sender=").append(sender)
        .append(", recipient=").append(recipient)
        .append(", messageType=").append(messageType);
    if (correlationId != null) {
      sb.append(", correlationId=").append(correlationId);
    }
    if (replyTo != null) {
      sb.append(", replyTo=").append(replyTo);
    }
    return sb.append(", signed=").append(isSigned()).append('}').toString();
  }

  /**
   * Builder for {@link MessageEnvelope}.
   */
  public static final class Builder {
    private final String sender;
    private final String recipient;
    private String messageId;
    private MessageType messageType;
    private String payload;
    private Instant timestamp;
    private String correlationId;
    private String replyTo;
    private String secretKey;
    private MessageSigner signer = HmacMessageSigner.INSTANCE;
    private String signature;

    private Builder(String sender, String recipient) {
      this.sender = sender;
      this.recipient = recipient;
    }

    /**
     * Sets a custom message identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param messageId the message identifier
     * @return this builder
     */
    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    /**
     * Sets the routing category.
     *
     * <p>Optional. Defaults to {@link MessageType#DIRECT}.
     *
     * @param messageType the message type
     * @return this builder
     */
    public Builder messageType(MessageType messageType) {
      this.messageType = messageType;
      return this;
    }

    /**
     * Sets the opaque payload.
     *
     * <p><b>Required.</b>
     *
     * @param payload the payload
     * @return this builder
     */
    public Builder payload(String payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Sets the creation time.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param timestamp creation time
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    /**
     * Sets the shared secret used to sign the envelope at build time. An empty or
     * {@code null} key leaves the envelope unsigned. Mutually exclusive with {@link #signature}.
     *
     * @param secretKey the shared secret
     * @return this builder
     */
    public Builder secretKey(String secretKey) {
      this.secretKey = secretKey;
      return this;
    }

    /**
     * Sets the signature scheme used with {@link #secretKey}.
     *
     * <p>Optional. Defaults to {@link HmacMessageSigner#INSTANCE}.
     *
     * @param signer the signer
     * @return this builder
     */
    public Builder signer(MessageSigner signer) {
      this.signer = Objects.requireNonNull(signer, "signer");
      return this;
    }

    /**
     * Sets a previously computed signature, for rehydrating stored envelopes.
     * Mutually exclusive with {@link #secretKey}.
     *
     * @param signature the stored signature token
     * @return this builder
     */
    public Builder signature(String signature) {
      this.signature = signature;
      return this;
    }

    /**
     * Builds an immutable {@link MessageEnvelope}.
     *
     * @return a new envelope
     * @throws NullPointerException     if sender, recipient or payload is null
     * @throws IllegalArgumentException if sender, recipient or messageId is blank, or both
     *                                  {@code signature} and {@code secretKey} are set
     */
    public MessageEnvelope build() {
      return new MessageEnvelope(this);
    }
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
    return value;
  }

  private static String stringField(Map<String, ?> fields, String key) {
    Object value = fields.get(key);
    return value == null ? null : value.toString();
  }

  private static String requiredField(Map<String, ?> fields, String key) {
    String value = stringField(fields, key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return value;
  }

  private static Instant fromEpochSeconds(double seconds) {
    long whole = (long) Math.floor(seconds);
    long nanos = Math.round((seconds - whole) * 1_000_000_000.0);
    return Instant.ofEpochSecond(whole, nanos);
  }

  private static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
