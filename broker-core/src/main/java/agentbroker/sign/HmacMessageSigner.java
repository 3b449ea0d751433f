package agentbroker.sign;

import agentbroker.spi.MessageSigner;
import agentbroker.util.JsonCodec;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HMAC-SHA256 signer producing compact JWS tokens ({@code header.claims.signature}).
 *
 * <p>The header is {@code {"alg":"HS256","typ":"JWT"}} and the claims are
 * {@code {"message_id":...,"payload":...}}, each base64url-encoded without padding.
 * Verification recomputes the MAC over the received header and claims, compares it in
 * constant time, then requires both claims to equal the envelope's values.
 *
 * <p>This class is stateless and thread-safe; use {@link #INSTANCE}.
 */
public final class HmacMessageSigner implements MessageSigner {
  static final String ALGORITHM = "HS256";
  private static final String MAC_ALGORITHM = "HmacSHA256";
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  public static final HmacMessageSigner INSTANCE = new HmacMessageSigner(JsonCodec.getDefault());

  private final JsonCodec jsonCodec;
  private final String encodedHeader;

  public HmacMessageSigner(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    Map<String, String> header = new LinkedHashMap<>();
    header.put("alg", ALGORITHM);
    header.put("typ", "JWT");
    this.encodedHeader = encode(jsonCodec.toJson(header));
  }

  @Override
  public String sign(String messageId, String payload, String secretKey) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secretKey, "secretKey");
    if (secretKey.isEmpty()) {
      throw new IllegalArgumentException("secretKey cannot be empty");
    }
    Map<String, String> claims = new LinkedHashMap<>();
    claims.put("message_id", messageId);
    claims.put("payload", payload);
    String signingInput = encodedHeader + "." + encode(jsonCodec.toJson(claims));
    return signingInput + "." + ENCODER.encodeToString(mac(signingInput, secretKey));
  }

  @Override
  public boolean verify(String token, String messageId, String payload, String secretKey) {
    if (token == null || messageId == null || payload == null
        || secretKey == null || secretKey.isEmpty()) {
      return false;
    }
    String[] parts = token.split("\\.", -1);
    if (parts.length != 3) {
      return false;
    }
    try {
      Map<String, String> header = jsonCodec.parseObject(decode(parts[0]));
      if (!ALGORITHM.equals(header.get("alg"))) {
        return false;
      }
      byte[] expected = mac(parts[0] + "." + parts[1], secretKey);
      byte[] actual = DECODER.decode(parts[2]);
      if (!MessageDigest.isEqual(expected, actual)) {
        return false;
      }
      Map<String, String> claims = jsonCodec.parseObject(decode(parts[1]));
      return messageId.equals(claims.get("message_id"))
          && payload.equals(claims.get("payload"));
    } catch (IllegalArgumentException e) {
      // malformed base64, JSON or key
      return false;
    }
  }

  private static byte[] mac(String signingInput, String secretKey) {
    try {
      Mac mac = Mac.getInstance(MAC_ALGORITHM);
      mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), MAC_ALGORITHM));
      return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }

  private static String encode(String json) {
    return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  private static String decode(String part) {
    return new String(DECODER.decode(part), StandardCharsets.UTF_8);
  }
}
