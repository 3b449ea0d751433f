package agentbroker.util;

import java.util.Map;

/**
 * Encodes and decodes the flat JSON objects inside signature tokens: the JOSE header and the
 * {@code message_id}/{@code payload} claims.
 *
 * <p>Signatures are computed over the encoded bytes, so an implementation must emit compact
 * output in map iteration order. Plug in a different codec through
 * {@link agentbroker.sign.HmacMessageSigner#HmacMessageSigner(JsonCodec)}.
 */
public interface JsonCodec {

  /** The built-in {@link DefaultJsonCodec}. */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Renders {@code values} as a compact JSON object; {@code "{}"} for null or empty input.
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object whose values are strings or {@code null}. Null members are omitted
   * from the result; blank input and the literal {@code null} give an empty map.
   *
   * @throws IllegalArgumentException if the input is not such an object
   */
  Map<String, String> parseObject(String json);
}
