package agentbroker.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for flat {@code Map<String, String>} objects.
 * Has no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()}. Output is compact (no whitespace) and deterministic for a
 * given map iteration order, which signature computation relies on.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    Cursor cursor = new Cursor(trimmed);
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    cursor.skipWhitespace();
    if (cursor.peek() == '}') {
      cursor.next();
      cursor.expectEnd();
      return result;
    }
    while (true) {
      cursor.skipWhitespace();
      if (cursor.peek() != '"') {
        throw new IllegalArgumentException("Expected string key at " + cursor.index);
      }
      cursor.next();
      String key = cursor.readString();
      cursor.skipWhitespace();
      cursor.expect(':');
      cursor.skipWhitespace();
      if (cursor.consumeLiteral("null")) {
        // null values are dropped
      } else if (cursor.peek() == '"') {
        cursor.next();
        result.put(key, cursor.readString());
      } else {
        throw new IllegalArgumentException("Expected string value or null at " + cursor.index);
      }
      cursor.skipWhitespace();
      char separator = cursor.next();
      if (separator == '}') {
        cursor.expectEnd();
        return result;
      }
      if (separator != ',') {
        throw new IllegalArgumentException("Expected ',' or '}' at " + (cursor.index - 1));
      }
    }
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int index;

    private Cursor(String input) {
      this.input = input;
    }

    private char peek() {
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return input.charAt(index);
    }

    private char next() {
      char c = peek();
      index++;
      return c;
    }

    private void expect(char expected) {
      char actual = next();
      if (actual != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + (index - 1));
      }
    }

    private void expectEnd() {
      skipWhitespace();
      if (index != input.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON object");
      }
    }

    private boolean consumeLiteral(String literal) {
      if (input.startsWith(literal, index)) {
        index += literal.length();
        return true;
      }
      return false;
    }

    private void skipWhitespace() {
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        index++;
      }
    }

    /** Reads string content after the opening quote, consuming the closing quote. */
    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char escaped = next();
        switch (escaped) {
          case '"':
          case '\\':
          case '/':
            sb.append(escaped);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (index + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(index, index + 4);
            try {
              sb.append((char) Integer.parseInt(hex, 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            index += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
    }
  }
}
