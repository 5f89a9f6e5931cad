package tracking.util;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} for flat objects.
 *
 * <p>Accepts string, number, boolean and {@code null} member values; numbers and booleans
 * are returned in their literal textual form ({@code 1}, {@code 2.50}, {@code true}).
 * Nested objects and arrays are rejected.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder(values.size() * 24);
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object keys cannot be null");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendQuoted(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendQuoted(sb, entry.getValue());
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
    return new Cursor(trimmed).readObject();
  }

  private static void appendQuoted(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  /** Single-pass reader over one JSON document. Not thread-safe; one instance per parse. */
  private static final class Cursor {
    private final String in;
    private int pos;

    Cursor(String in) {
      this.in = in;
    }

    Map<String, String> readObject() {
      skipWhitespace();
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at offset " + pos);
        }
        pos++;
        String key = readString();
        skipWhitespace();
        expect(':');
        skipWhitespace();
        String value = readScalar();
        if (value != null) {
          result.put(key, value);
        }
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at offset " + (pos - 1));
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      skipWhitespace();
      if (pos != in.length()) {
        throw new IllegalArgumentException("Trailing content after JSON object");
      }
      return result;
    }

    private String readScalar() {
      char c = peek();
      if (c == '"') {
        pos++;
        return readString();
      }
      if (c == '{' || c == '[') {
        throw new IllegalArgumentException("Nested values are not supported at offset " + pos);
      }
      if (in.startsWith("null", pos)) {
        pos += 4;
        return null;
      }
      if (in.startsWith("true", pos)) {
        pos += 4;
        return "true";
      }
      if (in.startsWith("false", pos)) {
        pos += 5;
        return "false";
      }
      return readNumber();
    }

    private String readNumber() {
      int start = pos;
      while (pos < in.length()) {
        char c = in.charAt(pos);
        if ((c >= '0' && c <= '9') || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E') {
          pos++;
        } else {
          break;
        }
      }
      if (start == pos) {
        throw new IllegalArgumentException("Expected value at offset " + start);
      }
      String literal = in.substring(start, pos);
      try {
        new BigDecimal(literal);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + literal, e);
      }
      return literal;
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (pos < in.length()) {
        char c = in.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= in.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char esc = in.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > in.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(in.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void skipWhitespace() {
      while (pos < in.length()) {
        char c = in.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        pos++;
      }
    }

    private char peek() {
      if (pos >= in.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return in.charAt(pos);
    }

    private void expect(char c) {
      if (peek() != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at offset " + pos);
      }
      pos++;
    }
  }
}
