package relay.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat objects of scalar values.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      writeString(sb, entry.getKey());
      sb.append(':');
      writeValue(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(json.trim());
    in.skipWhitespace();
    in.expect('{');
    Map<String, Object> result = new LinkedHashMap<>();
    in.skipWhitespace();
    if (in.peek() == '}') {
      in.pos++;
      return finish(in, result);
    }
    while (true) {
      in.skipWhitespace();
      if (in.peek() != '"') {
        throw new IllegalArgumentException("Expected string key at " + in.pos);
      }
      String key = in.readString();
      in.skipWhitespace();
      in.expect(':');
      in.skipWhitespace();
      Object value = in.readScalar();
      if (value != null) {
        result.put(key, value);
      }
      in.skipWhitespace();
      char next = in.peek();
      in.pos++;
      if (next == ',') {
        continue;
      }
      if (next == '}') {
        return finish(in, result);
      }
      throw new IllegalArgumentException("Expected ',' or '}' at " + (in.pos - 1));
    }
  }

  private static Map<String, Object> finish(Cursor in, Map<String, Object> result) {
    in.skipWhitespace();
    if (in.pos != in.input.length()) {
      throw new IllegalArgumentException("Trailing characters after JSON object");
    }
    return result;
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      writeString(sb, d.toString());
    } else if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      writeString(sb, f.toString());
    } else if (value instanceof Number) {
      sb.append(value);
    } else {
      writeString(sb, String.valueOf(value));
    }
  }

  private static void writeString(StringBuilder sb, String value) {
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

  private static final class Cursor {
    private final String input;
    private int pos;

    Cursor(String input) {
      this.input = input;
    }

    char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    void expect(char c) {
      if (peek() != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at " + pos);
      }
      pos++;
    }

    void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        pos++;
      }
    }

    Object readScalar() {
      char c = peek();
      if (c == '"') {
        return readString();
      }
      if (input.startsWith("null", pos)) {
        pos += 4;
        return null;
      }
      if (input.startsWith("true", pos)) {
        pos += 4;
        return Boolean.TRUE;
      }
      if (input.startsWith("false", pos)) {
        pos += 5;
        return Boolean.FALSE;
      }
      if (c == '-' || (c >= '0' && c <= '9')) {
        return readNumber();
      }
      throw new IllegalArgumentException("Unsupported value at " + pos);
    }

    Object readNumber() {
      int start = pos;
      boolean integral = true;
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '.' || c == 'e' || c == 'E') {
          integral = false;
        } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
          break;
        }
        pos++;
      }
      String text = input.substring(start, pos);
      try {
        return integral ? (Object) Long.parseLong(text) : (Object) Double.parseDouble(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + text, e);
      }
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char esc = input.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
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
  }
}
