package io.admission.util;

import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON array encoder for request parameters.
 *
 * <p>Numbers and booleans are written bare, {@code null} as {@code null}, nested lists and
 * arrays (primitive arrays included) as arrays, maps as objects with string keys in iteration order. Everything else,
 * including dates, is written as its {@code toString()} in quotes.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJsonArray(List<?> values) {
    if (values == null) {
      return "[]";
    }
    StringBuilder sb = new StringBuilder();
    appendList(sb, values);
    return sb.toString();
  }

  private static void appendValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof Number || value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof List<?> list) {
      appendList(sb, list);
    } else if (value.getClass().isArray()) {
      appendArray(sb, value);
    } else if (value instanceof Map<?, ?> map) {
      appendMap(sb, map);
    } else if (value instanceof TemporalAccessor || value instanceof CharSequence) {
      sb.append('"').append(escape(value.toString())).append('"');
    } else {
      sb.append('"').append(escape(String.valueOf(value))).append('"');
    }
  }

  private static void appendList(StringBuilder sb, List<?> values) {
    sb.append('[');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      appendValue(sb, values.get(i));
    }
    sb.append(']');
  }

  private static void appendArray(StringBuilder sb, Object array) {
    sb.append('[');
    int length = Array.getLength(array);
    for (int i = 0; i < length; i++) {
      if (i > 0) {
        sb.append(',');
      }
      appendValue(sb, Array.get(array, i));
    }
    sb.append(']');
  }

  private static void appendMap(StringBuilder sb, Map<?, ?> map) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("map parameters cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
      appendValue(sb, entry.getValue());
    }
    sb.append('}');
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
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
    return sb.toString();
  }
}
