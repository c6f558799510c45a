package io.admission.util;

import java.util.List;

/**
 * Encodes request parameters as a compact, deterministic JSON array. Used to derive
 * cache keys, so equal parameter lists must always produce the same string.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external dependencies.
 * Users who already have Jackson or Gson on the classpath can implement this interface
 * to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a list as a JSON array. {@code null} encodes as {@code []}.
     *
     * @param values the values to encode
     * @return JSON array string (never {@code null})
     */
    String toJsonArray(List<?> values);
}
