package io.admission.cache;

import io.admission.AdmissionRequest;
import io.admission.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Default {@link CacheKeyFunction}: {@code "query_" + base64(operation + jsonArray(params))}.
 */
public final class QueryCacheKeys implements CacheKeyFunction {
  public static final String PREFIX = "query_";

  private static final QueryCacheKeys DEFAULT = new QueryCacheKeys(JsonCodec.getDefault());

  private final JsonCodec jsonCodec;

  public QueryCacheKeys(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public static QueryCacheKeys getDefault() {
    return DEFAULT;
  }

  @Override
  public String keyFor(AdmissionRequest request) {
    String descriptor = request.operation() + jsonCodec.toJsonArray(request.params());
    return PREFIX + Base64.getEncoder().encodeToString(descriptor.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Resolves the key for a request: its explicit key if set, otherwise the derived one.
   *
   * @param request   a cacheable request
   * @param derivation fallback key derivation
   * @return the cache key
   */
  public static String resolve(AdmissionRequest request, CacheKeyFunction derivation) {
    if (request.cacheKey() != null) {
      return request.cacheKey();
    }
    String key = derivation.keyFor(request);
    if (key == null || key.isEmpty()) {
      throw new IllegalStateException("CacheKeyFunction returned an empty key for " + request);
    }
    return key;
  }
}
