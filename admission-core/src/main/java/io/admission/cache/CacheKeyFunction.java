package io.admission.cache;

import io.admission.AdmissionRequest;

/**
 * Derives a deterministic cache key for a cacheable request that carries no explicit
 * {@linkplain AdmissionRequest#cacheKey() cache key}.
 *
 * @see QueryCacheKeys
 */
@FunctionalInterface
public interface CacheKeyFunction {

    /**
     * @param request a cacheable request
     * @return a non-empty key; equal requests must map to equal keys
     */
    String keyFor(AdmissionRequest request);
}
