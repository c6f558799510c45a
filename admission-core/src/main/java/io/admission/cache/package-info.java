/**
 * Result cache with lazy TTL expiry for cacheable data operations.
 *
 * @see io.admission.cache.ResultCache
 * @see io.admission.cache.CacheKeyFunction
 */
package io.admission.cache;
