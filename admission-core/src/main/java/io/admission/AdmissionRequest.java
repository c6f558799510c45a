package io.admission;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a unit of work submitted for admission.
 *
 * <p>A request is either a <em>cacheable data operation</em> (created via
 * {@link #query(String)}), whose result is looked up in and stored into the result cache,
 * or a plain operation (created via {@link #of(String)}) that always reaches the
 * {@link RequestExecutor}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AdmissionRequest request = AdmissionRequest.query("SELECT * FROM siswa WHERE status = ?")
 *     .params("aktif")
 *     .ttl(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public final class AdmissionRequest {

    private final String operation;
    private final List<Object> params;
    private final boolean cacheable;
    private final String cacheKey;
    private final Duration ttl;
    private final Object body;
    private final Map<String, String> headers;

    private AdmissionRequest(Builder builder) {
        this.operation = Objects.requireNonNull(builder.operation, "operation");
        if (this.operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be blank");
        }
        this.params = builder.params == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(builder.params));
        this.cacheable = builder.cacheable;
        if (!cacheable && (builder.cacheKey != null || builder.ttl != null)) {
            throw new IllegalArgumentException("cacheKey and ttl only apply to cacheable requests");
        }
        if (builder.cacheKey != null && builder.cacheKey.isEmpty()) {
            throw new IllegalArgumentException("cacheKey cannot be empty");
        }
        if (builder.ttl != null && (builder.ttl.isZero() || builder.ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.cacheKey = builder.cacheKey;
        this.ttl = builder.ttl;
        this.body = builder.body;

        Map<String, String> headerCopy = builder.headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        if (headerCopy.containsKey(null)) {
            throw new IllegalArgumentException("headers cannot contain null keys");
        }
        if (headerCopy.containsValue(null)) {
            throw new IllegalArgumentException("headers cannot contain null values");
        }
        this.headers = headerCopy;
    }

    /**
     * Starts a cacheable data operation, typically a read query.
     *
     * @param query the query text; together with the params it forms the default cache key
     * @return a new builder
     */
    public static Builder query(String query) {
        return new Builder(query, true);
    }

    /**
     * Starts a non-cacheable operation.
     *
     * @param operation the operation name
     * @return a new builder
     */
    public static Builder of(String operation) {
        return new Builder(operation, false);
    }

    public String operation() {
        return operation;
    }

    public List<Object> params() {
        return params;
    }

    public boolean isCacheable() {
        return cacheable;
    }

    /**
     * Returns the explicit cache key, or {@code null} to derive one from operation and params.
     */
    public String cacheKey() {
        return cacheKey;
    }

    /**
     * Returns the per-request freshness window, or {@code null} to use the configured default.
     */
    public Duration ttl() {
        return ttl;
    }

    public Object body() {
        return body;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return "AdmissionRequest{operation='" + operation + "', params=" + params
                + ", cacheable=" + cacheable + '}';
    }

    /** Builder for {@link AdmissionRequest}. */
    public static final class Builder {
        private final String operation;
        private final boolean cacheable;
        private List<Object> params;
        private String cacheKey;
        private Duration ttl;
        private Object body;
        private Map<String, String> headers;

        private Builder(String operation, boolean cacheable) {
            this.operation = operation;
            this.cacheable = cacheable;
        }

        /**
         * Sets positional parameters. Values are copied at build time.
         *
         * @param params the parameters, may contain {@code null}
         * @return this builder
         */
        public Builder params(Object... params) {
            Objects.requireNonNull(params, "params");
            List<Object> list = new ArrayList<>(params.length);
            Collections.addAll(list, params);
            this.params = list;
            return this;
        }

        /**
         * Sets positional parameters. Values are copied at build time.
         *
         * @param params the parameters, may contain {@code null}
         * @return this builder
         */
        public Builder params(List<?> params) {
            this.params = new ArrayList<>(Objects.requireNonNull(params, "params"));
            return this;
        }

        /**
         * Sets an explicit cache key instead of deriving one from operation and params.
         *
         * <p>Only valid for cacheable requests.
         *
         * @param cacheKey the cache key
         * @return this builder
         */
        public Builder cacheKey(String cacheKey) {
            this.cacheKey = Objects.requireNonNull(cacheKey, "cacheKey");
            return this;
        }

        /**
         * Overrides the default cache freshness window for this request.
         *
         * <p>Only valid for cacheable requests.
         *
         * @param ttl the time-to-live (must be positive)
         * @return this builder
         */
        public Builder ttl(Duration ttl) {
            this.ttl = Objects.requireNonNull(ttl, "ttl");
            return this;
        }

        /**
         * Attaches an opaque payload for the {@link RequestExecutor}.
         *
         * @param body the payload
         * @return this builder
         */
        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        /**
         * Sets string metadata headers. The map is copied at build time.
         *
         * @param headers the headers
         * @return this builder
         */
        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        /**
         * Builds an immutable {@link AdmissionRequest}.
         *
         * @return a new request
         * @throws IllegalArgumentException if the operation is blank, the ttl is not positive,
         *                                  cache settings are set on a non-cacheable request,
         *                                  or headers contain null keys or values
         */
        public AdmissionRequest build() {
            return new AdmissionRequest(this);
        }
    }
}
