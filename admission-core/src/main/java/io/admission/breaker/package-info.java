/**
 * Circuit breaker that halts dispatch after repeated downstream failures.
 */
package io.admission.breaker;
