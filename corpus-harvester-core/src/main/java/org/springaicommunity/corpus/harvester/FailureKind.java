package org.springaicommunity.corpus.harvester;

/**
 * Classification of a failed fetch, driving the retry decision in
 * {@link RateLimitedFetcher}.
 */
public enum FailureKind {

	/**
	 * Server error, timeout, I/O failure or an explicit backoff instruction. Retried with
	 * exponential or provider-specified delay.
	 */
	TRANSIENT,

	/**
	 * Quota exhausted (429, or 403 with no remaining quota). Retried after the quota
	 * resets.
	 */
	RATE_LIMITED,

	/**
	 * Any other client error. Never retried.
	 */
	PERMANENT

}
