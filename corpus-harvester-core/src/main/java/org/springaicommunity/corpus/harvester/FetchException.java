package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Exception thrown when a fetch fails.
 *
 * <p>
 * Carries the failure classification, the quota snapshot and any provider-specified retry
 * delay, enabling the retry decisions in {@link RateLimitedFetcher}.
 */
public class FetchException extends RuntimeException {

	private final FailureKind kind;

	private final int statusCode;

	@Nullable
	private final String responseBody;

	@Nullable
	private final RateLimitInfo rateLimit;

	@Nullable
	private final Duration retryAfter;

	public FetchException(String message, FailureKind kind, int statusCode, @Nullable String responseBody,
			@Nullable RateLimitInfo rateLimit, @Nullable Duration retryAfter) {
		super(message);
		this.kind = kind;
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimit = rateLimit;
		this.retryAfter = retryAfter;
	}

	public FetchException(String message, FailureKind kind, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimit = null;
		this.retryAfter = null;
	}

	/**
	 * Create a permanent failure for a response that arrived but could not be used, such
	 * as malformed JSON or a GraphQL error payload.
	 * @param message description of the problem
	 * @param responseBody offending body
	 * @return permanent FetchException
	 */
	public static FetchException malformed(String message, @Nullable String responseBody) {
		return new FetchException(message, FailureKind.PERMANENT, 200, responseBody, null, null);
	}

	public FailureKind getKind() {
		return kind;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	@Nullable
	public RateLimitInfo getRateLimit() {
		return rateLimit;
	}

	@Nullable
	public Duration getRetryAfter() {
		return retryAfter;
	}

	/**
	 * Returns true if this failure was caused by an exhausted quota.
	 */
	public boolean isRateLimitError() {
		return kind == FailureKind.RATE_LIMITED;
	}

	/**
	 * Returns true if a retry may succeed.
	 */
	public boolean isRetryable() {
		return kind != FailureKind.PERMANENT;
	}

}
