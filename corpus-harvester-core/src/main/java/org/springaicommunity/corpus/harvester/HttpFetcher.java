package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Interface for executing HTTP requests against an external API.
 *
 * <p>
 * Implementations return the response for 2xx status codes and throw a classified
 * {@link FetchException} otherwise. This abstraction allows decorators (retry, quota
 * pacing) and test doubles to be layered around the real client.
 */
public interface HttpFetcher {

	/**
	 * Execute a request.
	 * @param request the request to send
	 * @return the successful response
	 * @throws FetchException on non-2xx status codes or transport errors
	 */
	FetchResponse fetch(FetchRequest request);

	/**
	 * Get the quota snapshot from the most recent response.
	 * @return the last observed quota, or {@code null} if none has been observed
	 */
	@Nullable
	default RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
