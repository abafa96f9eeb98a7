package org.springaicommunity.corpus.harvester;

import java.time.Duration;
import java.util.Optional;

/**
 * Strategy for reading the provider's quota state from a response. GitHub reports quota
 * in headers, Stack Exchange inside the JSON body.
 */
public interface QuotaInspector {

	/**
	 * Extract the quota snapshot from a response.
	 * @param response the response to inspect
	 * @return the quota snapshot, or empty if the response carries none
	 */
	Optional<RateLimitInfo> inspect(FetchResponse response);

	/**
	 * Extract an explicit instruction to pause before the next request.
	 * @param response the response to inspect
	 * @return the requested pause, or empty if none was given
	 */
	default Optional<Duration> backoffHint(FetchResponse response) {
		return Optional.empty();
	}

}
