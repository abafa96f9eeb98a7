package org.springaicommunity.corpus.harvester;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A received HTTP response.
 *
 * @param statusCode HTTP status code
 * @param body decoded response body
 * @param headers response headers; names are matched case-insensitively by
 * {@link #header(String)}
 */
public record FetchResponse(int statusCode, String body, Map<String, List<String>> headers) {

	/**
	 * Look up the first value of a header.
	 * @param name header name, case-insensitive
	 * @return the first value, if present
	 */
	public Optional<String> header(String name) {
		for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
			if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
				return Optional.of(entry.getValue().get(0));
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns true for 2xx responses.
	 * @return true if successful
	 */
	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

}
