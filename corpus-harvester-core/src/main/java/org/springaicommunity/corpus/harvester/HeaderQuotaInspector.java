package org.springaicommunity.corpus.harvester;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads GitHub's {@code X-RateLimit-*} headers and the standard {@code Retry-After}
 * header.
 */
public class HeaderQuotaInspector implements QuotaInspector {

	@Override
	public Optional<RateLimitInfo> inspect(FetchResponse response) {
		int remaining = parseInt(response, "X-RateLimit-Remaining", -1);
		if (remaining < 0) {
			return Optional.empty();
		}
		long reset = parseLong(response, "X-RateLimit-Reset", -1);
		int limit = parseInt(response, "X-RateLimit-Limit", -1);
		int used = parseInt(response, "X-RateLimit-Used", -1);
		return Optional.of(new RateLimitInfo(limit, remaining, reset, used));
	}

	@Override
	public Optional<Duration> backoffHint(FetchResponse response) {
		long seconds = parseLong(response, "Retry-After", -1);
		return seconds > 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
	}

	private static int parseInt(FetchResponse response, String headerName, int defaultValue) {
		return response.header(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLong(FetchResponse response, String headerName, long defaultValue) {
		return response.header(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
