package org.springaicommunity.corpus.harvester;

import java.time.Instant;

/**
 * Quota snapshot reported by an API provider, either through response headers (GitHub)
 * or inside the response body (Stack Exchange).
 *
 * @param limit the maximum number of requests allowed in the window, or -1 if unknown
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the quota resets (epoch seconds), or -1 if unknown
 * @param used the number of requests used in the current window, or -1 if unknown
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the remaining quota is known and below the given low-water mark.
	 * @param lowWaterMark threshold below which callers should wait for the reset
	 * @return true if the quota is running low
	 */
	public boolean isBelow(int lowWaterMark) {
		return remaining >= 0 && remaining < lowWaterMark;
	}

}
