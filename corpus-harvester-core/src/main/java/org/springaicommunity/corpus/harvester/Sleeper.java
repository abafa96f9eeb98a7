package org.springaicommunity.corpus.harvester;

import java.time.Duration;

/**
 * Blocks the calling thread. Injected wherever the harvester waits so tests can record
 * delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	/**
	 * Sleep for the given duration.
	 * @param duration how long to block
	 * @throws InterruptedException if the thread is interrupted while sleeping
	 */
	void sleep(Duration duration) throws InterruptedException;

}
