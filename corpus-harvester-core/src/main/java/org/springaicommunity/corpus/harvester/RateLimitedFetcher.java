package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decorator that adds quota awareness, politeness and retries to an {@link HttpFetcher}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Quota gate: before each call, inspects the quota snapshot observed on the previous
 * response and, when fewer than {@code lowWaterMark} requests remain, sleeps until the
 * reported reset plus a safety margin</li>
 * <li>Provider backoff: honours a {@code backoff} instruction carried by a successful
 * response before the next call</li>
 * <li>Polite delay: a fixed minimum gap between consecutive requests</li>
 * <li>Exponential backoff for transient errors, reset-aware waits for rate limit errors,
 * immediate rethrow for permanent errors</li>
 * </ul>
 *
 * <p>
 * One instance per API identity and worker. Instances hold mutable pacing state and are
 * not meant to be shared across threads.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * HttpFetcher fetcher = RateLimitedFetcher.builder()
 *     .wrapping(new JdkHttpFetcher(new HeaderQuotaInspector()))
 *     .quotaInspector(new HeaderQuotaInspector())
 *     .maxRetries(3)
 *     .politeDelay(Duration.ofMillis(300))
 *     .build();
 * }
 * </pre>
 */
public final class RateLimitedFetcher implements HttpFetcher {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitedFetcher.class);

	private final HttpFetcher delegate;

	private final QuotaInspector quotaInspector;

	private final int maxRetries;

	private final long initialDelayMs;

	private final int lowWaterMark;

	private final Duration safetyMargin;

	private final Duration maxResetWait;

	private final Duration politeDelay;

	private final Sleeper sleeper;

	private final Clock clock;

	@Nullable
	private RateLimitInfo pendingQuota;

	@Nullable
	private RateLimitInfo lastObservedQuota;

	@Nullable
	private Instant backoffUntil;

	@Nullable
	private Instant lastRequestAt;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RateLimitedFetcher(Builder builder) {
		this.delegate = builder.delegate;
		this.quotaInspector = builder.quotaInspector;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.lowWaterMark = builder.lowWaterMark;
		this.safetyMargin = builder.safetyMargin;
		this.maxResetWait = builder.maxResetWait;
		this.politeDelay = builder.politeDelay;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	/**
	 * Create a new builder for RateLimitedFetcher.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastObservedQuota;
	}

	@Override
	public FetchResponse fetch(FetchRequest request) {
		String description = request.describe();
		FetchException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			awaitQuota(description);
			awaitBackoff(description);
			awaitPoliteDelay();

			try {
				FetchResponse response = delegate.fetch(request);
				lastRequestAt = clock.instant();
				observe(response);
				return response;
			}
			catch (FetchException e) {
				lastRequestAt = clock.instant();
				lastException = e;
				if (e.getRateLimit() != null) {
					lastObservedQuota = e.getRateLimit();
				}

				if (!e.isRetryable()) {
					throw e;
				}

				if (attempt < maxRetries) {
					Duration wait = computeWaitTime(e, delay);
					logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), wait.toMillis());
					sleep(wait);
					delay *= 2;
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	private void observe(FetchResponse response) {
		quotaInspector.inspect(response).ifPresent(quota -> {
			lastObservedQuota = quota;
			pendingQuota = quota;
		});
		quotaInspector.backoffHint(response).ifPresent(backoff -> {
			logger.info("Provider requested a backoff of {}s", backoff.toSeconds());
			backoffUntil = clock.instant().plus(backoff);
		});
	}

	/**
	 * Sleep until the quota resets when the previous response reported fewer remaining
	 * requests than the low-water mark. The snapshot is consumed so the wait happens once.
	 */
	private void awaitQuota(String description) {
		RateLimitInfo quota = pendingQuota;
		if (quota == null || !quota.isBelow(lowWaterMark) || quota.reset() <= 0) {
			return;
		}
		pendingQuota = null;

		Duration wait = Duration.between(clock.instant(), quota.getResetTime()).plus(safetyMargin);
		if (wait.isNegative() || wait.isZero()) {
			return;
		}
		if (wait.compareTo(maxResetWait) > 0) {
			logger.warn("Quota nearly exhausted ({} remaining) and reset is {}s away, waiting anyway before {}",
					quota.remaining(), wait.toSeconds(), description);
		}
		else {
			logger.info("Quota low ({} remaining). Waiting {}s for reset before {}", quota.remaining(),
					wait.toSeconds(), description);
		}
		sleep(wait);
	}

	private void awaitBackoff(String description) {
		Instant until = backoffUntil;
		if (until == null) {
			return;
		}
		backoffUntil = null;
		Duration wait = Duration.between(clock.instant(), until);
		if (!wait.isNegative() && !wait.isZero()) {
			logger.debug("Honouring provider backoff of {}ms before {}", wait.toMillis(), description);
			sleep(wait);
		}
	}

	private void awaitPoliteDelay() {
		Instant previous = lastRequestAt;
		if (previous == null || politeDelay.isZero()) {
			return;
		}
		Duration remaining = politeDelay.minus(Duration.between(previous, clock.instant()));
		if (!remaining.isNegative() && !remaining.isZero()) {
			sleep(remaining);
		}
	}

	/**
	 * Compute how long to wait before retrying. A provider-specified delay wins; a rate
	 * limit error with a known reset waits for that reset plus the safety margin; anything
	 * else falls back to the exponential backoff delay.
	 */
	private Duration computeWaitTime(FetchException e, long defaultDelayMs) {
		if (e.getRetryAfter() != null) {
			return e.getRetryAfter();
		}
		RateLimitInfo quota = e.getRateLimit();
		if (e.isRateLimitError() && quota != null && quota.reset() > 0) {
			Duration wait = Duration.between(clock.instant(), quota.getResetTime()).plus(safetyMargin);
			if (!wait.isNegative() && !wait.isZero() && wait.compareTo(maxResetWait) <= 0) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", wait.toSeconds(),
						quota.reset());
				return wait;
			}
			else if (wait.compareTo(maxResetWait) > 0) {
				logger.warn("Rate limit reset is {} seconds away (> {}s), using exponential backoff instead",
						wait.toSeconds(), maxResetWait.toSeconds());
			}
		}
		return Duration.ofMillis(defaultDelayMs);
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FetchException("Fetch interrupted while waiting", FailureKind.PERMANENT, e);
		}
	}

	/**
	 * Builder for {@link RateLimitedFetcher}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>initialDelay: 1 second</li>
	 * <li>lowWaterMark: 10 remaining requests</li>
	 * <li>safetyMargin: 5 seconds</li>
	 * <li>maxResetWait: 1 hour (longer waits are logged at WARN)</li>
	 * <li>politeDelay: 300 milliseconds</li>
	 * <li>quotaInspector: {@link HeaderQuotaInspector}</li>
	 * </ul>
	 */
	public static class Builder {

		private HttpFetcher delegate;

		private QuotaInspector quotaInspector = new HeaderQuotaInspector();

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private int lowWaterMark = 10;

		private Duration safetyMargin = Duration.ofSeconds(5);

		private Duration maxResetWait = Duration.ofHours(1);

		private Duration politeDelay = Duration.ofMillis(300);

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the fetcher to wrap.
		 * @param fetcher the HttpFetcher to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(HttpFetcher fetcher) {
			this.delegate = fetcher;
			return this;
		}

		/**
		 * Set how quota is read from successful responses.
		 * @param quotaInspector header or body inspector (default: headers)
		 * @return this builder
		 */
		public Builder quotaInspector(QuotaInspector quotaInspector) {
			this.quotaInspector = quotaInspector;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries using Duration.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay in milliseconds (doubles on each retry, default:
		 * 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the remaining-quota threshold below which the next call waits for the reset.
		 * @param lowWaterMark remaining request threshold (default: 10)
		 * @return this builder
		 */
		public Builder lowWaterMark(int lowWaterMark) {
			this.lowWaterMark = lowWaterMark;
			return this;
		}

		/**
		 * Set the margin added to a reported reset time.
		 * @param safetyMargin extra wait after the reset (default: 5 seconds)
		 * @return this builder
		 */
		public Builder safetyMargin(Duration safetyMargin) {
			this.safetyMargin = safetyMargin;
			return this;
		}

		/**
		 * Set the reset wait above which waits are logged at WARN, and above which rate
		 * limit retries fall back to exponential backoff.
		 * @param maxResetWait reset wait cap (default: 1 hour)
		 * @return this builder
		 */
		public Builder maxResetWait(Duration maxResetWait) {
			this.maxResetWait = maxResetWait;
			return this;
		}

		/**
		 * Set the minimum gap between consecutive requests.
		 * @param politeDelay delay between requests (default: 300 milliseconds)
		 * @return this builder
		 */
		public Builder politeDelay(Duration politeDelay) {
			this.politeDelay = politeDelay;
			return this;
		}

		/**
		 * Set the sleeper used for every wait.
		 * @param sleeper sleeper (default: {@link Sleeper#SYSTEM})
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set the clock used to compute waits.
		 * @param clock clock (default: system UTC)
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RateLimitedFetcher.
		 * @return configured RateLimitedFetcher
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RateLimitedFetcher build() {
			if (delegate == null) {
				throw new IllegalStateException("An HttpFetcher to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (lowWaterMark < 0) {
				throw new IllegalStateException("lowWaterMark must be non-negative");
			}
			if (politeDelay.isNegative() || safetyMargin.isNegative()) {
				throw new IllegalStateException("politeDelay and safetyMargin must not be negative");
			}
			return new RateLimitedFetcher(this);
		}

	}

}
