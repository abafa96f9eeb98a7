package org.springaicommunity.corpus.harvester;

import java.time.Duration;

/**
 * Settings of a synthesis run.
 *
 * @param model model identifier
 * @param targetCount total examples wanted
 * @param batchSize responses requested per completion call
 * @param maxTokens completion token limit
 * @param checkpointEvery accepted examples between checkpoints
 * @param maxBatchesPerTemplate completion calls allowed per template, failed ones
 * included
 * @param requestDelay delay between completion calls
 * @param apiErrorBackoff delay after a failed completion call
 */
public record SynthesisOptions(String model, int targetCount, int batchSize, int maxTokens, int checkpointEvery,
		int maxBatchesPerTemplate, Duration requestDelay, Duration apiErrorBackoff) {

	public SynthesisOptions {
		if (targetCount < 0) {
			throw new IllegalArgumentException("targetCount must not be negative");
		}
		if (batchSize <= 0) {
			throw new IllegalArgumentException("batchSize must be positive");
		}
		if (checkpointEvery <= 0) {
			throw new IllegalArgumentException("checkpointEvery must be positive");
		}
		if (maxBatchesPerTemplate <= 0) {
			throw new IllegalArgumentException("maxBatchesPerTemplate must be positive");
		}
	}

	/**
	 * Options from configuration; the request delay is derived from the requests per
	 * minute budget.
	 * @param properties harvest properties
	 * @return options
	 */
	public static SynthesisOptions from(HarvestProperties properties) {
		Duration delay = Duration.ofMillis(60_000L / Math.max(1, properties.getRequestsPerMinute()));
		return new SynthesisOptions(properties.getModel(), properties.getTargetExamples(), properties.getBatchSize(),
				properties.getMaxTokens(), properties.getCheckpointEvery(), properties.getMaxBatchesPerTemplate(),
				delay, Duration.ofSeconds(properties.getApiErrorBackoffSeconds()));
	}

}
