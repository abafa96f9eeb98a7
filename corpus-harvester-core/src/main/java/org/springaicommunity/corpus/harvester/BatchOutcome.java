package org.springaicommunity.corpus.harvester;

/**
 * Terminal result of one batch.
 *
 * @param templateKey template the batch was generated for
 * @param attempt 1-based batch number within the template
 * @param state terminal state
 * @param accepted number of new examples the batch contributed
 */
public record BatchOutcome(String templateKey, int attempt, BatchState state, int accepted) {

	public BatchOutcome {
		if (!state.isTerminal()) {
			throw new IllegalArgumentException("Batch outcome must be terminal: " + state);
		}
	}

}
