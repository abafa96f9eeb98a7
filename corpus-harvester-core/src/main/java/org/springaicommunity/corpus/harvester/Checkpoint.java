package org.springaicommunity.corpus.harvester;

import java.time.Instant;
import java.util.List;

/**
 * Whole state of a synthesis run.
 *
 * @param generatedAt when the snapshot was taken
 * @param model model that produced the examples
 * @param stats counters at snapshot time
 * @param examples every example produced so far
 */
public record Checkpoint(Instant generatedAt, String model, SynthesisStats stats, List<TrainingExample> examples) {

	public Checkpoint {
		examples = List.copyOf(examples);
	}

}
