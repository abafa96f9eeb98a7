package org.springaicommunity.corpus.harvester;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of a synthesis run: the examples produced so far and their counters.
 *
 * <p>
 * A fresh run starts at zero. A resumed run is seeded from a checkpoint, so quotas
 * already met are skipped and ids already present are never added again.
 */
public class SynthesisProgress {

	static final String TEMPLATE = "template";

	static final String CATEGORY = "category";

	private final List<TrainingExample> examples = new ArrayList<>();

	private final Set<String> ids = new HashSet<>();

	private final Map<String, Integer> byCategory = new LinkedHashMap<>();

	private final Map<String, Integer> byTech = new LinkedHashMap<>();

	private final Map<String, Integer> byTemplate = new LinkedHashMap<>();

	private final Map<BatchState, Integer> batchOutcomes = new EnumMap<>(BatchState.class);

	private int lastCheckpointTotal;

	public static SynthesisProgress fresh() {
		return new SynthesisProgress();
	}

	/**
	 * Seed progress from a checkpoint. Counters are rebuilt from the examples' metadata
	 * and batch outcome counts are carried over.
	 * @param checkpoint saved state
	 * @return progress continuing where the checkpoint left off
	 */
	public static SynthesisProgress resumeFrom(Checkpoint checkpoint) {
		SynthesisProgress progress = new SynthesisProgress();
		for (TrainingExample example : checkpoint.examples()) {
			progress.add(example);
		}
		progress.batchOutcomes.putAll(checkpoint.stats().batchOutcomes());
		progress.lastCheckpointTotal = progress.total();
		return progress;
	}

	/**
	 * Add an example unless its id is already present.
	 * @param example example carrying {@code key}, {@code tech}, {@code category} and
	 * {@code template} metadata
	 * @return true if the example was added
	 */
	public boolean add(TrainingExample example) {
		if (!ids.add(example.naturalKey())) {
			return false;
		}
		examples.add(example);
		byCategory.merge(example.metaString(CATEGORY), 1, Integer::sum);
		byTech.merge(example.metaString(TrainingExample.TECH), 1, Integer::sum);
		byTemplate.merge(example.metaString(TEMPLATE), 1, Integer::sum);
		return true;
	}

	public void recordBatch(BatchOutcome outcome) {
		batchOutcomes.merge(outcome.state(), 1, Integer::sum);
	}

	public int total() {
		return examples.size();
	}

	public int countForTemplate(String templateKey) {
		return byTemplate.getOrDefault(templateKey, 0);
	}

	public int countForTech(String tech) {
		return byTech.getOrDefault(tech, 0);
	}

	public boolean contains(String id) {
		return ids.contains(id);
	}

	/**
	 * Whether enough examples were accepted since the last checkpoint.
	 * @param every checkpoint interval
	 * @return true when a checkpoint is due
	 */
	public boolean isCheckpointDue(int every) {
		return total() - lastCheckpointTotal >= every;
	}

	public void markCheckpointed() {
		lastCheckpointTotal = total();
	}

	public SynthesisStats toStats() {
		return new SynthesisStats(total(), byCategory, byTech, byTemplate, batchOutcomes);
	}

	/**
	 * Snapshot of the whole state.
	 * @param model model that produced the examples
	 * @return checkpoint
	 */
	public Checkpoint toCheckpoint(String model) {
		return new Checkpoint(Instant.now(), model, toStats(), examples);
	}

	public List<TrainingExample> examples() {
		return List.copyOf(examples);
	}

}
