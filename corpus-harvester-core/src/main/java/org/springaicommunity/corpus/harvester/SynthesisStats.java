package org.springaicommunity.corpus.harvester;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of a synthesis run, persisted with every checkpoint.
 *
 * @param total accepted examples
 * @param byCategory accepted examples per category
 * @param byTech accepted examples per technology
 * @param byTemplate accepted examples per template key
 * @param batchOutcomes number of batches per terminal state
 */
public record SynthesisStats(int total, Map<String, Integer> byCategory, Map<String, Integer> byTech,
		Map<String, Integer> byTemplate, Map<BatchState, Integer> batchOutcomes) {

	public SynthesisStats {
		byCategory = Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
		byTech = Collections.unmodifiableMap(new LinkedHashMap<>(byTech));
		byTemplate = Collections.unmodifiableMap(new LinkedHashMap<>(byTemplate));
		batchOutcomes = Collections.unmodifiableMap(new LinkedHashMap<>(batchOutcomes));
	}

	public static SynthesisStats empty() {
		return new SynthesisStats(0, Map.of(), Map.of(), Map.of(), Map.of());
	}

}
