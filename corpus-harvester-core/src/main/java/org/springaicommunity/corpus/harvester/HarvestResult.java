package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of harvesting one source.
 *
 * @param source the harvested source
 * @param corpusFile combined corpus file, or null for a dry run or a failed source
 * @param records unique curated records of the run, in harvest order
 * @param context counters of the run
 * @param error failure message when the source as a whole failed
 */
public record HarvestResult(SourceType source, @Nullable Path corpusFile, List<CandidateRecord> records,
		HarvestContext context, @Nullable String error) {

	public HarvestResult {
		records = List.copyOf(records);
	}

	public static HarvestResult failed(SourceType source, String error) {
		return new HarvestResult(source, null, List.of(), new HarvestContext(source.id()), error);
	}

	public boolean isSuccess() {
		return error == null;
	}

}
