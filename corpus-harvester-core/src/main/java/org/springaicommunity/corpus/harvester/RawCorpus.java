package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Whole-file envelope for the curated records of one source, or of one technology within
 * a source.
 *
 * @param scrapedAt when the harvest finished
 * @param source source id, e.g. {@code github_issues}
 * @param minDate date floor used for the harvest ({@code YYYY-MM-DD})
 * @param total number of records in {@code examples}
 * @param stats harvest statistics from the {@link HarvestContext}
 * @param examples curated records
 */
public record RawCorpus(Instant scrapedAt, String source, @Nullable String minDate, int total,
		Map<String, Object> stats, List<CandidateRecord> examples) {

	public RawCorpus {
		examples = List.copyOf(examples);
	}

}
