package org.springaicommunity.corpus.harvester;

import java.util.List;

/**
 * A problem/solution pair harvested from an external source, before it is turned into a
 * training example.
 *
 * <p>
 * Records are immutable. A re-fetch of the same upstream item produces a new record with
 * the same natural key, which {@link Deduplicator} reconciles.
 *
 * @param naturalKey source-scoped unique key, e.g. {@code github_issues:owner/repo#123}
 * @param category technology tag such as {@code kubernetes}
 * @param title issue, discussion or question title; the file path for review comments
 * @param problem problem description; the code under review for review comments
 * @param solution resolution text; the review comment for review comments
 * @param labels issue labels or the discussion category
 * @param provenance source, origin and creation time
 * @param score votes or comment count, used for ranking only
 */
public record CandidateRecord(String naturalKey, String category, String title, String problem, String solution,
		List<String> labels, Provenance provenance, int score) {

	public CandidateRecord {
		labels = List.copyOf(labels);
	}

	/**
	 * Returns a copy of this record with the given solution.
	 * @param newSolution resolution text
	 * @return new record
	 */
	public CandidateRecord withSolution(String newSolution) {
		return new CandidateRecord(naturalKey, category, title, problem, newSolution, labels, provenance, score);
	}

	/**
	 * Build a natural key.
	 * @param source the source type
	 * @param origin repository or site
	 * @param id upstream identifier
	 * @return key of the form {@code source:origin#id}
	 */
	public static String key(SourceType source, String origin, Object id) {
		return source.id() + ":" + origin + "#" + id;
	}

}
