package org.springaicommunity.corpus.harvester;

import java.util.function.Function;

/**
 * The text of a candidate record a quality predicate looks at.
 */
public enum TextField {

	TITLE(CandidateRecord::title),

	PROBLEM(CandidateRecord::problem),

	TITLE_AND_PROBLEM(candidate -> candidate.title() + " " + candidate.problem()),

	SOLUTION(CandidateRecord::solution);

	private final Function<CandidateRecord, String> extractor;

	TextField(Function<CandidateRecord, String> extractor) {
		this.extractor = extractor;
	}

	public String extract(CandidateRecord candidate) {
		return extractor.apply(candidate);
	}

}
