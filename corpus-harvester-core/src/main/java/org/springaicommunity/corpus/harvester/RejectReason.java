package org.springaicommunity.corpus.harvester;

/**
 * Why a candidate record was not kept. The code is the key used in corpus statistics.
 */
public enum RejectReason {

	NONE("ok"),

	PROBLEM_TOO_SHORT("problem_too_short"),

	PROBLEM_TOO_LONG("problem_too_long"),

	SOLUTION_TOO_SHORT("solution_too_short"),

	SOLUTION_TOO_LONG("solution_too_long"),

	NO_ERROR_INDICATOR("no_error_indicator"),

	NO_ACTIONABLE_SOLUTION("no_actionable_solution"),

	EXCLUDED_CATEGORY("excluded_category"),

	NON_ENGLISH("non_english"),

	MOSTLY_CODE_BLOCKS("mostly_code_blocks"),

	MOSTLY_QUESTIONS("mostly_questions"),

	LOW_VALUE("low_value"),

	AUTHOR_RESPONSE("author_response"),

	LOW_SCORE("low_score"),

	UNSUPPORTED_FILE("unsupported_file"),

	NO_SOLUTION("no_solution");

	private final String code;

	RejectReason(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

}
