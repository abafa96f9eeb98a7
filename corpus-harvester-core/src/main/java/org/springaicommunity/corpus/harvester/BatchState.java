package org.springaicommunity.corpus.harvester;

/**
 * Lifecycle of one synthetic-generation batch:
 * {@code PROMPTED -> AWAITING_RESPONSE -> PARSED | PARSE_FAILED | API_FAILED}.
 */
public enum BatchState {

	PROMPTED, AWAITING_RESPONSE, PARSED, PARSE_FAILED, API_FAILED;

	public boolean isTerminal() {
		return this == PARSED || this == PARSE_FAILED || this == API_FAILED;
	}

}
