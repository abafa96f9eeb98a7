package org.springaicommunity.corpus.harvester;

import java.util.function.Predicate;

/**
 * A named acceptance rule.
 *
 * @param name stable name, used to remove or replace the rule in a filter
 * @param reason reported when the rule rejects a record
 * @param condition returns true when the record satisfies the rule
 */
public record QualityPredicate(String name, RejectReason reason, Predicate<CandidateRecord> condition) {

	/**
	 * Test a record.
	 * @param candidate the record
	 * @return true if the record satisfies this rule
	 */
	public boolean accepts(CandidateRecord candidate) {
		return condition.test(candidate);
	}

}
