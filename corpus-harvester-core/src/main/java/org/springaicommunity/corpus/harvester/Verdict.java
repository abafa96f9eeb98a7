package org.springaicommunity.corpus.harvester;

/**
 * Result of classifying a candidate record. Never stored with the record.
 *
 * @param passed whether every predicate accepted the record
 * @param reason the first failing predicate's reason, {@link RejectReason#NONE} on
 * acceptance
 */
public record Verdict(boolean passed, RejectReason reason) {

	private static final Verdict ACCEPT = new Verdict(true, RejectReason.NONE);

	public static Verdict accept() {
		return ACCEPT;
	}

	public static Verdict reject(RejectReason reason) {
		return new Verdict(false, reason);
	}

}
