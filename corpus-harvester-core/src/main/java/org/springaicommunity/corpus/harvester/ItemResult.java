package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of processing a single fetched record.
 *
 * @param <T> the type of the accepted value
 * @param status whether the record was accepted, skipped by a rule, or failed
 * @param value the accepted value, {@code null} unless accepted
 * @param reason rule that skipped the record, {@link RejectReason#NONE} otherwise
 * @param detail failure description, {@code null} unless failed
 */
public record ItemResult<T>(Status status, @Nullable T value, RejectReason reason, @Nullable String detail) {

	public static <T> ItemResult<T> accepted(T value) {
		return new ItemResult<>(Status.ACCEPTED, value, RejectReason.NONE, null);
	}

	public static <T> ItemResult<T> skipped(RejectReason reason) {
		return new ItemResult<>(Status.SKIPPED, null, reason, null);
	}

	public static <T> ItemResult<T> failed(String detail) {
		return new ItemResult<>(Status.FAILED, null, RejectReason.NONE, detail);
	}

	public boolean isAccepted() {
		return status == Status.ACCEPTED;
	}

	/**
	 * Item outcome.
	 */
	public enum Status {

		ACCEPTED, SKIPPED, FAILED

	}

}
