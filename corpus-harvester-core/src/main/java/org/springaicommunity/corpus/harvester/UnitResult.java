package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of harvesting one unit of work (a repository or a tag).
 *
 * @param unit the repository ({@code owner/repo}) or tag
 * @param category technology the unit belongs to
 * @param status whether the unit ran to completion
 * @param kept number of records kept from the unit
 * @param error failure message, {@code null} when completed
 */
public record UnitResult(String unit, String category, Status status, int kept, @Nullable String error) {

	public static UnitResult completed(String unit, String category, int kept) {
		return new UnitResult(unit, category, Status.COMPLETED, kept, null);
	}

	public static UnitResult failed(String unit, String category, int kept, String error) {
		return new UnitResult(unit, category, Status.FAILED, kept, error);
	}

	/**
	 * Unit outcome.
	 */
	public enum Status {

		COMPLETED, FAILED

	}

}
