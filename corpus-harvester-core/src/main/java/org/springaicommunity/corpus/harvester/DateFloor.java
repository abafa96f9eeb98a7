package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds the per-record date floor applied while paginating.
 *
 * <p>
 * Listings are sorted by update time, not creation time, so an old record can appear on
 * any page. The floor is therefore checked record by record and never used to stop
 * pagination early.
 */
public final class DateFloor {

	private DateFloor() {
	}

	/**
	 * Keep records created at or after the floor. Records without a creation time are
	 * dropped.
	 * @param <T> the record type
	 * @param floor earliest accepted creation time
	 * @param createdAt extracts the creation time of a record
	 * @return keep predicate
	 */
	public static <T> Predicate<T> onOrAfter(Instant floor, Function<? super T, @Nullable Instant> createdAt) {
		return item -> {
			Instant created = createdAt.apply(item);
			return created != null && !created.isBefore(floor);
		};
	}

	/**
	 * Parse a {@code YYYY-MM-DD} date as the start of that day in UTC.
	 * @param date ISO local date
	 * @return the instant at UTC midnight
	 * @throws IllegalArgumentException if the date is malformed
	 */
	public static Instant parse(String date) {
		try {
			return LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant();
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + date + "': must be YYYY-MM-DD format", e);
		}
	}

}
