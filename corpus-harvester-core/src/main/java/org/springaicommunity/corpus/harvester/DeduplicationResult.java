package org.springaicommunity.corpus.harvester;

import java.util.List;

/**
 * Result of a {@link Deduplicator} merge.
 *
 * @param <T> the record type
 * @param unique records kept, in first-seen order
 * @param duplicatesRemoved number of records dropped because their key was already seen
 */
public record DeduplicationResult<T>(List<T> unique, int duplicatesRemoved) {

	public DeduplicationResult {
		unique = List.copyOf(unique);
	}

}
