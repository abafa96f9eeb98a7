package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Merges record lists keeping the first occurrence of each key.
 *
 * <p>
 * Insertion order is preserved and later duplicates are dropped and counted. Used per
 * technology within a source and across sources before dataset assembly.
 */
public final class Deduplicator {

	private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);

	private Deduplicator() {
	}

	/**
	 * Merge several lists.
	 * @param <T> the record type
	 * @param <K> the key type
	 * @param sources lists in priority order
	 * @param key extracts the deduplication key
	 * @return unique records in first-seen order and the number dropped
	 */
	public static <T, K> DeduplicationResult<T> merge(List<? extends Iterable<? extends T>> sources,
			Function<? super T, ? extends K> key) {
		Set<K> seen = new HashSet<>();
		List<T> unique = new ArrayList<>();
		int removed = 0;
		for (Iterable<? extends T> source : sources) {
			for (T item : source) {
				if (seen.add(key.apply(item))) {
					unique.add(item);
				}
				else {
					removed++;
				}
			}
		}
		if (removed > 0) {
			logger.debug("Dropped {} duplicates, {} unique remain", removed, unique.size());
		}
		return new DeduplicationResult<>(unique, removed);
	}

	/**
	 * Deduplicate a single list.
	 * @param <T> the record type
	 * @param <K> the key type
	 * @param items records in priority order
	 * @param key extracts the deduplication key
	 * @return unique records in first-seen order and the number dropped
	 */
	public static <T, K> DeduplicationResult<T> deduplicate(Iterable<? extends T> items,
			Function<? super T, ? extends K> key) {
		List<Iterable<? extends T>> single = List.of(items);
		return merge(single, key);
	}

}
