package org.springaicommunity.corpus.harvester;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of {@link QualityPredicate}s. A record passes only if every predicate
 * accepts it; the first failing predicate names the rejection reason.
 *
 * <p>
 * Filters are immutable and classification is pure: the same record always yields the
 * same verdict.
 */
public final class QualityFilter {

	private final List<QualityPredicate> predicates;

	public QualityFilter(List<QualityPredicate> predicates) {
		this.predicates = List.copyOf(predicates);
	}

	/**
	 * Classify a record.
	 * @param candidate the record
	 * @return acceptance, or the reason of the first failing predicate
	 */
	public Verdict classify(CandidateRecord candidate) {
		for (QualityPredicate predicate : predicates) {
			if (!predicate.accepts(candidate)) {
				return Verdict.reject(predicate.reason());
			}
		}
		return Verdict.accept();
	}

	/**
	 * Returns a filter with an extra predicate appended.
	 * @param predicate predicate to run after the existing ones
	 * @return new filter
	 */
	public QualityFilter then(QualityPredicate predicate) {
		List<QualityPredicate> extended = new ArrayList<>(predicates);
		extended.add(predicate);
		return new QualityFilter(extended);
	}

	/**
	 * Returns a filter with the named predicate replaced in place.
	 * @param name name of the predicate to replace
	 * @param replacement the new predicate
	 * @return new filter
	 * @throws IllegalArgumentException if no predicate has that name
	 */
	public QualityFilter replace(String name, QualityPredicate replacement) {
		List<QualityPredicate> updated = new ArrayList<>(predicates);
		for (int i = 0; i < updated.size(); i++) {
			if (updated.get(i).name().equals(name)) {
				updated.set(i, replacement);
				return new QualityFilter(updated);
			}
		}
		throw new IllegalArgumentException("No predicate named '" + name + "'");
	}

	/**
	 * Returns a filter without the named predicate.
	 * @param name name of the predicate to drop
	 * @return new filter
	 */
	public QualityFilter without(String name) {
		return new QualityFilter(predicates.stream().filter(p -> !p.name().equals(name)).toList());
	}

	public List<QualityPredicate> predicates() {
		return predicates;
	}

}
