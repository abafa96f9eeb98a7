package org.springaicommunity.corpus.harvester;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress counters for one source run, passed explicitly through pagination, filtering
 * and deduplication.
 *
 * <p>
 * A context is confined to the single worker that harvests its source and is not
 * thread-safe.
 */
public class HarvestContext {

	private final String source;

	private int pagesFetched;

	private int rawRecords;

	private int droppedAtFetch;

	private int accepted;

	private int failedItems;

	private int duplicates;

	private final Map<RejectReason, Integer> rejected = new EnumMap<>(RejectReason.class);

	private final Map<String, Integer> byCategory = new LinkedHashMap<>();

	private final List<UnitResult> units = new ArrayList<>();

	public HarvestContext(String source) {
		this.source = source;
	}

	/**
	 * Record a fetched page.
	 * @param rawCount number of records the provider returned before any filtering
	 */
	public void recordPage(int rawCount) {
		pagesFetched++;
		rawRecords += rawCount;
	}

	public void recordDroppedAtFetch() {
		droppedAtFetch++;
	}

	/**
	 * Record the outcome of one record.
	 * @param result the item outcome
	 */
	public void recordOutcome(ItemResult<?> result) {
		switch (result.status()) {
			case ACCEPTED -> accepted++;
			case SKIPPED -> rejected.merge(result.reason(), 1, Integer::sum);
			case FAILED -> failedItems++;
		}
	}

	public void recordDuplicates(int count) {
		duplicates += count;
	}

	public void recordUnit(UnitResult unit) {
		units.add(unit);
	}

	/**
	 * Record the number of unique records kept for a technology.
	 * @param category technology tag
	 * @param count unique records after deduplication
	 */
	public void recordCategoryTotal(String category, int count) {
		byCategory.put(category, count);
	}

	public String getSource() {
		return source;
	}

	public int getPagesFetched() {
		return pagesFetched;
	}

	public int getRawRecords() {
		return rawRecords;
	}

	public int getDroppedAtFetch() {
		return droppedAtFetch;
	}

	public int getAccepted() {
		return accepted;
	}

	public int getFailedItems() {
		return failedItems;
	}

	public int getDuplicates() {
		return duplicates;
	}

	public int getRejected(RejectReason reason) {
		return rejected.getOrDefault(reason, 0);
	}

	public Map<String, Integer> getByCategory() {
		return Collections.unmodifiableMap(byCategory);
	}

	public List<UnitResult> getUnits() {
		return Collections.unmodifiableList(units);
	}

	public List<UnitResult> getFailedUnits() {
		return units.stream().filter(u -> u.status() == UnitResult.Status.FAILED).toList();
	}

	/**
	 * Statistics block written into the raw corpus envelope.
	 * @return ordered statistics map
	 */
	public Map<String, Object> toStats() {
		Map<String, Object> stats = new LinkedHashMap<>();
		stats.put("pages_fetched", pagesFetched);
		stats.put("raw_records", rawRecords);
		stats.put("dropped_at_fetch", droppedAtFetch);
		stats.put("accepted", accepted);
		Map<String, Integer> filtered = new LinkedHashMap<>();
		rejected.forEach((reason, count) -> filtered.put(reason.code(), count));
		stats.put("filtered", filtered);
		stats.put("failed_items", failedItems);
		stats.put("duplicates", duplicates);
		stats.put("by_tech", new LinkedHashMap<>(byCategory));
		stats.put("failed_units", getFailedUnits().stream().map(UnitResult::unit).toList());
		return stats;
	}

}
