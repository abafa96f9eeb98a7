package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Parameters of one harvest run.
 *
 * @param technologies technologies to harvest; empty harvests every configured one
 * @param minDate date floor in {@code YYYY-MM-DD} format
 * @param outputDir base directory for raw corpora
 * @param dryRun fetch and filter but write nothing
 * @param maxPerUnit overrides the per-repository or per-tag cap of the source when set
 */
public record HarvestRequest(List<String> technologies, String minDate, Path outputDir, boolean dryRun,
		@Nullable Integer maxPerUnit) {

	public HarvestRequest {
		technologies = List.copyOf(technologies);
		// Fail fast on a malformed date
		DateFloor.parse(minDate);
	}

	/**
	 * Request for every technology with the configured defaults.
	 * @param properties harvest properties
	 * @return the request
	 */
	public static HarvestRequest defaults(HarvestProperties properties) {
		return new HarvestRequest(List.of(), properties.getMinDate(), Path.of(properties.getOutputDir()), false,
				null);
	}

	public Instant minDateInstant() {
		return DateFloor.parse(minDate);
	}

	/**
	 * The per-unit cap to apply.
	 * @param configured the source's configured cap
	 * @return the override when present, otherwise the configured cap
	 */
	public int capOr(int configured) {
		return maxPerUnit != null ? maxPerUnit : configured;
	}

}
