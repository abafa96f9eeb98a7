package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class for harvest services providing the shared per-technology, per-unit loop,
 * deduplication and corpus persistence.
 *
 * <p>
 * A unit is one repository or tag. A failing unit is recorded in the
 * {@link HarvestContext} and the loop continues with the next one. Only a
 * {@link CorpusWriteException} ends the run.
 */
public abstract class BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(BaseHarvestService.class);

	protected final TargetCatalog targets;

	protected final CorpusRepository repository;

	protected final HarvestProperties properties;

	protected BaseHarvestService(TargetCatalog targets, CorpusRepository repository, HarvestProperties properties) {
		this.targets = targets;
		this.repository = repository;
		this.properties = properties;
	}

	/**
	 * Get the source this service harvests.
	 */
	public abstract SourceType getSourceType();

	/**
	 * Harvest the kept candidates of one unit. Provider errors propagate to the caller.
	 * @param tech technology tag
	 * @param unit repository or tag
	 * @param request the run parameters
	 * @param context counters of the run
	 * @return accepted candidates in fetch order
	 */
	protected abstract List<CandidateRecord> harvestUnit(String tech, String unit, HarvestRequest request,
			HarvestContext context);

	/**
	 * Template method: harvest every configured unit of every requested technology.
	 * @param request the run parameters
	 * @return the result, with the combined corpus file unless this is a dry run
	 */
	public HarvestResult harvest(HarvestRequest request) {
		HarvestContext context = new HarvestContext(getSourceType().id());
		Map<String, List<String>> byTech = targets.targets(getSourceType(), request.technologies());
		logger.info("Harvesting {} for {} technologies since {}", getSourceType().id(), byTech.size(),
				request.minDate());

		List<List<CandidateRecord>> perTech = new ArrayList<>();
		for (Map.Entry<String, List<String>> entry : byTech.entrySet()) {
			String tech = entry.getKey();
			List<CandidateRecord> techRecords = new ArrayList<>();
			for (String unit : entry.getValue()) {
				techRecords.addAll(runUnit(tech, unit, request, context));
			}

			DeduplicationResult<CandidateRecord> unique = Deduplicator.deduplicate(techRecords,
					CandidateRecord::naturalKey);
			context.recordDuplicates(unique.duplicatesRemoved());
			context.recordCategoryTotal(tech, unique.unique().size());
			logger.info("{} {}: {} unique records", getSourceType().id(), tech, unique.unique().size());

			if (!request.dryRun() && !unique.unique().isEmpty()) {
				saveCorpus(techFile(request, tech), unique.unique(), request, context);
			}
			perTech.add(unique.unique());
		}

		DeduplicationResult<CandidateRecord> combined = Deduplicator.merge(perTech, CandidateRecord::naturalKey);
		context.recordDuplicates(combined.duplicatesRemoved());

		Path combinedFile = null;
		if (request.dryRun()) {
			logger.info("Dry run: {} records from {} would be written", combined.unique().size(),
					getSourceType().id());
		}
		else {
			combinedFile = combinedFile(request);
			saveCorpus(combinedFile, combined.unique(), request, context);
		}
		logger.info("Harvest of {} complete: {} records, {} failed units", getSourceType().id(),
				combined.unique().size(), context.getFailedUnits().size());
		return new HarvestResult(getSourceType(), combinedFile, combined.unique(), context, null);
	}

	private List<CandidateRecord> runUnit(String tech, String unit, HarvestRequest request, HarvestContext context) {
		logger.info("Harvesting {} [{}] from {}", getSourceType().id(), tech, unit);
		try {
			List<CandidateRecord> kept = harvestUnit(tech, unit, request, context);
			context.recordUnit(UnitResult.completed(unit, tech, kept.size()));
			logger.info("Kept {} records from {}", kept.size(), unit);
			return kept;
		}
		catch (CorpusWriteException e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.warn("Unit {} failed, continuing with next: {}", unit, e.getMessage());
			context.recordUnit(UnitResult.failed(unit, tech, 0, e.getMessage() != null ? e.getMessage()
					: e.getClass().getSimpleName()));
			return List.of();
		}
	}

	/**
	 * Classify a candidate.
	 * @param candidate the candidate
	 * @param filter the filter to apply
	 * @return accepted, or skipped with the first failing reason
	 */
	protected ItemResult<CandidateRecord> screen(CandidateRecord candidate, QualityFilter filter) {
		Verdict verdict = filter.classify(candidate);
		ItemResult<CandidateRecord> result = verdict.passed() ? ItemResult.accepted(candidate)
				: ItemResult.skipped(verdict.reason());
		if (!result.isAccepted()) {
			logger.debug("Rejected {}: {}", candidate.naturalKey(), verdict.reason().code());
		}
		return result;
	}

	/**
	 * Record the final outcome of one candidate and collect it when accepted.
	 * @param result final outcome
	 * @param kept accepted candidates so far
	 * @param context receives the outcome
	 */
	protected void settle(ItemResult<CandidateRecord> result, List<CandidateRecord> kept, HarvestContext context) {
		context.recordOutcome(result);
		if (result.isAccepted() && result.value() != null) {
			kept.add(result.value());
		}
	}

	protected Path sourceDir(HarvestRequest request) {
		return request.outputDir().resolve(getSourceType().id());
	}

	protected Path techFile(HarvestRequest request, String tech) {
		return sourceDir(request).resolve(tech + "_" + getSourceType().id() + ".json");
	}

	protected Path combinedFile(HarvestRequest request) {
		return combinedFile(request.outputDir(), getSourceType());
	}

	/**
	 * Location of the combined corpus of a source.
	 * @param outputDir base output directory
	 * @param source the source
	 * @return {@code {outputDir}/{source}/all_{source}.json}
	 */
	public static Path combinedFile(Path outputDir, SourceType source) {
		return outputDir.resolve(source.id()).resolve("all_" + source.id() + ".json");
	}

	private void saveCorpus(Path file, List<CandidateRecord> records, HarvestRequest request,
			HarvestContext context) {
		repository.saveRawCorpus(file,
				new RawCorpus(Instant.now(), getSourceType().id(), request.minDate(), records.size(),
						context.toStats(), records));
		logger.info("Saved {} records to {}", records.size(), file);
	}

}
