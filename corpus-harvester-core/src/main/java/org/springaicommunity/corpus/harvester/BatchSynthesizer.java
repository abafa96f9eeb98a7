package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates synthetic training examples in batches from a {@link TemplateCatalog}.
 *
 * <p>
 * Each completion call asks for several responses to one template and the first JSON
 * array in the reply is parsed. A reply without a usable array discards the batch; a
 * failed call backs off and skips the batch. Neither is retried, but both count towards
 * the per-template batch limit.
 *
 * <p>
 * The target is split evenly across technologies and then across the templates of each
 * technology. State is checkpointed every {@code checkpointEvery} accepted examples and
 * unconditionally at the end.
 */
public class BatchSynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(BatchSynthesizer.class);

	static final String ID_PREFIX = "synthetic:";

	private final CompletionClient client;

	private final JsonArrayExtractor extractor;

	private final CheckpointStore checkpointStore;

	private final SynthesisOptions options;

	private final Sleeper sleeper;

	public BatchSynthesizer(CompletionClient client, JsonArrayExtractor extractor, CheckpointStore checkpointStore,
			SynthesisOptions options, Sleeper sleeper) {
		this.client = client;
		this.extractor = extractor;
		this.checkpointStore = checkpointStore;
		this.options = options;
		this.sleeper = sleeper;
	}

	/**
	 * Run synthesis until every quota is met, the target is reached, or every template
	 * has used its batch allowance.
	 * @param catalog templates and prompts
	 * @param progress fresh or resumed progress, updated in place
	 * @return the final checkpoint, which has also been saved
	 */
	public Checkpoint synthesize(TemplateCatalog catalog, SynthesisProgress progress) {
		Map<String, List<PromptTemplate>> byTech = catalog.byTech();
		int perTech = options.targetCount() / Math.max(1, byTech.size());
		logger.info("Synthesizing {} {} examples across {} technologies (~{} each), {} already present",
				options.targetCount(), catalog.profile(), byTech.size(), perTech, progress.total());

		try {
			for (Map.Entry<String, List<PromptTemplate>> entry : byTech.entrySet()) {
				int perTemplate = Math.max(perTech / entry.getValue().size(), 1);
				for (PromptTemplate template : entry.getValue()) {
					if (progress.total() >= options.targetCount()) {
						break;
					}
					synthesizeTemplate(catalog, template, perTemplate, progress);
				}
				logger.info("{}: {} examples", entry.getKey(), progress.countForTech(entry.getKey()));
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Synthesis interrupted, saving checkpoint with {} examples", progress.total());
		}

		Checkpoint finalCheckpoint = progress.toCheckpoint(options.model());
		checkpointStore.save(finalCheckpoint);
		progress.markCheckpointed();
		logger.info("Synthesis complete: {} examples, batches {}", progress.total(),
				finalCheckpoint.stats().batchOutcomes());
		return finalCheckpoint;
	}

	private void synthesizeTemplate(TemplateCatalog catalog, PromptTemplate template, int quota,
			SynthesisProgress progress) throws InterruptedException {
		String key = template.templateKey();
		if (progress.countForTemplate(key) >= quota) {
			logger.debug("Quota of {} already met, skipping", key);
			return;
		}

		int attempt = 0;
		while (progress.countForTemplate(key) < quota && progress.total() < options.targetCount()
				&& attempt < options.maxBatchesPerTemplate()) {
			attempt++;
			int wanted = Math.min(options.batchSize(),
					Math.min(quota - progress.countForTemplate(key), options.targetCount() - progress.total()));
			BatchOutcome outcome = runBatch(catalog, template, attempt, wanted, progress);
			progress.recordBatch(outcome);

			if (progress.isCheckpointDue(options.checkpointEvery())) {
				checkpointStore.save(progress.toCheckpoint(options.model()));
				progress.markCheckpointed();
			}
			pause(outcome.state() == BatchState.API_FAILED ? options.apiErrorBackoff() : options.requestDelay());
		}
		if (progress.countForTemplate(key) < quota) {
			logger.warn("Template {} stopped at {}/{} after {} batches", key, progress.countForTemplate(key), quota,
					attempt);
		}
	}

	private BatchOutcome runBatch(TemplateCatalog catalog, PromptTemplate template, int attempt, int wanted,
			SynthesisProgress progress) {
		String key = template.templateKey();
		String prompt = catalog.generationPrompt(template, wanted);
		logger.debug("Batch {} of {}: {} -> {}", attempt, key, BatchState.PROMPTED, BatchState.AWAITING_RESPONSE);

		String reply;
		try {
			reply = client.complete(options.model(), prompt, options.maxTokens());
		}
		catch (CompletionApiException e) {
			logger.warn("Batch {} of {} failed: {}", attempt, key, e.getMessage());
			return new BatchOutcome(key, attempt, BatchState.API_FAILED, 0);
		}

		List<String> responses = extractor.extract(reply, "response");
		if (responses.isEmpty()) {
			logger.warn("Batch {} of {}: no JSON array in response, discarding", attempt, key);
			return new BatchOutcome(key, attempt, BatchState.PARSE_FAILED, 0);
		}

		int accepted = 0;
		for (String response : responses) {
			if (accepted == wanted) {
				break;
			}
			if (progress.add(toExample(catalog, template, response))) {
				accepted++;
			}
		}
		logger.debug("Batch {} of {}: {} of {} responses accepted", attempt, key, accepted, responses.size());
		return new BatchOutcome(key, attempt, BatchState.PARSED, accepted);
	}

	private TrainingExample toExample(TemplateCatalog catalog, PromptTemplate template, String response) {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put(TrainingExample.KEY, exampleId(template, response));
		meta.put(TrainingExample.SOURCE, SourceType.SYNTHETIC.id());
		meta.put(TrainingExample.TECH, template.tech());
		meta.put(SynthesisProgress.CATEGORY, template.category());
		meta.put("scenario", template.scenario());
		meta.put(SynthesisProgress.TEMPLATE, template.templateKey());
		if (template.hint() != null) {
			meta.put("bug_type", template.hint());
		}
		return TrainingExample.of(catalog.systemPrompt(), catalog.userPrompt(template), response, meta);
	}

	/**
	 * Content-derived example id: identical responses to one template share an id.
	 * @param template source template
	 * @param response generated response
	 * @return {@code synthetic:} followed by 16 hex characters
	 */
	static String exampleId(PromptTemplate template, String response) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest((template.templateKey() + "\n" + response).getBytes(StandardCharsets.UTF_8));
			return ID_PREFIX + HexFormat.of().formatHex(hash, 0, 8);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	private void pause(Duration delay) throws InterruptedException {
		if (!delay.isZero() && !delay.isNegative()) {
			sleeper.sleep(delay);
		}
	}

}
