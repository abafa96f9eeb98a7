package org.springaicommunity.corpus.harvester.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.corpus.harvester.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Corpus Harvester CLI Application
 *
 * Plain Java command-line application that harvests incident and code-review
 * conversations, synthesizes examples from prompt templates and assembles the train/eval
 * dataset. Uses HarvesterBuilder for service wiring.
 *
 * Usage: java -jar corpus-harvester-cli.jar COMMAND [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN, STACKEXCHANGE_API_KEY, ANTHROPIC_API_KEY
 *
 * Examples: java -jar corpus-harvester-cli.jar harvest --tech kubernetes java -jar
 * corpus-harvester-cli.jar synthesize --count 500 --resume java -jar
 * corpus-harvester-cli.jar assemble --seed 42
 */
public class HarvesterCli {

	private static final Logger logger = LoggerFactory.getLogger(HarvesterCli.class);

	static final String PROCESSED_DIR = "processed";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Run failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		return run(args, new HarvestProperties(), HarvesterBuilder.create());
	}

	/**
	 * Run a command with the given defaults and builder. Credentials are read from the
	 * environment only for services the builder cannot otherwise build.
	 * @param args command-line arguments
	 * @param properties default properties, updated with the parsed options
	 * @param builder service builder
	 * @return process exit code
	 */
	static int run(String[] args, HarvestProperties properties, HarvesterBuilder builder) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		// Parse and validate arguments
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		applyVerbosity(config.verbose);
		logConfiguration(config);

		properties.setOutputDir(config.outputDir);
		properties.setMinDate(config.minDate);
		properties.setTargetExamples(config.count);
		properties.setBatchSize(config.batchSize);
		properties.setTrainRatio(config.trainRatio);
		properties.setSeed(config.seed);
		builder.properties(properties);

		String command = config.command != null ? config.command : "";
		return switch (command) {
			case "synthesize" -> runSynthesis(config, builder);
			case "assemble" -> runAssembly(config, builder);
			default -> runHarvest(command, config, builder);
		};
	}

	private static int runHarvest(String command, ParsedConfiguration config, HarvesterBuilder builder) {
		List<SourceType> sources = config.harvestSources();
		builder.stackExchangeKeyFromEnv();
		if (sources.stream().anyMatch(source -> source != SourceType.STACKOVERFLOW)) {
			new ArgumentParser(builder.getProperties()).validateEnvironment(command);
			builder.githubTokenFromEnv();
		}

		HarvestRequest request = config.toHarvestRequest();
		List<HarvestResult> results;
		if (sources.size() == 1) {
			results = List.of(builder.buildHarvester(sources.get(0)).harvest(request));
		}
		else {
			results = builder.buildOrchestrator(sources).harvestAll(request);
		}

		boolean allSucceeded = true;
		for (HarvestResult result : results) {
			logHarvestResult(result, config.verbose);
			allSucceeded &= result.isSuccess();
		}
		return allSucceeded ? 0 : 1;
	}

	private static int runSynthesis(ParsedConfiguration config, HarvesterBuilder builder) {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		builder.objectMapper(objectMapper);
		new ArgumentParser(builder.getProperties()).validateEnvironment("synthesize");
		builder.anthropicApiKeyFromEnv();

		Path checkpointFile = config.resolveCheckpointFile();
		TemplateCatalog catalog = TemplateCatalog.forProfile(objectMapper, config.profile);
		CheckpointStore store = builder.buildCheckpointStore(checkpointFile);

		SynthesisProgress progress = SynthesisProgress.fresh();
		if (config.resume) {
			Optional<Checkpoint> existing = store.load();
			if (existing.isPresent()) {
				progress = SynthesisProgress.resumeFrom(existing.get());
				logger.info("Resuming from {} with {} examples", checkpointFile, progress.total());
			}
			else {
				logger.info("No checkpoint at {}, starting fresh", checkpointFile);
			}
		}
		else if (Files.exists(checkpointFile)) {
			logger.warn("Existing checkpoint {} will be replaced (use --resume to continue it)", checkpointFile);
		}

		Checkpoint checkpoint = builder.buildSynthesizer(checkpointFile).synthesize(catalog, progress);

		logger.info("Synthesis completed: {} examples for profile {}", checkpoint.stats().total(), catalog.profile());
		logger.info("Checkpoint: {}", checkpointFile);
		logger.info("By tech: {}", checkpoint.stats().byTech());
		logger.info("Batch outcomes: {}", checkpoint.stats().batchOutcomes());
		if (config.verbose) {
			logger.info("By template: {}", checkpoint.stats().byTemplate());
		}
		if (checkpoint.stats().total() < config.count) {
			logger.warn("Target of {} not reached: template batch limits exhausted", config.count);
		}
		return 0;
	}

	private static int runAssembly(ParsedConfiguration config, HarvesterBuilder builder) {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		builder.objectMapper(objectMapper);
		CorpusRepository repository = builder.buildCorpusRepository();
		DatasetAssembler assembler = builder.buildAssembler();
		Path outputDir = Path.of(config.outputDir);

		List<RawCorpus> corpora = new ArrayList<>();
		for (SourceType source : config.assemblySources()) {
			Path file = BaseHarvestService.combinedFile(outputDir, source);
			Optional<RawCorpus> corpus = repository.loadRawCorpus(file);
			if (corpus.isPresent()) {
				logger.info("Loaded {} records from {}", corpus.get().examples().size(), file);
				corpora.add(corpus.get());
			}
			else {
				logger.warn("No corpus for {} at {}", source.id(), file);
			}
		}
		List<TrainingExample> curated = assembler.curate(corpora);

		List<TrainingExample> synthetic = List.of();
		if (!config.noSynthetic) {
			Path checkpointFile = config.resolveCheckpointFile();
			Optional<Checkpoint> checkpoint = builder.buildCheckpointStore(checkpointFile).load();
			if (checkpoint.isPresent()) {
				synthetic = checkpoint.get().examples();
				logger.info("Loaded {} synthetic examples from {}", synthetic.size(), checkpointFile);
			}
			else {
				logger.info("No synthetic checkpoint at {}", checkpointFile);
			}
		}

		if (curated.isEmpty() && synthetic.isEmpty()) {
			logger.error("Nothing to assemble in {}", outputDir);
			return 1;
		}

		CorpusPartition partition = assembler.assemble(curated, synthetic, config.trainRatio, config.seed);
		List<TrainingExample> all = new ArrayList<>(curated);
		all.addAll(synthetic);

		Path processedDir = outputDir.resolve(PROCESSED_DIR);
		if (config.dryRun) {
			logger.info("Dry run: {} train and {} eval examples would be written to {}", partition.train().size(),
					partition.eval().size(), processedDir);
			return 0;
		}
		assembler.writePartition(partition, processedDir, DatasetAssembler.countBySource(all));
		logger.info("Dataset written to {}", processedDir);
		return 0;
	}

	private static void applyVerbosity(boolean verbose) {
		if (verbose && LoggerFactory.getLogger("org.springaicommunity.corpus.harvester")
				instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command);
		logger.info("  Output directory: {}", config.outputDir);
		logger.info("  Dry run: {}", config.dryRun);
		logger.info("  Verbose: {}", config.verbose);
		switch (config.command != null ? config.command : "") {
			case "synthesize":
				logger.info("  Profile: {}", config.profile);
				logger.info("  Target count: {}", config.count);
				logger.info("  Batch size: {}", config.batchSize);
				logger.info("  Resume: {}", config.resume);
				logger.info("  Checkpoint: {}", config.resolveCheckpointFile());
				break;
			case "assemble":
				logger.info("  Sources: {}", config.assemblySources());
				logger.info("  Synthetic: {}", config.noSynthetic ? "(excluded)" : config.resolveCheckpointFile());
				logger.info("  Train ratio: {}", config.trainRatio);
				logger.info("  Seed: {}", config.seed);
				break;
			default:
				logger.info("  Technologies: {}", config.technologies.isEmpty() ? "all" : config.technologies);
				logger.info("  Min date: {}", config.minDate);
				logger.info("  Max per unit: {}", config.maxPerUnit != null ? config.maxPerUnit : "(per source)");
				break;
		}
	}

	private static void logHarvestResult(HarvestResult result, boolean verbose) {
		if (!result.isSuccess()) {
			logger.error("Harvest of {} failed: {}", result.source().id(), result.error());
			return;
		}
		HarvestContext context = result.context();
		logger.info("Harvest of {} completed", result.source().id());
		logger.info("  Records: {}", result.records().size());
		logger.info("  Pages fetched: {}", context.getPagesFetched());
		logger.info("  Raw records: {}", context.getRawRecords());
		logger.info("  Failed items: {}", context.getFailedItems());
		logger.info("  Duplicates: {}", context.getDuplicates());
		logger.info("  By tech: {}", context.getByCategory());
		logger.info("  Output: {}", result.corpusFile() != null ? result.corpusFile() : "(dry run)");
		for (UnitResult unit : context.getFailedUnits()) {
			logger.warn("  FAILED: {} [{}]: {}", unit.unit(), unit.category(), unit.error());
		}
		if (verbose) {
			for (RejectReason reason : RejectReason.values()) {
				int count = context.getRejected(reason);
				if (reason != RejectReason.NONE && count > 0) {
					logger.info("  Rejected {}: {}", reason.code(), count);
				}
			}
		}
	}

}
