package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Command: issues, discussions, stackoverflow, reviews, harvest, synthesize, assemble
	public @Nullable String command;

	// Harvest settings
	public List<String> technologies = new ArrayList<>();

	public String minDate;

	public String outputDir;

	public @Nullable Integer maxPerUnit; // null = configured cap per source

	public boolean dryRun = false;

	// Synthesis settings
	public int count;

	public int batchSize;

	public String profile = "incident"; // incident or code_review

	public boolean resume = false;

	public @Nullable String checkpointFile; // null = default location for the profile

	// Assembly settings
	public double trainRatio;

	public long seed;

	public List<String> sources = new ArrayList<>(); // empty = the incident sources

	public boolean noSynthetic = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(HarvestProperties defaultProperties) {
		this.minDate = defaultProperties.getMinDate();
		this.outputDir = defaultProperties.getOutputDir();
		this.count = defaultProperties.getTargetExamples();
		this.batchSize = defaultProperties.getBatchSize();
		this.trainRatio = defaultProperties.getTrainRatio();
		this.seed = defaultProperties.getSeed();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Build the harvest request for this configuration.
	 * @return the request
	 */
	public HarvestRequest toHarvestRequest() {
		return new HarvestRequest(technologies, minDate, Path.of(outputDir), dryRun, maxPerUnit);
	}

	/**
	 * Sources harvested by the configured command.
	 * @return sources, empty for commands that do not harvest
	 */
	public List<SourceType> harvestSources() {
		if (command == null) {
			return List.of();
		}
		return switch (command) {
			case "issues" -> List.of(SourceType.GITHUB_ISSUES);
			case "discussions" -> List.of(SourceType.GITHUB_DISCUSSIONS);
			case "stackoverflow" -> List.of(SourceType.STACKOVERFLOW);
			case "reviews" -> List.of(SourceType.GITHUB_REVIEWS);
			case "harvest" -> ArgumentParser.INCIDENT_SOURCES;
			default -> List.of();
		};
	}

	/**
	 * Checkpoint file of the synthesis run.
	 * @return the configured file, or {@code {outputDir}/synthetic/synthetic_{profile}.json}
	 */
	public Path resolveCheckpointFile() {
		if (checkpointFile != null) {
			return Path.of(checkpointFile);
		}
		return Path.of(outputDir, SourceType.SYNTHETIC.id(), "synthetic_" + profile.replace('-', '_') + ".json");
	}

	/**
	 * Corpus sources read by the assemble command.
	 * @return configured sources, or the incident sources when none are given
	 */
	public List<SourceType> assemblySources() {
		if (sources.isEmpty()) {
			return ArgumentParser.INCIDENT_SOURCES;
		}
		return sources.stream().map(SourceType::fromId).toList();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", technologies=" + technologies
				+ ", minDate='" + minDate + '\'' + ", outputDir='" + outputDir + '\'' + ", maxPerUnit=" + maxPerUnit
				+ ", dryRun=" + dryRun + ", count=" + count + ", batchSize=" + batchSize + ", profile='" + profile
				+ '\'' + ", resume=" + resume + ", checkpointFile='" + checkpointFile + '\'' + ", trainRatio="
				+ trainRatio + ", seed=" + seed + ", sources=" + sources + ", noSynthetic=" + noSynthetic
				+ ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
