package org.springaicommunity.corpus.harvester.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.corpus.harvester.BaseHarvestService;
import org.springaicommunity.corpus.harvester.CandidateRecord;
import org.springaicommunity.corpus.harvester.Checkpoint;
import org.springaicommunity.corpus.harvester.FileCheckpointStore;
import org.springaicommunity.corpus.harvester.FileSystemCorpusRepository;
import org.springaicommunity.corpus.harvester.HarvestProperties;
import org.springaicommunity.corpus.harvester.HarvesterBuilder;
import org.springaicommunity.corpus.harvester.ObjectMapperFactory;
import org.springaicommunity.corpus.harvester.Provenance;
import org.springaicommunity.corpus.harvester.RawCorpus;
import org.springaicommunity.corpus.harvester.SourceType;
import org.springaicommunity.corpus.harvester.SynthesisStats;
import org.springaicommunity.corpus.harvester.TrainingExample;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the command-line entry point. Only commands that need no credentials are run.
 */
@DisplayName("HarvesterCli Tests")
class HarvesterCliTest {

	private static final String PROBLEM = "Deployment fails with error ImagePullBackOff after the registry moved. "
			+ "Pods never start and kubectl describe shows the pull being denied.";

	private static final String SOLUTION = "The issue is caused by a stale image pull secret. Update the secret with "
			+ "the new registry credentials and run kubectl rollout restart.";

	@TempDir
	Path tempDir;

	private static int run(String... args) {
		return HarvesterCli.run(args, new HarvestProperties(), HarvesterBuilder.create());
	}

	private void writeIssueCorpus(int count) {
		List<CandidateRecord> records = new ArrayList<>();
		for (int i = 1; i <= count; i++) {
			records.add(new CandidateRecord(CandidateRecord.key(SourceType.GITHUB_ISSUES, "kubernetes/kubernetes", i),
					"kubernetes", "Image pull fails " + i, PROBLEM, SOLUTION, List.of("kind/bug"),
					new Provenance(SourceType.GITHUB_ISSUES, "kubernetes/kubernetes",
							"https://github.com/kubernetes/kubernetes/issues/" + i, Instant.parse("2023-03-01T00:00:00Z")),
					2));
		}
		new FileSystemCorpusRepository(ObjectMapperFactory.create()).saveRawCorpus(
				BaseHarvestService.combinedFile(tempDir, SourceType.GITHUB_ISSUES),
				new RawCorpus(Instant.now(), SourceType.GITHUB_ISSUES.id(), "2021-01-01", count, Map.of(), records));
	}

	private void writeSyntheticCheckpoint(int count) {
		List<TrainingExample> examples = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			Map<String, Object> meta = new LinkedHashMap<>();
			meta.put(TrainingExample.KEY, "synthetic:" + String.format("%016x", i));
			meta.put(TrainingExample.SOURCE, "synthetic");
			meta.put(TrainingExample.TECH, "docker");
			examples.add(TrainingExample.of("system", "user " + i, "assistant " + i, meta));
		}
		new FileCheckpointStore(tempDir.resolve("synthetic").resolve("synthetic_incident.json"),
				ObjectMapperFactory.create())
			.save(new Checkpoint(Instant.now(), "test-model", SynthesisStats.empty(), examples));
	}

	@Nested
	@DisplayName("Argument Handling Tests")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Should print help and succeed without arguments")
		void shouldShowHelp() {
			assertThat(run()).isZero();
			assertThat(run("issues", "--help")).isZero();
		}

		@Test
		@DisplayName("Should reject an unknown option")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> run("assemble", "--zip")).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("--zip");
		}

	}

	@Nested
	@DisplayName("Assemble Tests")
	class AssembleTest {

		@Test
		@DisplayName("Should fail when there is nothing to assemble")
		void shouldFailWithoutInput() {
			assertThat(run("assemble", "-o", tempDir.toString())).isEqualTo(1);
		}

		@Test
		@DisplayName("Should write train, eval and statistics from harvested corpora")
		void shouldAssembleCuratedCorpus() throws Exception {
			writeIssueCorpus(10);

			int exit = run("assemble", "-o", tempDir.toString(), "--no-synthetic", "--train-ratio", "0.8");

			assertThat(exit).isZero();
			Path processed = tempDir.resolve("processed");
			assertThat(Files.readAllLines(processed.resolve("train.jsonl"))).hasSize(8);
			assertThat(Files.readAllLines(processed.resolve("eval.jsonl"))).hasSize(2);
			assertThat(Files.readString(processed.resolve("preprocessing_stats.json"))).contains("\"github_issues\" : 10");
		}

		@Test
		@DisplayName("Should include the synthetic checkpoint unless disabled")
		void shouldIncludeSyntheticExamples() throws Exception {
			writeIssueCorpus(3);
			writeSyntheticCheckpoint(7);

			int exit = run("assemble", "-o", tempDir.toString(), "--train-ratio", "1.0");

			assertThat(exit).isZero();
			List<String> train = Files.readAllLines(tempDir.resolve("processed").resolve("train.jsonl"));
			assertThat(train).hasSize(10);
			assertThat(train).filteredOn(line -> line.contains("\"source\":\"synthetic\"")).hasSize(7);
			assertThat(Files.readAllLines(tempDir.resolve("processed").resolve("eval.jsonl"))).isEmpty();
		}

		@Test
		@DisplayName("Should write nothing on a dry run")
		void shouldNotWriteOnDryRun() {
			writeIssueCorpus(4);

			int exit = run("assemble", "-o", tempDir.toString(), "--dry-run", "--no-synthetic");

			assertThat(exit).isZero();
			assertThat(tempDir.resolve("processed")).doesNotExist();
		}

	}

}
