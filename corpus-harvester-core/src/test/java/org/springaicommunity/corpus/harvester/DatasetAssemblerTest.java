package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DatasetAssembler}.
 */
@DisplayName("DatasetAssembler Tests")
class DatasetAssemblerTest {

	@TempDir
	Path tempDir;

	private DatasetAssembler assembler;

	private FileSystemCorpusRepository repository;

	@BeforeEach
	void setUp() {
		repository = new FileSystemCorpusRepository(ObjectMapperFactory.create());
		assembler = new DatasetAssembler(repository, new ExampleFormatter());
	}

	private static List<TrainingExample> examples(String prefix, String source, int count) {
		List<TrainingExample> examples = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			examples.add(TestRecords.example(prefix + i, source, i % 2 == 0 ? "docker" : "kubernetes"));
		}
		return examples;
	}

	private static Set<String> keys(List<TrainingExample> examples) {
		Set<String> keys = new HashSet<>();
		examples.forEach(e -> keys.add(e.naturalKey()));
		return keys;
	}

	@Nested
	@DisplayName("Partition Tests")
	class PartitionTest {

		@Test
		@DisplayName("Should cut at floor(N * ratio) with disjoint partitions")
		void shouldCutAtFloor() {
			List<TrainingExample> curated = examples("github_issues:o/r#", "github_issues", 7);
			List<TrainingExample> synthetic = examples("synthetic:", "synthetic", 4);

			CorpusPartition partition = assembler.assemble(curated, synthetic, 0.9, 42);

			assertThat(partition.train()).hasSize(9);
			assertThat(partition.eval()).hasSize(2);
			assertThat(keys(partition.train())).doesNotContainAnyElementsOf(keys(partition.eval()));
			Set<String> all = keys(partition.train());
			all.addAll(keys(partition.eval()));
			assertThat(all).hasSize(11);
		}

		@Test
		@DisplayName("Should produce the same partition for the same seed")
		void shouldBeReproducible() {
			List<TrainingExample> curated = examples("github_issues:o/r#", "github_issues", 20);

			CorpusPartition first = assembler.assemble(curated, List.of(), 0.8, 7);
			CorpusPartition second = assembler.assemble(curated, List.of(), 0.8, 7);
			CorpusPartition other = assembler.assemble(curated, List.of(), 0.8, 8);

			assertThat(second.train()).isEqualTo(first.train());
			assertThat(second.eval()).isEqualTo(first.eval());
			assertThat(other.train()).isNotEqualTo(first.train());
		}

		@Test
		@DisplayName("Should put everything in one partition at the ratio bounds")
		void shouldHandleRatioBounds() {
			List<TrainingExample> curated = examples("k", "github_issues", 5);

			assertThat(assembler.assemble(curated, List.of(), 1.0, 1).eval()).isEmpty();
			assertThat(assembler.assemble(curated, List.of(), 0.0, 1).train()).isEmpty();
		}

		@Test
		@DisplayName("Should reject a ratio outside [0, 1]")
		void shouldRejectInvalidRatio() {
			assertThatThrownBy(() -> assembler.assemble(List.of(), List.of(), 1.5, 1))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("trainRatio");
		}

		@Test
		@DisplayName("Should reject a key present in both inputs")
		void shouldRejectDuplicateKeys() {
			List<TrainingExample> curated = List.of(TestRecords.example("dup", "github_issues", "docker"));
			List<TrainingExample> synthetic = List.of(TestRecords.example("dup", "synthetic", "docker"));

			assertThatThrownBy(() -> assembler.assemble(curated, synthetic, 0.9, 42))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("dup");
		}

		@Test
		@DisplayName("Should return empty partitions for no input")
		void shouldHandleEmptyInput() {
			CorpusPartition partition = assembler.assemble(List.of(), List.of(), 0.9, 42);

			assertThat(partition.size()).isZero();
		}

	}

	@Nested
	@DisplayName("Curation Tests")
	class CurationTest {

		@Test
		@DisplayName("Should keep the first occurrence of a key across corpora")
		void shouldDeduplicateAcrossCorpora() {
			RawCorpus issues = new RawCorpus(Instant.now(), "github_issues", "2023-01-01", 2, Map.of(),
					List.of(TestRecords.incident("k1"), TestRecords.incident("k2")));
			RawCorpus again = new RawCorpus(Instant.now(), "github_issues", "2023-01-01", 1, Map.of(),
					List.of(TestRecords.incident("k2", "Other title", TestRecords.PROBLEM, TestRecords.SOLUTION)));

			List<TrainingExample> curated = assembler.curate(List.of(issues, again));

			assertThat(curated).extracting(TrainingExample::naturalKey).containsExactly("k1", "k2");
			assertThat(curated.get(1).messages().get(1).content()).doesNotContain("Other title");
		}

		@Test
		@DisplayName("Should count examples by source")
		void shouldCountBySource() {
			List<TrainingExample> all = new ArrayList<>(examples("a", "github_issues", 3));
			all.addAll(examples("b", "synthetic", 2));

			assertThat(DatasetAssembler.countBySource(all)).containsExactly(Map.entry("github_issues", 3),
					Map.entry("synthetic", 2));
		}

	}

	@Nested
	@DisplayName("Output Tests")
	class OutputTest {

		@Test
		@DisplayName("Should write byte-identical partition files on rerun")
		void shouldWriteIdenticalFiles() throws Exception {
			List<TrainingExample> curated = examples("github_issues:o/r#", "github_issues", 12);
			Path first = tempDir.resolve("first");
			Path second = tempDir.resolve("second");

			CorpusPartition partition = assembler.assemble(curated, List.of(), 0.75, 42);
			assembler.writePartition(partition, first, DatasetAssembler.countBySource(curated));
			assembler.writePartition(assembler.assemble(curated, List.of(), 0.75, 42), second,
					DatasetAssembler.countBySource(curated));

			assertThat(Files.readAllBytes(first.resolve(DatasetAssembler.TRAIN_FILE)))
				.isEqualTo(Files.readAllBytes(second.resolve(DatasetAssembler.TRAIN_FILE)));
			assertThat(Files.readAllBytes(first.resolve(DatasetAssembler.EVAL_FILE)))
				.isEqualTo(Files.readAllBytes(second.resolve(DatasetAssembler.EVAL_FILE)));
			assertThat(Files.readAllLines(first.resolve(DatasetAssembler.TRAIN_FILE))).hasSize(9);
		}

		@Test
		@DisplayName("Should write statistics next to the partitions")
		void shouldWriteStatistics() throws Exception {
			List<TrainingExample> curated = examples("github_issues:o/r#", "github_issues", 4);

			assembler.writePartition(assembler.assemble(curated, List.of(), 0.5, 1), tempDir,
					DatasetAssembler.countBySource(curated));

			String stats = Files.readString(tempDir.resolve(DatasetAssembler.STATS_FILE));
			assertThat(stats).contains("\"train_count\" : 2")
				.contains("\"eval_count\" : 2")
				.contains("\"github_issues\" : 4")
				.contains("\"processed_at\"");
		}

		@Test
		@DisplayName("Should read back what it wrote")
		void shouldReadBackPartition() {
			List<TrainingExample> curated = examples("github_issues:o/r#", "github_issues", 3);

			assembler.writePartition(assembler.assemble(curated, List.of(), 1.0, 1), tempDir, Map.of());

			List<TrainingExample> train = repository.readJsonl(tempDir.resolve(DatasetAssembler.TRAIN_FILE));
			assertThat(keys(train)).isEqualTo(keys(curated));
			assertThat(train.get(0).metaString(TrainingExample.SOURCE)).isEqualTo("github_issues");
		}

	}

}
