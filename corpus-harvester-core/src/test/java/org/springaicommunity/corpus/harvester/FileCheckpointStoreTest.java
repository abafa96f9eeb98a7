package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileCheckpointStore}.
 */
@DisplayName("FileCheckpointStore Tests")
class FileCheckpointStoreTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("Should return empty when no checkpoint was saved")
	void shouldReturnEmptyWhenMissing() {
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("missing.json"),
				ObjectMapperFactory.create());

		assertThat(store.load()).isEmpty();
	}

	@Test
	@DisplayName("Should restore examples and counters from the saved file")
	void shouldRoundTripCheckpoint() {
		Path file = tempDir.resolve("synthetic").resolve("synthetic_incident.json");
		FileCheckpointStore store = new FileCheckpointStore(file, ObjectMapperFactory.create());
		SynthesisProgress progress = SynthesisProgress.fresh();
		progress.add(TestRecords.example("synthetic:0123456789abcdef", "synthetic", "docker"));
		progress.recordBatch(new BatchOutcome("docker/networking/port-conflict", 1, BatchState.PARSED, 1));
		progress.recordBatch(new BatchOutcome("docker/networking/port-conflict", 2, BatchState.PARSE_FAILED, 0));

		store.save(progress.toCheckpoint("test-model"));
		Optional<Checkpoint> loaded = store.load();

		assertThat(file).exists();
		assertThat(loaded).isPresent();
		Checkpoint checkpoint = loaded.get();
		assertThat(checkpoint.model()).isEqualTo("test-model");
		assertThat(checkpoint.examples()).hasSize(1);
		assertThat(checkpoint.examples().get(0).naturalKey()).isEqualTo("synthetic:0123456789abcdef");
		assertThat(checkpoint.stats().byTech()).containsEntry("docker", 1);
		assertThat(checkpoint.stats().batchOutcomes()).containsEntry(BatchState.PARSED, 1)
			.containsEntry(BatchState.PARSE_FAILED, 1);
	}

	@Test
	@DisplayName("Should replace the previous snapshot without leaving temporary files")
	void shouldReplacePreviousSnapshot() throws Exception {
		Path file = tempDir.resolve("checkpoint.json");
		FileCheckpointStore store = new FileCheckpointStore(file, ObjectMapperFactory.create());
		TrainingExample first = TestRecords.example("synthetic:aaaaaaaaaaaaaaaa", "synthetic", "docker");
		TrainingExample second = TestRecords.example("synthetic:bbbbbbbbbbbbbbbb", "synthetic", "docker");

		store.save(new Checkpoint(Instant.now(), "m", SynthesisStats.empty(), List.of(first)));
		store.save(new Checkpoint(Instant.now(), "m", SynthesisStats.empty(), List.of(first, second)));

		assertThat(store.load()).get().extracting(c -> c.examples().size()).isEqualTo(2);
		try (var files = Files.list(tempDir)) {
			assertThat(files.map(p -> p.getFileName().toString())).containsExactly("checkpoint.json");
		}
	}

	@Test
	@DisplayName("Should keep example metadata under _meta")
	void shouldWriteMetaField() throws Exception {
		Path file = tempDir.resolve("checkpoint.json");
		FileCheckpointStore store = new FileCheckpointStore(file, ObjectMapperFactory.create());

		store.save(new Checkpoint(Instant.now(), "m", SynthesisStats.empty(),
				List.of(TestRecords.example("synthetic:cccccccccccccccc", "synthetic", "ansible"))));

		String json = Files.readString(file);
		assertThat(json).contains("\"_meta\"").contains("\"generated_at\"").contains("\"batch_outcomes\"");
	}

}
