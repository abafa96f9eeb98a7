package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemCorpusRepository} and {@link AtomicFileWriter}.
 */
@DisplayName("FileSystemCorpusRepository Tests")
class FileSystemCorpusRepositoryTest {

	@TempDir
	Path tempDir;

	private FileSystemCorpusRepository repository;

	@BeforeEach
	void setUp() {
		repository = new FileSystemCorpusRepository(ObjectMapperFactory.create());
	}

	@Test
	@DisplayName("Should save and load a raw corpus envelope")
	void shouldRoundTripRawCorpus() throws IOException {
		Path file = tempDir.resolve("github_issues").resolve("all_github_issues.json");
		RawCorpus corpus = new RawCorpus(Instant.parse("2024-05-01T12:00:00Z"), "github_issues", "2023-01-01", 1,
				Map.of("accepted", 1), List.of(TestRecords.incident("github_issues:kubernetes/kubernetes#1")));

		repository.saveRawCorpus(file, corpus);
		Optional<RawCorpus> loaded = repository.loadRawCorpus(file);

		assertThat(loaded).isPresent();
		assertThat(loaded.get().examples()).containsExactlyElementsOf(corpus.examples());
		assertThat(loaded.get().minDate()).isEqualTo("2023-01-01");
		assertThat(Files.readString(file)).contains("\"scraped_at\"").contains("\"natural_key\"");
	}

	@Test
	@DisplayName("Should return empty for a missing corpus")
	void shouldReturnEmptyForMissingCorpus() {
		assertThat(repository.loadRawCorpus(tempDir.resolve("absent.json"))).isEmpty();
	}

	@Test
	@DisplayName("Should write one compact JSON object per line")
	void shouldWriteJsonLines() throws IOException {
		Path file = tempDir.resolve("train.jsonl");
		List<TrainingExample> examples = List.of(TestRecords.example("a", "github_issues", "docker"),
				TestRecords.example("b", "synthetic", "terraform"));

		repository.writeJsonl(file, examples);

		List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		assertThat(lines).hasSize(2);
		assertThat(lines.get(0)).startsWith("{\"messages\":[{\"role\":\"system\"").contains("\"_meta\":{\"key\":\"a\"");
		assertThat(repository.readJsonl(file)).isEqualTo(examples);
	}

	@Test
	@DisplayName("Should retry a failed write once")
	void shouldRetryFailedWriteOnce() throws IOException {
		Path file = tempDir.resolve("retry.txt");
		AtomicInteger attempts = new AtomicInteger();

		AtomicFileWriter.write(file, out -> {
			if (attempts.incrementAndGet() == 1) {
				throw new IOException("disk hiccup");
			}
			out.write("ok".getBytes(StandardCharsets.UTF_8));
		});

		assertThat(attempts).hasValue(2);
		assertThat(Files.readString(file)).isEqualTo("ok");
	}

	@Test
	@DisplayName("Should keep the previous content when both attempts fail")
	void shouldSurfaceRepeatedFailure() throws IOException {
		Path file = tempDir.resolve("stable.txt");
		Files.writeString(file, "previous");

		assertThatThrownBy(() -> AtomicFileWriter.write(file, out -> {
			out.write("partial".getBytes(StandardCharsets.UTF_8));
			throw new IOException("disk full");
		})).isInstanceOf(CorpusWriteException.class).hasMessageContaining("disk full");

		assertThat(Files.readString(file)).isEqualTo("previous");
		try (var files = Files.list(tempDir)) {
			assertThat(files).hasSize(1);
		}
	}

}
