package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * File system implementation of {@link CorpusRepository}.
 *
 * <p>
 * Writes go through {@link AtomicFileWriter}. JSON Lines output uses the compact writer so
 * that a rerun with the same inputs produces byte-identical files.
 */
public class FileSystemCorpusRepository implements CorpusRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCorpusRepository.class);

	private final ObjectMapper objectMapper;

	public FileSystemCorpusRepository(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public void saveRawCorpus(Path file, RawCorpus corpus) {
		writeJson(file, corpus);
		logger.info("Saved {} {} records to {}", corpus.total(), corpus.source(), file);
	}

	@Override
	public Optional<RawCorpus> loadRawCorpus(Path file) {
		if (!Files.exists(file)) {
			logger.warn("Corpus file not found, skipping: {}", file);
			return Optional.empty();
		}
		try {
			RawCorpus corpus = objectMapper.readValue(file.toFile(), RawCorpus.class);
			logger.info("Loaded {} {} records from {}", corpus.examples().size(), corpus.source(), file);
			return Optional.of(corpus);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read corpus " + file, e);
		}
	}

	@Override
	public void writeJsonl(Path file, List<TrainingExample> examples) {
		ObjectWriter writer = objectMapper.writer();
		AtomicFileWriter.write(file, out -> {
			BufferedWriter lines = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
			for (TrainingExample example : examples) {
				lines.write(writer.writeValueAsString(example));
				lines.write('\n');
			}
			lines.flush();
		});
		logger.info("Wrote {} examples to {}", examples.size(), file);
	}

	@Override
	public List<TrainingExample> readJsonl(Path file) {
		try {
			List<TrainingExample> examples = new ArrayList<>();
			for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
				if (!line.isBlank()) {
					examples.add(objectMapper.readValue(line, TrainingExample.class));
				}
			}
			return examples;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read examples from " + file, e);
		}
	}

	@Override
	public void writeJson(Path file, Object value) {
		ObjectWriter writer = objectMapper.writerWithDefaultPrettyPrinter();
		AtomicFileWriter.write(file, out -> writer.writeValue(out, value));
	}

}
