package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores the checkpoint as one pretty-printed JSON file, replaced atomically on every
 * save.
 */
public class FileCheckpointStore implements CheckpointStore {

	private static final Logger logger = LoggerFactory.getLogger(FileCheckpointStore.class);

	private final Path file;

	private final ObjectMapper objectMapper;

	public FileCheckpointStore(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	@Override
	public void save(Checkpoint checkpoint) {
		ObjectWriter writer = objectMapper.writerWithDefaultPrettyPrinter();
		AtomicFileWriter.write(file, out -> writer.writeValue(out, checkpoint));
		logger.info("Checkpoint saved: {} examples to {}", checkpoint.examples().size(), file);
	}

	@Override
	public Optional<Checkpoint> load() {
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			Checkpoint checkpoint = objectMapper.readValue(file.toFile(), Checkpoint.class);
			logger.info("Loaded checkpoint with {} examples from {}", checkpoint.examples().size(), file);
			return Optional.of(checkpoint);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read checkpoint " + file, e);
		}
	}

}
