package org.springaicommunity.corpus.harvester;

import java.nio.file.Path;

/**
 * Thrown when a corpus, partition or checkpoint file cannot be written. Filesystem
 * failures are fatal for the run and are never swallowed by per-unit error isolation.
 */
public class CorpusWriteException extends RuntimeException {

	private final Path path;

	public CorpusWriteException(Path path, Throwable cause) {
		super("Failed to write " + path + ": " + cause.getMessage(), cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
