package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a whole file through a temporary sibling and an atomic rename, so readers only
 * ever see the previous or the new complete content. A failed write is retried once
 * before surfacing as {@link CorpusWriteException}.
 */
public final class AtomicFileWriter {

	private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

	private AtomicFileWriter() {
	}

	/**
	 * Content producer for {@link #write(Path, Content)}.
	 */
	@FunctionalInterface
	public interface Content {

		void writeTo(OutputStream out) throws IOException;

	}

	/**
	 * Replace the target file with the produced content.
	 * @param target file to replace
	 * @param content writes the complete new content
	 * @throws CorpusWriteException if both attempts fail
	 */
	public static void write(Path target, Content content) {
		try {
			writeOnce(target, content);
		}
		catch (IOException first) {
			logger.warn("Write of {} failed ({}), retrying once", target, first.getMessage());
			try {
				writeOnce(target, content);
			}
			catch (IOException second) {
				second.addSuppressed(first);
				throw new CorpusWriteException(target, second);
			}
		}
	}

	private static void writeOnce(Path target, Content content) throws IOException {
		Path absolute = target.toAbsolutePath();
		Path directory = absolute.getParent();
		Files.createDirectories(directory);
		Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
		try {
			try (OutputStream out = Files.newOutputStream(temp)) {
				content.writeTo(out);
			}
			try {
				Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				logger.debug("Atomic move not supported for {}, falling back to replace", absolute);
				Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(temp);
		}
	}

}
