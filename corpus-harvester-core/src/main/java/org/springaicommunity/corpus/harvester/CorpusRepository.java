package org.springaicommunity.corpus.harvester;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for raw corpora, dataset partitions and statistics files.
 *
 * <p>
 * Every write replaces the whole file. Implementations throw
 * {@link CorpusWriteException} when a write fails.
 */
public interface CorpusRepository {

	/**
	 * Write a raw corpus envelope.
	 * @param file target file
	 * @param corpus corpus to write
	 */
	void saveRawCorpus(Path file, RawCorpus corpus);

	/**
	 * Read a raw corpus envelope.
	 * @param file corpus file
	 * @return the corpus, or empty if the file does not exist
	 */
	Optional<RawCorpus> loadRawCorpus(Path file);

	/**
	 * Write examples as JSON Lines, one compact object per line.
	 * @param file target file
	 * @param examples examples in output order
	 */
	void writeJsonl(Path file, List<TrainingExample> examples);

	/**
	 * Read a JSON Lines file of examples.
	 * @param file source file
	 * @return examples in file order
	 */
	List<TrainingExample> readJsonl(Path file);

	/**
	 * Write any value as pretty-printed JSON.
	 * @param file target file
	 * @param value value to serialize
	 */
	void writeJson(Path file, Object value);

}
