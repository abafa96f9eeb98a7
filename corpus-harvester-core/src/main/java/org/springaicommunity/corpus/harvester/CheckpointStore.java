package org.springaicommunity.corpus.harvester;

import java.util.Optional;

/**
 * Persistence for synthesis checkpoints. Every save replaces the previous snapshot.
 */
public interface CheckpointStore {

	/**
	 * Persist the whole state.
	 * @param checkpoint state to save
	 * @throws CorpusWriteException if the write fails after one retry
	 */
	void save(Checkpoint checkpoint);

	/**
	 * Load the last saved state.
	 * @return the checkpoint, or empty if none was saved
	 */
	Optional<Checkpoint> load();

}
