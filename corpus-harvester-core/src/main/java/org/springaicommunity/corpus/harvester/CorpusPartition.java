package org.springaicommunity.corpus.harvester;

import java.util.List;

/**
 * Train/eval split of the final dataset.
 *
 * @param train training examples in shuffled order
 * @param eval evaluation examples in shuffled order
 */
public record CorpusPartition(List<TrainingExample> train, List<TrainingExample> eval) {

	public CorpusPartition {
		train = List.copyOf(train);
		eval = List.copyOf(eval);
	}

	public int size() {
		return train.size() + eval.size();
	}

}
