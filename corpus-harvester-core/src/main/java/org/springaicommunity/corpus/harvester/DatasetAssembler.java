package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Builds the final train/eval dataset from curated records and synthetic examples.
 *
 * <p>
 * The partition is a deterministic function of the seed and the input order: the same
 * inputs always produce byte-identical {@code train.jsonl} and {@code eval.jsonl}.
 */
public class DatasetAssembler {

	private static final Logger logger = LoggerFactory.getLogger(DatasetAssembler.class);

	public static final String TRAIN_FILE = "train.jsonl";

	public static final String EVAL_FILE = "eval.jsonl";

	public static final String STATS_FILE = "preprocessing_stats.json";

	private final CorpusRepository repository;

	private final ExampleFormatter formatter;

	public DatasetAssembler(CorpusRepository repository, ExampleFormatter formatter) {
		this.repository = repository;
		this.formatter = formatter;
	}

	/**
	 * Turn raw corpora into training examples, keeping the first occurrence of every
	 * natural key across corpora.
	 * @param corpora raw corpora in source order
	 * @return formatted unique examples
	 */
	public List<TrainingExample> curate(List<RawCorpus> corpora) {
		List<List<CandidateRecord>> sources = new ArrayList<>();
		for (RawCorpus corpus : corpora) {
			sources.add(corpus.examples());
		}
		DeduplicationResult<CandidateRecord> unique = Deduplicator.merge(sources, CandidateRecord::naturalKey);
		if (unique.duplicatesRemoved() > 0) {
			logger.info("Removed {} duplicate records across sources", unique.duplicatesRemoved());
		}
		return unique.unique().stream().map(formatter::format).toList();
	}

	/**
	 * Concatenate curated then synthetic examples, shuffle with the seed and cut at
	 * {@code floor(N * trainRatio)}.
	 * @param curated curated examples
	 * @param synthetic synthetic examples
	 * @param trainRatio fraction placed in the training partition, in [0, 1]
	 * @param seed shuffle seed
	 * @return the partition
	 * @throws IllegalArgumentException if a natural key occurs twice or the ratio is out
	 * of range
	 */
	public CorpusPartition assemble(List<TrainingExample> curated, List<TrainingExample> synthetic, double trainRatio,
			long seed) {
		if (trainRatio < 0.0 || trainRatio > 1.0) {
			throw new IllegalArgumentException("trainRatio must be between 0 and 1: " + trainRatio);
		}
		List<TrainingExample> all = new ArrayList<>(curated.size() + synthetic.size());
		all.addAll(curated);
		all.addAll(synthetic);

		Set<String> keys = new HashSet<>();
		for (TrainingExample example : all) {
			if (!keys.add(example.naturalKey())) {
				throw new IllegalArgumentException("Duplicate example key: " + example.naturalKey());
			}
		}

		Collections.shuffle(all, new Random(seed));
		int cut = (int) Math.floor(all.size() * trainRatio);
		CorpusPartition partition = new CorpusPartition(all.subList(0, cut), all.subList(cut, all.size()));
		logger.info("Assembled {} examples: {} train, {} eval", all.size(), partition.train().size(),
				partition.eval().size());
		return partition;
	}

	/**
	 * Write the partition and its statistics.
	 * @param partition the partition
	 * @param outputDir target directory
	 * @param sourceCounts number of input examples per source
	 */
	public void writePartition(CorpusPartition partition, Path outputDir, Map<String, Integer> sourceCounts) {
		repository.writeJsonl(outputDir.resolve(TRAIN_FILE), partition.train());
		repository.writeJsonl(outputDir.resolve(EVAL_FILE), partition.eval());

		Map<String, Integer> techDistribution = new LinkedHashMap<>();
		for (TrainingExample example : partition.train()) {
			techDistribution.merge(example.metaString(TrainingExample.TECH), 1, Integer::sum);
		}

		Map<String, Object> stats = new LinkedHashMap<>();
		stats.put("processed_at", Instant.now().toString());
		stats.put("source_counts", sourceCounts);
		stats.put("total", partition.size());
		stats.put("train_count", partition.train().size());
		stats.put("eval_count", partition.eval().size());
		stats.put("tech_distribution", techDistribution);
		repository.writeJson(outputDir.resolve(STATS_FILE), stats);
	}

	/**
	 * Count examples by their {@code source} metadata.
	 * @param examples examples
	 * @return source to count, in first-seen order
	 */
	public static Map<String, Integer> countBySource(List<TrainingExample> examples) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (TrainingExample example : examples) {
			counts.merge(example.metaString(TrainingExample.SOURCE), 1, Integer::sum);
		}
		return counts;
	}

}
