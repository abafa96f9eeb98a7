package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Harvests Stack Overflow questions with an accepted answer, one tag at a time.
 *
 * <p>
 * Question and answer bodies arrive as HTML and are converted to Markdown-flavoured text
 * before filtering.
 */
public class StackOverflowHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(StackOverflowHarvestService.class);

	static final int MIN_QUESTION_SCORE = 1;

	static final int MIN_ANSWER_SCORE = 1;

	private final StackExchangeService stackExchange;

	private final PaginatedCollector collector;

	private final QualityFilter prefilter = QualityFilters.stackOverflowPrefilter();

	private final QualityFilter incidentFilter = QualityFilters.incidents();

	public StackOverflowHarvestService(StackExchangeService stackExchange, TargetCatalog targets,
			CorpusRepository repository, HarvestProperties properties) {
		super(targets, repository, properties);
		this.stackExchange = stackExchange;
		this.collector = new PaginatedCollector(properties.getStackMaxPages());
	}

	@Override
	public SourceType getSourceType() {
		return SourceType.STACKOVERFLOW;
	}

	@Override
	protected List<CandidateRecord> harvestUnit(String tech, String tag, HarvestRequest request,
			HarvestContext context) {
		Instant floor = request.minDateInstant();
		int pageSize = properties.getStackPageSize();
		PageSource<StackQuestion> pages = cursor -> stackExchange.listQuestions(tag, floor.getEpochSecond(),
				pageSize, Page.pageNumber(cursor));
		Predicate<StackQuestion> keep = DateFloor.onOrAfter(floor, StackQuestion::createdAt);
		keep = keep.and(StackQuestion::hasAcceptedAnswer).and(q -> q.score() >= MIN_QUESTION_SCORE);

		List<CandidateRecord> kept = new ArrayList<>();
		collector.collect(pages, request.capOr(properties.getMaxQuestionsPerTag()), keep, context)
			.forEach(question -> settle(evaluate(question, tech, tag), kept, context));
		logger.debug("Tag {}: {} questions kept", tag, kept.size());
		return kept;
	}

	private ItemResult<CandidateRecord> evaluate(StackQuestion question, String tech, String tag) {
		Optional<StackAnswer> answer = question.embeddedAcceptedAnswer();
		if (answer.isEmpty() && question.acceptedAnswerId() != null) {
			try {
				answer = stackExchange.getAnswer(question.acceptedAnswerId());
			}
			catch (FetchException e) {
				logger.warn("Skipping answer {} of question {}: {}", question.acceptedAnswerId(),
						question.questionId(), e.getMessage());
				return ItemResult.failed(e.getMessage());
			}
		}
		if (answer.isEmpty()) {
			return ItemResult.skipped(RejectReason.NO_SOLUTION);
		}
		if (answer.get().score() < MIN_ANSWER_SCORE) {
			return ItemResult.skipped(RejectReason.LOW_SCORE);
		}

		String site = stackExchange.getSite();
		CandidateRecord candidate = new CandidateRecord(
				CandidateRecord.key(SourceType.STACKOVERFLOW, site, question.questionId()), tech, question.title(),
				TextCleaner.cleanHtml(question.body()), TextCleaner.cleanHtml(answer.get().body()), List.of(tag),
				new Provenance(SourceType.STACKOVERFLOW, tag, question.link(), question.createdAt()),
				question.score());
		ItemResult<CandidateRecord> screened = screen(candidate, prefilter);
		if (!screened.isAccepted()) {
			return screened;
		}
		return screen(candidate, incidentFilter);
	}

}
