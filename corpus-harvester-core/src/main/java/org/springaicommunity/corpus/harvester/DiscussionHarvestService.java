package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Harvests answered GitHub discussions through the GraphQL API.
 *
 * <p>
 * The solution is the marked answer, else a comment flagged as the answer, else the
 * longest substantial comment.
 */
public class DiscussionHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(DiscussionHarvestService.class);

	static final int MIN_ANSWER_LENGTH = 50;

	static final int HELPFUL_COMMENT_LENGTH = 100;

	private final GraphQLService graphQLService;

	private final PaginatedCollector collector;

	private final QualityFilter prefilter = QualityFilters.discussionPrefilter();

	private final QualityFilter incidentFilter = QualityFilters.incidents();

	public DiscussionHarvestService(GraphQLService graphQLService, TargetCatalog targets,
			CorpusRepository repository, HarvestProperties properties) {
		super(targets, repository, properties);
		this.graphQLService = graphQLService;
		this.collector = new PaginatedCollector(properties.getMaxPages());
	}

	@Override
	public SourceType getSourceType() {
		return SourceType.GITHUB_DISCUSSIONS;
	}

	@Override
	protected List<CandidateRecord> harvestUnit(String tech, String repo, HarvestRequest request,
			HarvestContext context) {
		String[] ownerAndName = repo.split("/", 2);
		if (ownerAndName.length != 2) {
			throw new IllegalArgumentException("Repository must be in owner/repo format: " + repo);
		}
		Instant floor = request.minDateInstant();
		int pageSize = properties.getDiscussionPageSize();
		PageSource<Discussion> pages = cursor -> graphQLService.listDiscussions(ownerAndName[0], ownerAndName[1],
				pageSize, cursor);

		List<CandidateRecord> kept = new ArrayList<>();
		collector
			.collect(pages, request.capOr(properties.getMaxDiscussionsPerRepo()),
					DateFloor.onOrAfter(floor, Discussion::createdAt), context)
			.forEach(discussion -> settle(evaluate(discussion, tech, repo), kept, context));
		logger.debug("{}: {} answered discussions kept", repo, kept.size());
		return kept;
	}

	private ItemResult<CandidateRecord> evaluate(Discussion discussion, String tech, String repo) {
		CandidateRecord draft = new CandidateRecord(
				CandidateRecord.key(SourceType.GITHUB_DISCUSSIONS, repo, discussion.number()), tech,
				discussion.title(), TextCleaner.clean(discussion.body()), "", List.of(discussion.category()),
				new Provenance(SourceType.GITHUB_DISCUSSIONS, repo, discussion.url(), discussion.createdAt()),
				discussion.upvotes());
		ItemResult<CandidateRecord> screened = screen(draft, prefilter);
		if (!screened.isAccepted()) {
			return screened;
		}

		String answer = selectAnswer(discussion);
		if (answer == null || answer.length() < MIN_ANSWER_LENGTH) {
			return ItemResult.skipped(RejectReason.NO_SOLUTION);
		}
		return screen(draft.withSolution(TextCleaner.clean(answer)), incidentFilter);
	}

	static @Nullable String selectAnswer(Discussion discussion) {
		if (discussion.answer() != null && !discussion.answer().isEmpty()) {
			return discussion.answer();
		}
		for (DiscussionComment comment : discussion.comments()) {
			if (comment.isAnswer() && !comment.body().isEmpty()) {
				return comment.body();
			}
		}
		return discussion.comments()
			.stream()
			.map(DiscussionComment::body)
			.filter(body -> body.length() > HELPFUL_COMMENT_LENGTH)
			.max(Comparator.comparingInt(String::length))
			.orElse(null);
	}

}
