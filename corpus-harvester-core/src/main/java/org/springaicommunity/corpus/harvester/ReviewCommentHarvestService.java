package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.springaicommunity.corpus.harvester.QualityPredicates.*;

/**
 * Harvests inline review comments of merged pull requests, pairing the reviewed diff
 * hunk with the reviewer's comment.
 */
public class ReviewCommentHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(ReviewCommentHarvestService.class);

	/**
	 * Bounds on the raw comment, checked before cleaning.
	 */
	static final QualityFilter RAW_COMMENT_FILTER = new QualityFilter(
			List.of(minLength(TextField.SOLUTION, 50, RejectReason.SOLUTION_TOO_SHORT),
					maxLength(TextField.SOLUTION, 2000, RejectReason.SOLUTION_TOO_LONG)));

	private final RestService restService;

	private final PaginatedCollector collector;

	private final QualityFilter reviewFilter = QualityFilters.codeReview();

	public ReviewCommentHarvestService(RestService restService, TargetCatalog targets, CorpusRepository repository,
			HarvestProperties properties) {
		super(targets, repository, properties);
		this.restService = restService;
		this.collector = new PaginatedCollector(properties.getMaxPages());
	}

	@Override
	public SourceType getSourceType() {
		return SourceType.GITHUB_REVIEWS;
	}

	@Override
	protected List<CandidateRecord> harvestUnit(String language, String repo, HarvestRequest request,
			HarvestContext context) {
		Instant floor = request.minDateInstant();
		int perPage = properties.getPerPage();
		PageSource<PullRequestSummary> pulls = cursor -> restService.listClosedPullRequests(repo, perPage,
				Page.pageNumber(cursor));
		Predicate<PullRequestSummary> keep = DateFloor.onOrAfter(floor, PullRequestSummary::createdAt);
		keep = keep.and(PullRequestSummary::isMerged);

		List<PullRequestSummary> merged = collector
			.collect(pulls, request.capOr(properties.getMaxPullRequestsPerRepo()), keep, context)
			.toList();
		logger.info("{}: {} merged pull requests", repo, merged.size());

		List<CandidateRecord> kept = new ArrayList<>();
		for (PullRequestSummary pull : merged) {
			PageSource<ReviewComment> comments = cursor -> restService.listReviewComments(repo, pull.number(),
					perPage, Page.pageNumber(cursor));
			try {
				collector.collect(comments, Integer.MAX_VALUE, comment -> true, context)
					.forEach(comment -> settle(evaluate(comment, language, repo), kept, context));
			}
			catch (FetchException e) {
				logger.warn("Skipping remaining review comments of {}#{}: {}", repo, pull.number(), e.getMessage());
				context.recordOutcome(ItemResult.failed(e.getMessage()));
			}
		}
		return kept;
	}

	private ItemResult<CandidateRecord> evaluate(ReviewComment comment, String language, String repo) {
		CandidateRecord raw = toCandidate(comment, language, repo, comment.diffHunk(), comment.body());
		ItemResult<CandidateRecord> screened = screen(raw, RAW_COMMENT_FILTER);
		if (!screened.isAccepted()) {
			return screened;
		}
		CandidateRecord cleaned = toCandidate(comment, language, repo, TextCleaner.cleanDiffHunk(comment.diffHunk()),
				TextCleaner.cleanReviewComment(comment.body()));
		return screen(cleaned, reviewFilter);
	}

	private static CandidateRecord toCandidate(ReviewComment comment, String language, String repo, String code,
			String review) {
		return new CandidateRecord(CandidateRecord.key(SourceType.GITHUB_REVIEWS, repo, comment.id()), language,
				comment.path(), code, review, List.of(),
				new Provenance(SourceType.GITHUB_REVIEWS, repo, comment.url(), comment.createdAt()), 0);
	}

}
